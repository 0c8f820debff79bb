package io.certregistry.core.storage;

import io.certregistry.core.registry.CertificateRecord;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent RegistryStore using RocksDB.
 *
 * Layout (column families):
 *  - "certificates" : key = certId (UTF-8),  val = CertificateRecordCodec bytes
 *  - "issuers"      : key = address (UTF-8), val = 1 byte flag
 *  - "nonces"       : key = address (UTF-8), val = next nonce (8, big-endian)
 *  - "meta"         : key = "owner",         val = owner address (UTF-8)
 *                     key = "registryId",    val = registry identifier (UTF-8)
 *
 * Every write goes through one WriteBatch per {@link #apply} call.
 */
public final class RocksDBRegistryStore implements RegistryStore, AutoCloseable {

    static {
        RocksDB.loadLibrary();
    }

    private static final byte[] OWNER_KEY = "owner".getBytes(StandardCharsets.UTF_8);
    private static final byte[] REGISTRY_ID_KEY = "registryId".getBytes(StandardCharsets.UTF_8);

    private final RocksDB db;
    private final DBOptions dbOptions;
    private final List<ColumnFamilyHandle> handles;
    private final ColumnFamilyHandle cfCertificates;
    private final ColumnFamilyHandle cfIssuers;
    private final ColumnFamilyHandle cfNonces;
    private final ColumnFamilyHandle cfMeta;
    private final WriteOptions writeOptions;

    private RocksDBRegistryStore(RocksDB db, DBOptions dbOptions, List<ColumnFamilyHandle> handles) {
        this.db = db;
        this.dbOptions = dbOptions;
        this.handles = handles;
        // index 0 is the default CF, unused
        this.cfCertificates = handles.get(1);
        this.cfIssuers = handles.get(2);
        this.cfNonces = handles.get(3);
        this.cfMeta = handles.get(4);
        this.writeOptions = new WriteOptions().setSync(true);
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBRegistryStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        List<ColumnFamilyDescriptor> descriptors = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor("certificates".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("issuers".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("nonces".getBytes(StandardCharsets.UTF_8)),
                new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8))
        );
        List<ColumnFamilyHandle> handles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir, descriptors, handles);
            return new RocksDBRegistryStore(db, dbOpts, handles);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public synchronized Optional<CertificateRecord> getCertificate(String certId) {
        if (certId == null) return Optional.empty();
        try {
            byte[] body = db.get(cfCertificates, key(certId));
            return body == null ? Optional.empty() : Optional.of(CertificateRecordCodec.fromBytes(body));
        } catch (RocksDBException e) {
            throw new IllegalStateException("getCertificate failed", e);
        }
    }

    @Override
    public synchronized long certificateCount() {
        try (RocksIterator it = db.newIterator(cfCertificates)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public synchronized boolean isIssuer(String address) {
        if (address == null) return false;
        try {
            byte[] flag = db.get(cfIssuers, key(address));
            return flag != null && flag.length == 1 && flag[0] == 1;
        } catch (RocksDBException e) {
            throw new IllegalStateException("isIssuer failed", e);
        }
    }

    @Override
    public synchronized List<String> authorizedIssuers() {
        List<String> out = new ArrayList<>();
        // RocksDB iterates keys in byte order, which is sorted for ASCII hex addresses
        try (RocksIterator it = db.newIterator(cfIssuers)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                byte[] flag = it.value();
                if (flag.length == 1 && flag[0] == 1) {
                    out.add(new String(it.key(), StandardCharsets.UTF_8));
                }
            }
        }
        return out;
    }

    @Override
    public synchronized Optional<String> getOwner() {
        return readMeta(OWNER_KEY);
    }

    @Override
    public synchronized Optional<String> getRegistryId() {
        return readMeta(REGISTRY_ID_KEY);
    }

    @Override
    public synchronized long getNonce(String address) {
        if (address == null) return 0L;
        try {
            byte[] v = db.get(cfNonces, key(address));
            return v == null ? 0L : ByteBuffer.wrap(v).getLong();
        } catch (RocksDBException e) {
            throw new IllegalStateException("getNonce failed", e);
        }
    }

    @Override
    public synchronized void apply(RegistryBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        try (WriteBatch wb = new WriteBatch()) {
            Map<String, CertificateRecord> staged = new HashMap<>();
            for (CertificateRecord record : batch.inserts()) {
                if (staged.containsKey(record.certId()) || db.get(cfCertificates, key(record.certId())) != null) {
                    throw new IllegalStateException("Certificate already stored: " + record.certId());
                }
                staged.put(record.certId(), record);
            }
            for (String certId : batch.revocations()) {
                CertificateRecord current = staged.get(certId);
                if (current == null) {
                    byte[] body = certId == null ? null : db.get(cfCertificates, key(certId));
                    if (body == null) {
                        throw new IllegalStateException("No certificate stored under " + certId);
                    }
                    current = CertificateRecordCodec.fromBytes(body);
                }
                staged.put(certId, current.asRevoked());
            }
            checkMeta(OWNER_KEY, batch.owner(), "Owner");
            checkMeta(REGISTRY_ID_KEY, batch.registryId(), "Registry id");

            for (CertificateRecord record : staged.values()) {
                wb.put(cfCertificates, key(record.certId()), CertificateRecordCodec.toBytes(record));
            }
            for (Map.Entry<String, Boolean> e : batch.issuers().entrySet()) {
                wb.put(cfIssuers, key(e.getKey()), new byte[] {(byte) (e.getValue() ? 1 : 0)});
            }
            for (Map.Entry<String, Long> e : batch.nonces().entrySet()) {
                wb.put(cfNonces, key(e.getKey()), ByteBuffer.allocate(8).putLong(e.getValue()).array());
            }
            if (batch.owner() != null) {
                wb.put(cfMeta, OWNER_KEY, key(batch.owner()));
            }
            if (batch.registryId() != null) {
                wb.put(cfMeta, REGISTRY_ID_KEY, key(batch.registryId()));
            }
            db.write(writeOptions, wb);
        } catch (RocksDBException e) {
            throw new IllegalStateException("apply failed", e);
        }
    }

    private Optional<String> readMeta(byte[] metaKey) {
        try {
            byte[] value = db.get(cfMeta, metaKey);
            return value == null ? Optional.empty() : Optional.of(new String(value, StandardCharsets.UTF_8));
        } catch (RocksDBException e) {
            throw new IllegalStateException("meta read failed", e);
        }
    }

    private void checkMeta(byte[] metaKey, String wanted, String label) {
        if (wanted == null) {
            return;
        }
        Optional<String> existing = readMeta(metaKey);
        if (existing.isPresent() && !existing.get().equals(wanted)) {
            throw new IllegalStateException(label + " already set to " + existing.get());
        }
    }

    @Override
    public synchronized void close() {
        // handles before the DB, options last
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        db.close();
        writeOptions.close();
        dbOptions.close();
    }

    private static byte[] key(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
