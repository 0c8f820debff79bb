package io.certregistry.core.storage;

import io.certregistry.core.protocol.CertHash;
import io.certregistry.core.registry.CertificateRecord;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Binary layout of a stored record:
 * version(4) | certId | hash(32) | ipfsCid | issuedBy | issuedAt(8) | revoked(1),
 * strings length-prefixed (4 bytes, big-endian) UTF-8.
 */
public final class CertificateRecordCodec {
    static final int VERSION = 1;

    private CertificateRecordCodec() {}

    public static byte[] toBytes(CertificateRecord record) {
        byte[] id = record.certId().getBytes(StandardCharsets.UTF_8);
        byte[] cid = record.ipfsCid().getBytes(StandardCharsets.UTF_8);
        byte[] issuer = record.issuedBy().getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(4
                + 4 + id.length
                + CertHash.LENGTH
                + 4 + cid.length
                + 4 + issuer.length
                + 8 + 1);
        buf.putInt(VERSION);
        putBytes(buf, id);
        buf.put(record.certHash().bytes());
        putBytes(buf, cid);
        putBytes(buf, issuer);
        buf.putLong(record.issuedAt());
        buf.put((byte) (record.revoked() ? 1 : 0));
        return buf.array();
    }

    public static CertificateRecord fromBytes(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            int version = buf.getInt();
            if (version != VERSION) {
                throw new IllegalArgumentException("Unsupported record version " + version);
            }
            String certId = readString(buf);
            byte[] hash = new byte[CertHash.LENGTH];
            buf.get(hash);
            String ipfsCid = readString(buf);
            String issuedBy = readString(buf);
            long issuedAt = buf.getLong();
            boolean revoked = buf.get() != 0;
            return new CertificateRecord(certId, new CertHash(hash), ipfsCid, issuedBy, issuedAt, revoked);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed certificate record bytes", ex);
        }
    }

    private static void putBytes(ByteBuffer b, byte[] data) {
        b.putInt(data.length);
        b.put(data);
    }

    private static String readString(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) {
            throw new IllegalArgumentException("Bad length: " + len + " (remaining=" + b.remaining() + ")");
        }
        byte[] out = new byte[len];
        b.get(out);
        return new String(out, StandardCharsets.UTF_8);
    }
}
