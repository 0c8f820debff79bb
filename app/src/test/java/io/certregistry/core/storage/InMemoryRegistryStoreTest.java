package io.certregistry.core.storage;

import io.certregistry.core.protocol.CertHash;
import io.certregistry.core.registry.CertificateRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRegistryStoreTest {

    private static final CertHash HASH = CertHash.fromHex("42".repeat(32));

    @Test
    void insertGetAndRevoke() {
        InMemoryRegistryStore store = new InMemoryRegistryStore();
        CertificateRecord record = new CertificateRecord("M-1", HASH, null, "ab".repeat(20), 100L, false);
        store.apply(new RegistryBatch().insertCertificate(record));

        assertEquals(Optional.of(record), store.getCertificate("M-1"));
        assertEquals("", store.getCertificate("M-1").orElseThrow().ipfsCid());
        assertEquals(1, store.certificateCount());

        store.apply(new RegistryBatch().markRevoked("M-1"));
        assertTrue(store.getCertificate("M-1").orElseThrow().revoked());
        assertThrows(IllegalStateException.class, () -> store.apply(new RegistryBatch().insertCertificate(record)));
        assertThrows(IllegalStateException.class, () -> store.apply(new RegistryBatch().markRevoked("missing")));
    }

    @Test
    void issuerFlagsAndSortedListing() {
        InMemoryRegistryStore store = new InMemoryRegistryStore();
        store.apply(new RegistryBatch()
                .setIssuer("cc".repeat(20), true)
                .setIssuer("aa".repeat(20), true)
                .setIssuer("bb".repeat(20), false));

        assertEquals(List.of("aa".repeat(20), "cc".repeat(20)), store.authorizedIssuers());
        assertFalse(store.isIssuer("bb".repeat(20)));
        assertFalse(store.isIssuer("dd".repeat(20)));
    }

    @Test
    void ownerAndRegistryIdAreSetOnce() {
        InMemoryRegistryStore store = new InMemoryRegistryStore();
        assertTrue(store.getOwner().isEmpty());
        store.apply(new RegistryBatch().setOwner("aa".repeat(20)).setRegistryId("reg-1"));
        store.apply(new RegistryBatch().setOwner("aa".repeat(20)));
        assertThrows(IllegalStateException.class, () -> store.apply(new RegistryBatch().setOwner("bb".repeat(20))));
        assertThrows(IllegalStateException.class, () -> store.apply(new RegistryBatch().setRegistryId("reg-2")));
        assertEquals(Optional.of("aa".repeat(20)), store.getOwner());
        assertEquals(Optional.of("reg-1"), store.getRegistryId());
    }

    @Test
    void noncesDefaultToZero() {
        InMemoryRegistryStore store = new InMemoryRegistryStore();
        assertEquals(0, store.getNonce("aa".repeat(20)));
        store.apply(new RegistryBatch().setNonce("aa".repeat(20), 7));
        assertEquals(7, store.getNonce("aa".repeat(20)));
    }

    @Test
    void refusedBatchWritesNothing() {
        InMemoryRegistryStore store = new InMemoryRegistryStore();
        CertificateRecord record = new CertificateRecord("M-1", HASH, "", "ab".repeat(20), 100L, false);
        store.apply(new RegistryBatch().insertCertificate(record));

        RegistryBatch batch = new RegistryBatch()
                .insertCertificate(new CertificateRecord("M-2", HASH, "", "ab".repeat(20), 101L, false))
                .insertCertificate(record)
                .setIssuer("cc".repeat(20), true)
                .setNonce("ab".repeat(20), 1);
        assertThrows(IllegalStateException.class, () -> store.apply(batch));

        assertTrue(store.getCertificate("M-2").isEmpty());
        assertFalse(store.isIssuer("cc".repeat(20)));
        assertEquals(0, store.getNonce("ab".repeat(20)));
    }
}
