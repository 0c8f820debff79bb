package io.certregistry.core.registry;

import io.certregistry.core.event.RegistryEvent;
import io.certregistry.core.protocol.Address;
import io.certregistry.core.protocol.CertHash;
import io.certregistry.core.storage.InMemoryRegistryStore;
import io.certregistry.core.storage.RegistryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CertificateRegistryTest {

    private static final String OWNER = "0a".repeat(20);
    private static final String ISSUER = "0b".repeat(20);
    private static final String OTHER = "0c".repeat(20);
    private static final String STRANGER = "0d".repeat(20);
    private static final CertHash H1 = CertHash.fromHex("11".repeat(32));
    private static final CertHash H2 = CertHash.fromHex("22".repeat(32));
    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private final List<RegistryEvent> events = new ArrayList<>();
    private RegistryStore store;
    private CertificateRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryRegistryStore();
        registry = new CertificateRegistry(store, OWNER, Clock.fixed(NOW, ZoneOffset.UTC), events::add);
    }

    @Test
    void ownerIsInitialIssuerAndAnnounced() {
        assertEquals(OWNER, registry.owner());
        assertTrue(registry.isIssuer(OWNER));
        assertEquals(List.of(OWNER), registry.issuers());
        assertEquals(List.of(new RegistryEvent.IssuerAdded(OWNER)), events);
    }

    @Test
    void zeroOrMalformedOwnerIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new CertificateRegistry(new InMemoryRegistryStore(), Address.ZERO, Clock.systemUTC(), null));
        assertThrows(IllegalArgumentException.class,
                () -> new CertificateRegistry(new InMemoryRegistryStore(), "not-an-address", Clock.systemUTC(), null));
    }

    @Test
    void reopeningWithAnotherOwnerFails() {
        assertThrows(IllegalStateException.class,
                () -> new CertificateRegistry(store, STRANGER, Clock.systemUTC(), null));
        CertificateRegistry same = new CertificateRegistry(store, OWNER.toUpperCase(), Clock.systemUTC(), null);
        assertEquals(OWNER, same.owner());
        assertEquals(registry.registryId(), same.registryId());
        assertThrows(IllegalStateException.class,
                () -> new CertificateRegistry(store, OWNER, "another-registry", Clock.systemUTC(), null));
    }

    @Test
    void ownerSetupIsOneWriteWithRegistryId() {
        assertEquals(OWNER, store.getOwner().orElseThrow());
        assertEquals(registry.registryId(), store.getRegistryId().orElseThrow());
        assertTrue(store.isIssuer(OWNER));

        CertificateRegistry named = new CertificateRegistry(new InMemoryRegistryStore(), OWNER, "campus",
                Clock.systemUTC(), null);
        assertEquals("campus", named.registryId());
    }

    @Test
    void ownerIssuesVerifiesAndRevokes() {
        events.clear();
        CertificateRecord issued = registry.issueCertificate(OWNER, "A-1", H1, "ipfs://QmA1");

        assertEquals(new CertificateRecord("A-1", H1, "ipfs://QmA1", OWNER, NOW.getEpochSecond(), false), issued);
        assertTrue(registry.verifyCertificate("A-1", H1));
        assertFalse(registry.verifyCertificate("A-1", H2));
        assertEquals(VerificationResult.HASH_MISMATCH, registry.diagnoseCertificate("A-1", H2));

        CertificateRecord revoked = registry.revokeCertificate(OWNER, "A-1");
        assertTrue(revoked.revoked());
        assertFalse(registry.verifyCertificate("A-1", H1));
        assertEquals(VerificationResult.REVOKED, registry.diagnoseCertificate("A-1", H1));

        CertificateRecord fetched = registry.getCertificate("A-1");
        assertEquals(H1, fetched.certHash());
        assertEquals("ipfs://QmA1", fetched.ipfsCid());
        assertEquals(OWNER, fetched.issuedBy());
        assertEquals(NOW.getEpochSecond(), fetched.issuedAt());
        assertTrue(fetched.revoked());
        assertEquals(CertificateStatus.REVOKED, registry.status("A-1"));

        assertEquals(List.of(
                new RegistryEvent.CertificateIssued("A-1", H1, "ipfs://QmA1", OWNER),
                new RegistryEvent.CertificateRevoked("A-1", OWNER)), events);
    }

    @Test
    void onlyIssuerOrOwnerMayRevoke() {
        registry.addIssuer(OWNER, ISSUER);
        registry.addIssuer(OWNER, OTHER);
        registry.issueCertificate(ISSUER, "B-2", H2, "");

        RegistryException denied = assertThrows(RegistryException.class, () -> registry.revokeCertificate(OTHER, "B-2"));
        assertEquals(RegistryException.Reason.AUTHORIZATION, denied.reason());
        assertEquals(CertificateStatus.ACTIVE, registry.status("B-2"));

        registry.revokeCertificate(OWNER, "B-2");
        assertEquals(CertificateStatus.REVOKED, registry.status("B-2"));
    }

    @Test
    void removedIssuerCanStillRevokeOwnRecordsButNotIssue() {
        registry.addIssuer(OWNER, ISSUER);
        registry.issueCertificate(ISSUER, "C-1", H1, null);
        registry.removeIssuer(OWNER, ISSUER);

        assertFalse(registry.isIssuer(ISSUER));
        assertReason(RegistryException.Reason.AUTHORIZATION, () -> registry.issueCertificate(ISSUER, "C-2", H2, ""));
        registry.revokeCertificate(ISSUER, "C-1");
        assertTrue(registry.getCertificate("C-1").revoked());
        assertTrue(registry.issuers().contains(OWNER));
    }

    @Test
    void issueRejectsBadInputInOrder() {
        assertReason(RegistryException.Reason.AUTHORIZATION, () -> registry.issueCertificate(STRANGER, "", CertHash.ZERO, ""));
        assertReason(RegistryException.Reason.INVALID_ARGUMENT, () -> registry.issueCertificate(OWNER, "", H1, ""));
        assertReason(RegistryException.Reason.INVALID_ARGUMENT, () -> registry.issueCertificate(OWNER, "X", CertHash.ZERO, ""));
        assertReason(RegistryException.Reason.INVALID_ARGUMENT, () -> registry.issueCertificate(OWNER, "X", null, ""));
        assertEquals(0, registry.certificateCount());
    }

    @Test
    void duplicateIdentifierIsRejectedAndOriginalKept() {
        registry.issueCertificate(OWNER, "D-1", H1, "first");
        registry.revokeCertificate(OWNER, "D-1");

        assertReason(RegistryException.Reason.ALREADY_EXISTS, () -> registry.issueCertificate(OWNER, "D-1", H2, "second"));
        CertificateRecord kept = registry.getCertificate("D-1");
        assertEquals(H1, kept.certHash());
        assertEquals("first", kept.ipfsCid());
        assertTrue(kept.revoked());
    }

    @Test
    void revokeFailures() {
        assertReason(RegistryException.Reason.NOT_FOUND, () -> registry.revokeCertificate(OWNER, "missing"));
        registry.issueCertificate(OWNER, "E-1", H1, "");
        registry.revokeCertificate(OWNER, "E-1");
        events.clear();

        assertReason(RegistryException.Reason.ALREADY_REVOKED, () -> registry.revokeCertificate(OWNER, "E-1"));
        assertTrue(events.isEmpty());
    }

    @Test
    void issuerManagementIsOwnerOnly() {
        registry.addIssuer(OWNER, ISSUER);
        assertReason(RegistryException.Reason.AUTHORIZATION, () -> registry.addIssuer(ISSUER, OTHER));
        assertReason(RegistryException.Reason.AUTHORIZATION, () -> registry.removeIssuer(ISSUER, OWNER));
        assertTrue(registry.isIssuer(OWNER));
        assertReason(RegistryException.Reason.INVALID_ARGUMENT, () -> registry.addIssuer(OWNER, Address.ZERO));
        assertReason(RegistryException.Reason.INVALID_ARGUMENT, () -> registry.addIssuer(OWNER, "short"));
        assertFalse(registry.isIssuer(OTHER));
    }

    @Test
    void addAndRemoveAreIdempotentButStillEmit() {
        events.clear();
        registry.addIssuer(OWNER, ISSUER);
        registry.addIssuer(OWNER, ISSUER);
        registry.removeIssuer(OWNER, OTHER);

        assertTrue(registry.isIssuer(ISSUER));
        assertFalse(registry.isIssuer(OTHER));
        assertEquals(List.of(
                new RegistryEvent.IssuerAdded(ISSUER),
                new RegistryEvent.IssuerAdded(ISSUER),
                new RegistryEvent.IssuerRemoved(OTHER)), events);
    }

    @Test
    void ownerCanRemoveItselfAndLoseIssuingRights() {
        registry.removeIssuer(OWNER, OWNER);
        assertReason(RegistryException.Reason.AUTHORIZATION, () -> registry.issueCertificate(OWNER, "F-1", H1, ""));
        registry.addIssuer(OWNER, OWNER);
        registry.issueCertificate(OWNER, "F-1", H1, "");
        assertEquals(CertificateStatus.ACTIVE, registry.status("F-1"));
    }

    @Test
    void unknownIdentifiers() {
        assertFalse(registry.verifyCertificate("nope", H1));
        assertEquals(VerificationResult.NOT_FOUND, registry.diagnoseCertificate("nope", H1));
        assertEquals(CertificateStatus.ABSENT, registry.status("nope"));
        assertReason(RegistryException.Reason.NOT_FOUND, () -> registry.getCertificate("nope"));
    }

    @Test
    void callerAddressesAreCaseInsensitive() {
        registry.addIssuer("0x" + OWNER.toUpperCase(), ISSUER.toUpperCase());
        assertTrue(registry.isIssuer(ISSUER));
        CertificateRecord record = registry.issueCertificate(ISSUER.toUpperCase(), "G-1", H1, "");
        assertEquals(ISSUER, record.issuedBy());
    }

    private static void assertReason(RegistryException.Reason expected, Runnable action) {
        RegistryException e = assertThrows(RegistryException.class, action::run);
        assertEquals(expected, e.reason());
    }
}
