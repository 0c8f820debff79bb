package io.certregistry.core.registry;

import io.certregistry.core.event.RegistryEvent;
import io.certregistry.core.event.RegistryEventListener;
import io.certregistry.core.metrics.RegistryMetrics;
import io.certregistry.core.protocol.Address;
import io.certregistry.core.protocol.CertHash;
import io.certregistry.core.storage.RegistryBatch;
import io.certregistry.core.storage.RegistryStore;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Certificate registry: one owner, a set of authorized issuers and
 * certificate records keyed by identifier.
 * <p>
 * Every public method holds this instance's monitor, so all operations run in
 * one global order. Each operation checks all preconditions, stages its
 * writes in one {@link RegistryBatch} and commits that batch with a single
 * {@link RegistryStore#apply}; a {@link RegistryException} or a failed commit
 * therefore leaves state untouched. Events are emitted after the commit.
 */
public final class CertificateRegistry {
    private static final Logger LOG = Logger.getLogger(CertificateRegistry.class.getName());

    private final RegistryStore store;
    private final String owner;
    private final String registryId;
    private final Clock clock;
    private final RegistryEventListener events;

    /** Open with the stored registry id, or a fresh random one on an empty store. */
    public CertificateRegistry(RegistryStore store, String owner, Clock clock, RegistryEventListener events) {
        this(store, owner, null, clock, events);
    }

    /**
     * Open the registry over {@code store}. On an empty store the owner,
     * its issuer flag and the registry id are recorded in one batch; a store
     * that already has an owner must name the same one.
     *
     * @param registryId identifier signed into every call; {@code null} keeps
     *                   the stored one or generates one
     * @throws IllegalStateException if the store belongs to another owner or registry id
     */
    public CertificateRegistry(RegistryStore store, String owner, String registryId, Clock clock,
                               RegistryEventListener events) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = events != null ? events : event -> { };
        String normalized = Address.normalize(owner);
        if (!Address.isValid(normalized) || Address.isZero(normalized)) {
            throw new IllegalArgumentException("Owner must be a non-zero address: " + owner);
        }
        if (registryId != null && registryId.isBlank()) {
            throw new IllegalArgumentException("Registry id must not be blank");
        }
        this.owner = normalized;

        Optional<String> existing = store.getOwner();
        if (existing.isPresent()) {
            if (!existing.get().equals(normalized)) {
                throw new IllegalStateException("Registry store is owned by " + existing.get()
                        + ", not " + normalized);
            }
            String stored = store.getRegistryId()
                    .orElseThrow(() -> new IllegalStateException("Registry store has an owner but no registry id"));
            if (registryId != null && !registryId.equals(stored)) {
                throw new IllegalStateException("Registry store has id " + stored + ", not " + registryId);
            }
            this.registryId = stored;
            LOG.info(() -> "Registry " + stored + " opened, owner=" + normalized);
        } else {
            String id = registryId != null ? registryId : UUID.randomUUID().toString();
            store.apply(new RegistryBatch()
                    .setOwner(normalized)
                    .setRegistryId(id)
                    .setIssuer(normalized, true));
            this.registryId = id;
            LOG.info(() -> "Registry " + id + " initialized, owner=" + normalized);
            this.events.onEvent(new RegistryEvent.IssuerAdded(normalized));
        }
    }

    public synchronized CertificateRecord issueCertificate(String caller, String certId, CertHash certHash, String ipfsCid) {
        return commit(prepareIssue(caller, certId, certHash, ipfsCid));
    }

    synchronized PendingChange<CertificateRecord> prepareIssue(String caller, String certId, CertHash certHash, String ipfsCid) {
        String issuer = Address.normalize(caller);
        if (issuer == null || !store.isIssuer(issuer)) {
            throw reject(RegistryException.unauthorized("Caller is not an authorized issuer: " + caller));
        }
        if (certId == null || certId.isEmpty()) {
            throw reject(RegistryException.invalid("Certificate ID required"));
        }
        if (certHash == null || certHash.isZero()) {
            throw reject(RegistryException.invalid("Certificate hash must be non-zero"));
        }
        if (store.getCertificate(certId).isPresent()) {
            throw reject(new RegistryException(RegistryException.Reason.ALREADY_EXISTS,
                    "Certificate already exists: " + certId));
        }

        CertificateRecord record = new CertificateRecord(
                certId, certHash, ipfsCid, issuer, clock.instant().getEpochSecond(), false);
        return new PendingChange<>(new RegistryBatch().insertCertificate(record), record,
                new RegistryEvent.CertificateIssued(certId, certHash, record.ipfsCid(), issuer), () -> {
                    RegistryMetrics.incrementIssued();
                    LOG.info(() -> "Issued " + certId + " hash=" + certHash.hex() + " by " + issuer);
                });
    }

    /**
     * True only for an existing, unrevoked record with exactly this hash.
     * Use {@link #diagnoseCertificate} to learn why a check failed.
     */
    public synchronized boolean verifyCertificate(String certId, CertHash certHash) {
        return diagnoseCertificate(certId, certHash).isValid();
    }

    /**
     * Diagnostic variant of {@link #verifyCertificate}. A hash mismatch is
     * reported before revocation.
     */
    public synchronized VerificationResult diagnoseCertificate(String certId, CertHash certHash) {
        VerificationResult result;
        Optional<CertificateRecord> record = certId == null ? Optional.empty() : store.getCertificate(certId);
        if (record.isEmpty()) {
            result = VerificationResult.NOT_FOUND;
        } else if (!record.get().certHash().equals(certHash)) {
            result = VerificationResult.HASH_MISMATCH;
        } else if (record.get().revoked()) {
            result = VerificationResult.REVOKED;
        } else {
            result = VerificationResult.VALID;
        }
        RegistryMetrics.recordVerification(result);
        return result;
    }

    /** Only the record's issuer or the owner may revoke; revocation is final. */
    public synchronized CertificateRecord revokeCertificate(String caller, String certId) {
        return commit(prepareRevoke(caller, certId));
    }

    synchronized PendingChange<CertificateRecord> prepareRevoke(String caller, String certId) {
        CertificateRecord record = (certId == null ? Optional.<CertificateRecord>empty() : store.getCertificate(certId))
                .orElseThrow(() -> reject(RegistryException.notFound(certId)));
        if (record.revoked()) {
            throw reject(new RegistryException(RegistryException.Reason.ALREADY_REVOKED,
                    "Certificate already revoked: " + certId));
        }
        String revoker = Address.normalize(caller);
        if (!record.issuedBy().equals(revoker) && !owner.equals(revoker)) {
            throw reject(RegistryException.unauthorized("Only the issuer or the owner may revoke " + certId));
        }

        return new PendingChange<>(new RegistryBatch().markRevoked(certId), record.asRevoked(),
                new RegistryEvent.CertificateRevoked(certId, revoker), () -> {
                    RegistryMetrics.incrementRevoked();
                    LOG.info(() -> "Revoked " + certId + " by " + revoker);
                });
    }

    /** Owner only. Re-adding an authorized issuer succeeds and emits again. */
    public synchronized void addIssuer(String caller, String address) {
        commit(prepareAddIssuer(caller, address));
    }

    synchronized PendingChange<Void> prepareAddIssuer(String caller, String address) {
        requireOwner(caller);
        String issuer = Address.normalize(address);
        if (!Address.isValid(issuer) || Address.isZero(issuer)) {
            throw reject(RegistryException.invalid("Issuer must be a non-zero address: " + address));
        }
        return new PendingChange<>(new RegistryBatch().setIssuer(issuer, true), null,
                new RegistryEvent.IssuerAdded(issuer), () -> {
                    RegistryMetrics.incrementIssuerChanges();
                    LOG.info(() -> "Issuer added: " + issuer);
                });
    }

    /** Owner only. Stores false whether or not the address was ever authorized. */
    public synchronized void removeIssuer(String caller, String address) {
        commit(prepareRemoveIssuer(caller, address));
    }

    synchronized PendingChange<Void> prepareRemoveIssuer(String caller, String address) {
        requireOwner(caller);
        String issuer = Address.normalize(address);
        if (!Address.isValid(issuer)) {
            throw reject(RegistryException.invalid("Malformed issuer address: " + address));
        }
        return new PendingChange<>(new RegistryBatch().setIssuer(issuer, false), null,
                new RegistryEvent.IssuerRemoved(issuer), () -> {
                    RegistryMetrics.incrementIssuerChanges();
                    LOG.info(() -> "Issuer removed: " + issuer);
                });
    }

    public synchronized CertificateRecord getCertificate(String certId) {
        if (certId == null) {
            throw reject(RegistryException.notFound(null));
        }
        return store.getCertificate(certId).orElseThrow(() -> reject(RegistryException.notFound(certId)));
    }

    public synchronized CertificateStatus status(String certId) {
        if (certId == null) {
            return CertificateStatus.ABSENT;
        }
        return store.getCertificate(certId).map(CertificateRecord::status).orElse(CertificateStatus.ABSENT);
    }

    public synchronized boolean isIssuer(String address) {
        String normalized = Address.normalize(address);
        return normalized != null && store.isIssuer(normalized);
    }

    public synchronized List<String> issuers() {
        return store.authorizedIssuers();
    }

    public synchronized long certificateCount() {
        return store.certificateCount();
    }

    public String owner() {
        return owner;
    }

    /** Identifier every signed call must carry; fixed for the life of the store. */
    public String registryId() {
        return registryId;
    }

    RegistryStore store() {
        return store;
    }

    /**
     * Write a staged change, then record metrics and emit its event. Callers
     * may add writes (the caller's nonce) to the batch before committing.
     */
    synchronized <T> T commit(PendingChange<T> change) {
        store.apply(change.batch);
        change.afterCommit.run();
        events.onEvent(change.event);
        return change.result;
    }

    private void requireOwner(String caller) {
        if (!owner.equals(Address.normalize(caller))) {
            throw reject(RegistryException.unauthorized("Only the owner may manage issuers"));
        }
    }

    private static RegistryException reject(RegistryException e) {
        RegistryMetrics.recordRejected(e.reason());
        return e;
    }

    /** Validated operation whose writes are staged but not yet committed. */
    static final class PendingChange<T> {
        final RegistryBatch batch;
        final T result;
        final RegistryEvent event;
        final Runnable afterCommit;

        PendingChange(RegistryBatch batch, T result, RegistryEvent event, Runnable afterCommit) {
            this.batch = batch;
            this.result = result;
            this.event = event;
            this.afterCommit = afterCommit;
        }
    }
}
