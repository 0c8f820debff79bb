package io.certregistry.core.storage;

import io.certregistry.core.registry.CertificateRecord;

import java.util.List;
import java.util.Optional;

/**
 * Persistent registry state: certificate records, issuer flags, the owner,
 * the registry identifier and per-principal call nonces. Insert-only: nothing
 * is ever deleted. All writes go through {@link #apply(RegistryBatch)}.
 */
public interface RegistryStore {

    Optional<CertificateRecord> getCertificate(String certId);

    long certificateCount();

    boolean isIssuer(String address);

    /** Addresses whose flag is currently true, sorted. */
    List<String> authorizedIssuers();

    Optional<String> getOwner();

    Optional<String> getRegistryId();

    long getNonce(String address);

    /**
     * Commit every change in {@code batch} or none of them.
     *
     * @throws IllegalStateException if an insert hits a stored identifier, a
     *         revocation names an absent record, the owner or registry id
     *         differs from the stored one, or the write itself fails
     */
    void apply(RegistryBatch batch);
}
