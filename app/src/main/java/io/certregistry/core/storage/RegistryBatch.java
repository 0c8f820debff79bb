package io.certregistry.core.storage;

import io.certregistry.core.registry.CertificateRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes that must land together. {@link RegistryStore#apply} checks every
 * staged change first and then commits all of them or none.
 */
public final class RegistryBatch {
    private final List<CertificateRecord> inserts = new ArrayList<>();
    private final List<String> revocations = new ArrayList<>();
    private final Map<String, Boolean> issuers = new LinkedHashMap<>();
    private final Map<String, Long> nonces = new LinkedHashMap<>();
    private String owner;
    private String registryId;

    /** New record; the identifier must not be stored yet. */
    public RegistryBatch insertCertificate(CertificateRecord record) {
        inserts.add(record);
        return this;
    }

    /** Flip the revoked flag of a stored record. */
    public RegistryBatch markRevoked(String certId) {
        revocations.add(certId);
        return this;
    }

    public RegistryBatch setIssuer(String address, boolean authorized) {
        issuers.put(address, authorized);
        return this;
    }

    public RegistryBatch setNonce(String address, long nonce) {
        nonces.put(address, nonce);
        return this;
    }

    /** Recorded once; a store that already names another owner refuses the batch. */
    public RegistryBatch setOwner(String owner) {
        this.owner = owner;
        return this;
    }

    /** Recorded once, like the owner. */
    public RegistryBatch setRegistryId(String registryId) {
        this.registryId = registryId;
        return this;
    }

    public List<CertificateRecord> inserts() { return Collections.unmodifiableList(inserts); }
    public List<String> revocations() { return Collections.unmodifiableList(revocations); }
    public Map<String, Boolean> issuers() { return Collections.unmodifiableMap(issuers); }
    public Map<String, Long> nonces() { return Collections.unmodifiableMap(nonces); }
    public String owner() { return owner; }
    public String registryId() { return registryId; }

    public boolean isEmpty() {
        return inserts.isEmpty() && revocations.isEmpty() && issuers.isEmpty() && nonces.isEmpty()
                && owner == null && registryId == null;
    }
}
