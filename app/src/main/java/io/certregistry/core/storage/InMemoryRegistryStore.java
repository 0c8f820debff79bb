package io.certregistry.core.storage;

import io.certregistry.core.registry.CertificateRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory implementation of RegistryStore.
 * Not persistent: resets every process run.
 */
public final class InMemoryRegistryStore implements RegistryStore {

    private final Map<String, CertificateRecord> certificates = new HashMap<>();
    private final Map<String, Boolean> issuers = new HashMap<>();
    private final Map<String, Long> nonces = new HashMap<>();
    private String owner;
    private String registryId;

    @Override
    public synchronized Optional<CertificateRecord> getCertificate(String certId) {
        return Optional.ofNullable(certificates.get(certId));
    }

    @Override
    public synchronized long certificateCount() {
        return certificates.size();
    }

    @Override
    public synchronized boolean isIssuer(String address) {
        return issuers.getOrDefault(address, false);
    }

    @Override
    public synchronized List<String> authorizedIssuers() {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, Boolean> e : issuers.entrySet()) {
            if (e.getValue()) {
                out.add(e.getKey());
            }
        }
        Collections.sort(out);
        return out;
    }

    @Override
    public synchronized Optional<String> getOwner() {
        return Optional.ofNullable(owner);
    }

    @Override
    public synchronized Optional<String> getRegistryId() {
        return Optional.ofNullable(registryId);
    }

    @Override
    public synchronized long getNonce(String address) {
        return nonces.getOrDefault(address, 0L);
    }

    @Override
    public synchronized void apply(RegistryBatch batch) {
        // check everything first so a refused batch leaves no trace
        Set<String> inserted = new HashSet<>();
        for (CertificateRecord record : batch.inserts()) {
            if (certificates.containsKey(record.certId()) || !inserted.add(record.certId())) {
                throw new IllegalStateException("Certificate already stored: " + record.certId());
            }
        }
        for (String certId : batch.revocations()) {
            if (!certificates.containsKey(certId) && !inserted.contains(certId)) {
                throw new IllegalStateException("No certificate stored under " + certId);
            }
        }
        if (batch.owner() != null && owner != null && !owner.equals(batch.owner())) {
            throw new IllegalStateException("Owner already set to " + owner);
        }
        if (batch.registryId() != null && registryId != null && !registryId.equals(batch.registryId())) {
            throw new IllegalStateException("Registry id already set to " + registryId);
        }

        for (CertificateRecord record : batch.inserts()) {
            certificates.put(record.certId(), record);
        }
        for (String certId : batch.revocations()) {
            certificates.put(certId, certificates.get(certId).asRevoked());
        }
        issuers.putAll(batch.issuers());
        nonces.putAll(batch.nonces());
        if (batch.owner() != null) {
            owner = batch.owner();
        }
        if (batch.registryId() != null) {
            registryId = batch.registryId();
        }
    }
}
