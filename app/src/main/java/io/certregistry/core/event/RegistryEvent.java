package io.certregistry.core.event;

import io.certregistry.core.protocol.CertHash;

/**
 * Notifications broadcast after a registry mutation has been applied.
 */
public interface RegistryEvent {

    /** Stable name used on the wire and in logs. */
    String type();

    record IssuerAdded(String issuer) implements RegistryEvent {
        @Override public String type() { return "IssuerAdded"; }
    }

    record IssuerRemoved(String issuer) implements RegistryEvent {
        @Override public String type() { return "IssuerRemoved"; }
    }

    record CertificateIssued(String certId, CertHash certHash, String ipfsCid, String issuer) implements RegistryEvent {
        @Override public String type() { return "CertificateIssued"; }
    }

    record CertificateRevoked(String certId, String revoker) implements RegistryEvent {
        @Override public String type() { return "CertificateRevoked"; }
    }
}
