package io.certregistry.core.registry;

import io.certregistry.core.protocol.CertHash;

import java.util.Objects;

/**
 * Stored certificate. Everything but {@code revoked} is fixed at issuance.
 *
 * @param certId   caller-chosen identifier
 * @param certHash digest of the certificate file
 * @param ipfsCid  opaque pointer to off-system storage, empty when not given
 * @param issuedBy address of the issuing principal
 * @param issuedAt epoch seconds at issuance
 * @param revoked  one-way revocation flag
 */
public record CertificateRecord(String certId,
                                CertHash certHash,
                                String ipfsCid,
                                String issuedBy,
                                long issuedAt,
                                boolean revoked) {

    public CertificateRecord {
        Objects.requireNonNull(certId, "certId");
        Objects.requireNonNull(certHash, "certHash");
        Objects.requireNonNull(issuedBy, "issuedBy");
        ipfsCid = ipfsCid == null ? "" : ipfsCid;
    }

    public CertificateStatus status() {
        return revoked ? CertificateStatus.REVOKED : CertificateStatus.ACTIVE;
    }

    public CertificateRecord asRevoked() {
        return new CertificateRecord(certId, certHash, ipfsCid, issuedBy, issuedAt, true);
    }
}
