package io.certregistry.core.registry;

/** Lifecycle of one identifier: ABSENT, then ACTIVE, then REVOKED (terminal). */
public enum CertificateStatus {
    ABSENT,
    ACTIVE,
    REVOKED
}
