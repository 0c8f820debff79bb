package io.certregistry.core.registry;

/**
 * Diagnostic outcome of checking a hash against the registry.
 * {@link CertificateRegistry#verifyCertificate} collapses everything but
 * {@link #VALID} to {@code false}.
 */
public enum VerificationResult {
    VALID,
    NOT_FOUND,
    HASH_MISMATCH,
    REVOKED;

    public boolean isValid() {
        return this == VALID;
    }
}
