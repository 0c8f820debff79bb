package io.certregistry.core.registry;

import java.util.Objects;

/**
 * A registry precondition failed. Nothing was written.
 */
public class RegistryException extends RuntimeException {

    public enum Reason {
        /** Caller lacks the role the operation needs, or could not be authenticated. */
        AUTHORIZATION,
        /** Empty identifier, zero hash, zero or malformed address, wrong nonce. */
        INVALID_ARGUMENT,
        ALREADY_EXISTS,
        NOT_FOUND,
        ALREADY_REVOKED
    }

    private final Reason reason;

    public RegistryException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }

    static RegistryException unauthorized(String message) {
        return new RegistryException(Reason.AUTHORIZATION, message);
    }

    static RegistryException invalid(String message) {
        return new RegistryException(Reason.INVALID_ARGUMENT, message);
    }

    static RegistryException notFound(String certId) {
        return new RegistryException(Reason.NOT_FOUND, "Certificate not found: " + certId);
    }
}
