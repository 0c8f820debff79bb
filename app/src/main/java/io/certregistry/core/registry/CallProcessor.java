package io.certregistry.core.registry;

import io.certregistry.core.metrics.RegistryMetrics;
import io.certregistry.core.protocol.Address;
import io.certregistry.core.protocol.RegistryCall;
import io.certregistry.core.storage.RegistryStore;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Entry point for signed, state-changing calls. The operation's writes and
 * the caller's nonce bump are committed in one batch under the registry
 * monitor, so a call either applies in full or leaves both the registry and
 * the caller's nonce unchanged.
 */
public final class CallProcessor {
    private static final Logger LOG = Logger.getLogger(CallProcessor.class.getName());

    private final CertificateRegistry registry;
    private final CallValidator validator;
    private final RegistryStore store;

    public CallProcessor(CertificateRegistry registry) {
        this(registry, new CallValidator(registry.store(), registry.registryId()));
    }

    public CallProcessor(CertificateRegistry registry, CallValidator validator) {
        this.registry = registry;
        this.validator = validator;
        this.store = registry.store();
    }

    /**
     * Apply a signed call.
     *
     * @return the affected record for certificate operations, empty for issuer operations
     * @throws RegistryException if authentication or any registry precondition fails
     */
    public Optional<CertificateRecord> submit(RegistryCall call) {
        synchronized (registry) {
            try {
                validator.validate(call);
            } catch (RegistryException e) {
                RegistryMetrics.recordRejected(e.reason());
                LOG.fine(() -> "Rejected " + call + ": " + e.getMessage());
                throw e;
            }
            CertificateRegistry.PendingChange<?> change = prepare(call);
            change.batch.setNonce(call.caller(), call.nonce() + 1);
            Object result = registry.commit(change);
            return result instanceof CertificateRecord record ? Optional.of(record) : Optional.empty();
        }
    }

    /** Next nonce the given principal must sign with. */
    public long nextNonce(String address) {
        synchronized (registry) {
            return address == null ? 0L : store.getNonce(Address.normalize(address));
        }
    }

    private CertificateRegistry.PendingChange<?> prepare(RegistryCall call) {
        switch (call.operation()) {
            case ISSUE_CERTIFICATE:
                return registry.prepareIssue(call.caller(), call.certId(), call.certHash(), call.ipfsCid());
            case REVOKE_CERTIFICATE:
                return registry.prepareRevoke(call.caller(), call.certId());
            case ADD_ISSUER:
                return registry.prepareAddIssuer(call.caller(), call.subject());
            case REMOVE_ISSUER:
                return registry.prepareRemoveIssuer(call.caller(), call.subject());
            default:
                throw new IllegalStateException("Unhandled operation " + call.operation());
        }
    }
}
