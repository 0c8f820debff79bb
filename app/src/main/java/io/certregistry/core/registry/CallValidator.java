package io.certregistry.core.registry;

import io.certregistry.core.protocol.RegistryCall;
import io.certregistry.core.protocol.SignatureUtil;
import io.certregistry.core.storage.RegistryStore;

/**
 * Authenticates the caller of a {@link RegistryCall}: the signature must
 * verify under the supplied key, that key must hash to the caller address,
 * the call must name this registry and the nonce must be the caller's next one.
 */
public class CallValidator {
    private final RegistryStore store;
    private final String registryId;

    public CallValidator(RegistryStore store, String registryId) {
        this.store = store;
        this.registryId = registryId;
    }

    public void validate(RegistryCall call) {
        if (call == null) {
            throw RegistryException.invalid("Call required");
        }
        if (call.publicKey() == null) {
            throw RegistryException.unauthorized("Missing public key");
        }
        if (!SignatureUtil.deriveAddress(call.publicKey()).equals(call.caller())) {
            throw RegistryException.unauthorized("Public key does not match caller " + call.caller());
        }
        if (!SignatureUtil.verify(call.toUnsignedBytes(), call.signature(), call.publicKey())) {
            throw RegistryException.unauthorized("Invalid signature");
        }
        if (!registryId.equals(call.registryId())) {
            throw RegistryException.invalid("Call is for registry " + call.registryId() + ", not " + registryId);
        }
        long expected = store.getNonce(call.caller());
        if (call.nonce() != expected) {
            throw RegistryException.invalid("Bad nonce " + call.nonce() + ", expected " + expected);
        }
    }
}
