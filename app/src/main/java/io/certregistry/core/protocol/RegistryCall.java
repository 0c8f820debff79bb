package io.certregistry.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.util.Objects;

/**
 * A state-changing registry operation signed by its caller.
 * <p>
 * The signature covers {@link #toUnsignedBytes()}: version, registry id,
 * operation, caller, nonce and every argument slot, absent arguments encoded
 * as empty. The registry id binds a signature to one registry, so a call
 * signed for one deployment is refused by another with the same owner.
 */
public final class RegistryCall {

    public enum Operation {
        ISSUE_CERTIFICATE,
        REVOKE_CERTIFICATE,
        ADD_ISSUER,
        REMOVE_ISSUER
    }

    private final int version;
    private final String registryId;
    private final Operation operation;
    private final String caller;
    private final long nonce;

    private final String certId;
    private final CertHash certHash;
    private final String ipfsCid;
    private final String subject;

    private final byte[] signature;
    private final PublicKey publicKey;

    private RegistryCall(int version,
                         String registryId,
                         Operation operation,
                         String caller,
                         long nonce,
                         String certId,
                         CertHash certHash,
                         String ipfsCid,
                         String subject,
                         byte[] signature,
                         PublicKey publicKey) {
        this.version = version;
        this.registryId = registryId;
        this.operation = Objects.requireNonNull(operation, "operation");
        this.caller = Address.normalize(caller);
        this.nonce = nonce;
        this.certId = certId;
        this.certHash = certHash;
        this.ipfsCid = ipfsCid;
        this.subject = Address.normalize(subject);
        this.signature = signature != null ? signature.clone() : new byte[0];
        this.publicKey = publicKey;
        if (registryId == null || registryId.isBlank()) {
            throw new IllegalArgumentException("Registry id required");
        }
        if (this.caller == null || this.caller.isBlank()) {
            throw new IllegalArgumentException("Caller address required");
        }
        if (nonce < 0) {
            throw new IllegalArgumentException("Nonce must be >= 0");
        }
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int version = 1;
        private String registryId;
        private Operation operation;
        private String caller;
        private long nonce;
        private String certId;
        private CertHash certHash;
        private String ipfsCid;
        private String subject;
        private byte[] signature = new byte[0];
        private PublicKey publicKey;

        public Builder version(int v) { this.version = v; return this; }
        public Builder registryId(String id) { this.registryId = id; return this; }
        public Builder operation(Operation op) { this.operation = op; return this; }
        public Builder caller(String c) { this.caller = c; return this; }
        public Builder nonce(long n) { this.nonce = n; return this; }
        public Builder certId(String id) { this.certId = id; return this; }
        public Builder certHash(CertHash h) { this.certHash = h; return this; }
        public Builder ipfsCid(String cid) { this.ipfsCid = cid; return this; }
        public Builder subject(String s) { this.subject = s; return this; }
        public Builder signature(byte[] s) { this.signature = s != null ? s.clone() : new byte[0]; return this; }
        public Builder publicKey(PublicKey pk) { this.publicKey = pk; return this; }

        public RegistryCall build() {
            return new RegistryCall(version, registryId, operation, caller, nonce, certId, certHash,
                                    ipfsCid, subject, signature, publicKey);
        }
    }

    public static Builder issue(String registryId, String caller, long nonce, String certId,
                                CertHash certHash, String ipfsCid) {
        return builder().registryId(registryId).operation(Operation.ISSUE_CERTIFICATE).caller(caller).nonce(nonce)
                .certId(certId).certHash(certHash).ipfsCid(ipfsCid);
    }

    public static Builder revoke(String registryId, String caller, long nonce, String certId) {
        return builder().registryId(registryId).operation(Operation.REVOKE_CERTIFICATE).caller(caller).nonce(nonce).certId(certId);
    }

    public static Builder addIssuer(String registryId, String caller, long nonce, String issuer) {
        return builder().registryId(registryId).operation(Operation.ADD_ISSUER).caller(caller).nonce(nonce).subject(issuer);
    }

    public static Builder removeIssuer(String registryId, String caller, long nonce, String issuer) {
        return builder().registryId(registryId).operation(Operation.REMOVE_ISSUER).caller(caller).nonce(nonce).subject(issuer);
    }

    /** Copy of this call carrying the given signature and key. */
    public RegistryCall signed(byte[] signature, PublicKey publicKey) {
        return new RegistryCall(version, registryId, operation, caller, nonce, certId, certHash,
                                ipfsCid, subject, signature, publicKey);
    }

    public int version() { return version; }
    public String registryId() { return registryId; }
    public Operation operation() { return operation; }
    public String caller() { return caller; }
    public long nonce() { return nonce; }
    public String certId() { return certId; }
    public CertHash certHash() { return certHash; }
    public String ipfsCid() { return ipfsCid; }
    public String subject() { return subject; }
    public byte[] signature() { return signature.clone(); }
    public PublicKey publicKey() { return publicKey; }

    public byte[] toUnsignedBytes() {
        byte[] registry = utf8(registryId);
        byte[] op = operation.name().getBytes(StandardCharsets.UTF_8);
        byte[] from = utf8(caller);
        byte[] id = utf8(certId);
        byte[] hash = certHash != null ? certHash.bytes() : new byte[0];
        byte[] cid = utf8(ipfsCid);
        byte[] subj = utf8(subject);

        int size = 4 + 8
                + 4 + registry.length
                + 4 + op.length
                + 4 + from.length
                + 4 + id.length
                + 4 + hash.length
                + 4 + cid.length
                + 4 + subj.length;
        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putInt(version);
        putBytes(buf, registry);
        putBytes(buf, op);
        putBytes(buf, from);
        buf.putLong(nonce);
        putBytes(buf, id);
        putBytes(buf, hash);
        putBytes(buf, cid);
        putBytes(buf, subj);
        return buf.array();
    }

    private static byte[] utf8(String s) {
        return s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
    }

    private static void putBytes(ByteBuffer b, byte[] data) {
        b.putInt(data.length);
        b.put(data);
    }

    @Override
    public String toString() {
        return "RegistryCall{" + operation + ", caller=" + caller + ", nonce=" + nonce + "}";
    }
}
