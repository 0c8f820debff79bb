package io.certregistry.core.protocol;

import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;

public final class SignatureUtil {
    private static final String ALGORITHM = "SHA256withECDSA";

    private SignatureUtil() {}

    public static byte[] sign(byte[] data, PrivateKey priv) {
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initSign(priv);
            sig.update(data);
            return sig.sign();
        } catch (Exception e) {
            throw new IllegalStateException("Signing failed", e);
        }
    }

    /** Returns false for any malformed signature or key instead of throwing. */
    public static boolean verify(byte[] data, byte[] signature, PublicKey pub) {
        if (data == null || signature == null || signature.length == 0 || pub == null) {
            return false;
        }
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initVerify(pub);
            sig.update(data);
            return sig.verify(signature);
        } catch (Exception e) {
            return false;
        }
    }

    public static String deriveAddress(PublicKey pub) {
        byte[] hash = sha256(pub.getEncoded());
        StringBuilder sb = new StringBuilder(Address.LENGTH);
        for (int i = 0; i < Address.LENGTH / 2; i++) {
            sb.append(String.format("%02x", hash[i]));
        }
        return sb.toString();
    }

    /** Decode an X.509 (SubjectPublicKeyInfo) EC public key. */
    public static PublicKey decodePublicKey(byte[] encoded) {
        try {
            return KeyFactory.getInstance("EC").generatePublic(new X509EncodedKeySpec(encoded));
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid EC public key", e);
        }
    }

    public static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
