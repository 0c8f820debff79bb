package io.certregistry.core.protocol;

import java.util.Arrays;

/**
 * 32-byte content digest of a certificate file, computed off-system by the issuer.
 */
public final class CertHash {
    public static final int LENGTH = 32;
    public static final CertHash ZERO = new CertHash(new byte[LENGTH]);

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    public CertHash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Certificate hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    /** Parse 64 hex characters, with or without a {@code 0x} prefix. */
    public static CertHash fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Certificate hash required");
        }
        String normalized = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (normalized.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Certificate hash must be 64 hex characters");
        }
        byte[] out = new byte[LENGTH];
        for (int i = 0; i < normalized.length(); i += 2) {
            int hi = Character.digit(normalized.charAt(i), 16);
            int lo = Character.digit(normalized.charAt(i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Certificate hash must be hexadecimal");
            }
            out[i / 2] = (byte) ((hi << 4) + lo);
        }
        return new CertHash(out);
    }

    /** SHA-256 over the certificate bytes. */
    public static CertHash of(byte[] content) {
        return new CertHash(SignatureUtil.sha256(content));
    }

    public boolean isZero() {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    public byte[] bytes() { return bytes.clone(); }

    public String hex() {
        char[] out = new char[bytes.length * 2];
        for (int i = 0, j = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    @Override public boolean equals(Object o) { return o instanceof CertHash other && Arrays.equals(bytes, other.bytes); }
    @Override public int hashCode() { return Arrays.hashCode(bytes); }
    @Override public String toString() { return "CertHash(" + hex().substring(0, 8) + "…)"; }
}
