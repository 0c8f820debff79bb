package io.certregistry.core.protocol;

import java.util.Locale;

/**
 * Principal addresses: 40 hex characters derived from an EC public key
 * (see {@link SignatureUtil#deriveAddress}).
 */
public final class Address {
    public static final int LENGTH = 40;
    public static final String ZERO = "0".repeat(LENGTH);

    private Address() {}

    public static boolean isValid(String addr) {
        if (addr == null || addr.length() != LENGTH) return false;
        for (int i = 0; i < LENGTH; i++) {
            char c = addr.charAt(i);
            boolean ok = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            if (!ok) return false;
        }
        return true;
    }

    public static boolean isZero(String addr) {
        return ZERO.equals(addr);
    }

    /** Lowercase form used as the storage key; {@code null} stays {@code null}. */
    public static String normalize(String addr) {
        if (addr == null) return null;
        String trimmed = addr.trim();
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            trimmed = trimmed.substring(2);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
