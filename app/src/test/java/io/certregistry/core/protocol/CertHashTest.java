package io.certregistry.core.protocol;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CertHashTest {

    @Test
    void parsesHexWithAndWithoutPrefix() {
        String hex = "ab".repeat(32);
        CertHash plain = CertHash.fromHex(hex);
        CertHash prefixed = CertHash.fromHex("0x" + hex.toUpperCase());
        assertEquals(plain, prefixed);
        assertEquals(hex, prefixed.hex());
        assertFalse(plain.isZero());
    }

    @Test
    void rejectsWrongLengthAndNonHex() {
        assertThrows(IllegalArgumentException.class, () -> CertHash.fromHex("abcd"));
        assertThrows(IllegalArgumentException.class, () -> CertHash.fromHex("zz".repeat(32)));
        assertThrows(IllegalArgumentException.class, () -> CertHash.fromHex(null));
        assertThrows(IllegalArgumentException.class, () -> new CertHash(new byte[31]));
    }

    @Test
    void zeroHashIsDetected() {
        assertTrue(CertHash.ZERO.isZero());
        assertTrue(CertHash.fromHex("00".repeat(32)).isZero());
    }

    @Test
    void contentDigestIsStable() {
        byte[] content = "diploma.pdf contents".getBytes(StandardCharsets.UTF_8);
        assertEquals(CertHash.of(content), CertHash.of(content.clone()));
        assertNotEquals(CertHash.of(content), CertHash.of("other".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void bytesAreDefensivelyCopied() {
        CertHash hash = CertHash.fromHex("01".repeat(32));
        byte[] copy = hash.bytes();
        copy[0] = 0x7f;
        assertEquals("01".repeat(32), hash.hex());
    }
}
