package org.symproof.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintsTest {

    @Test
    @DisplayName("SHA-256 与已知摘要一致")
    void testKnownDigest() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                Fingerprints.sha256("abc"));
    }

    @Test
    @DisplayName("短哈希是完整摘要的前缀")
    void testShortHash() {
        String full = Fingerprints.sha256("def f(x):\n    return x\n");
        String shortHash = Fingerprints.shortHash("def f(x):\n    return x\n");

        assertAll(
                () -> assertEquals(Fingerprints.KEY_LENGTH, shortHash.length()),
                () -> assertTrue(full.startsWith(shortHash)),
                () -> assertNotEquals(shortHash, Fingerprints.shortHash("def f(x):\n    return -x\n"))
        );
    }
}
