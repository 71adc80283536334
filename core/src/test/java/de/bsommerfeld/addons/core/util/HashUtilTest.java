package de.bsommerfeld.addons.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HashUtilTest {

    @Test
    void sha1_shouldProduceKnownDigest() {
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d", HashUtil.sha1("abc"));
    }

    @Test
    void sha1_shouldBeLowerCaseHexOfFortyChars() {
        String hash = HashUtil.sha1("https://github.com/example/addons");
        assertEquals(40, hash.length());
        assertTrue(hash.matches("[0-9a-f]+"));
    }

    @Test
    void sha1_shouldBeDeterministic() {
        assertEquals(HashUtil.sha1("repo"), HashUtil.sha1("repo"));
        assertNotEquals(HashUtil.sha1("repo"), HashUtil.sha1("Repo"));
    }
}
