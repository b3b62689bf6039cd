package org.muma.mini.kv.utils;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class ScanUtilTest {

    private static boolean glob(String pattern, String s) {
        return ScanUtil.matches(ScanUtil.compileOrNull(pattern), s);
    }

    @Test
    void testStarAndQuestionMark() {
        assertTrue(glob("*", "anything"));
        assertTrue(glob("user:*", "user:42"));
        assertFalse(glob("user:*", "post:1"));
        assertTrue(glob("h?llo", "hello"));
        assertFalse(glob("h?llo", "heello"));
    }

    /**
     * 与 Redis 的 stringmatchlen 一致：'*' 和 '?' 都可以匹配 '/'
     */
    @Test
    void testWildcardsCrossSlash() {
        assertTrue(glob("user:*", "user:a/b"));
        assertTrue(glob("*", "/"));
        assertTrue(glob("a?b", "a/b"));
        assertTrue(glob("logs/*/error", "logs/2024/01/error"));
        assertFalse(glob("logs/*/error", "logs/2024/01/warn"));
    }

    @Test
    void testCharacterClasses() {
        assertTrue(glob("h[ae]llo", "hallo"));
        assertFalse(glob("h[ae]llo", "hillo"));
        assertTrue(glob("h[^e]llo", "hallo"));
        assertFalse(glob("h[^e]llo", "hello"));
        assertTrue(glob("key[0-9]", "key7"));
        assertFalse(glob("key[0-9]", "keyx"));
    }

    @Test
    void testEscapesAndRegexMetaCharacters() {
        assertTrue(glob("a\\*b", "a*b"));
        assertFalse(glob("a\\*b", "axxb"));
        assertTrue(glob("a.b", "a.b"));
        assertFalse(glob("a.b", "axb"));
        assertTrue(glob("(x)+", "(x)+"));
    }

    @Test
    void testInvalidPatternsMatchNothing() {
        Pattern unclosed = ScanUtil.compileGlob("abc[");
        assertFalse(unclosed.matcher("abc[").matches());
        assertFalse(glob("[z-a]", "m"));
    }

    @Test
    void testParseMatchAndCount() {
        ScanUtil.ScanParams params = ScanUtil.parse(List.of("0", "MATCH", "k*", "count", "5"), 1);
        assertEquals("k*", params.matchPattern);
        assertEquals(5, params.count);

        ScanUtil.ScanParams defaults = ScanUtil.parse(List.of("0"), 1);
        assertEquals(10, defaults.count);
        assertNull(defaults.matchPattern);
    }

    @Test
    void testParseErrors() {
        assertThrows(IllegalArgumentException.class, () -> ScanUtil.parse(List.of("0", "MATCH"), 1));
        assertThrows(IllegalArgumentException.class, () -> ScanUtil.parse(List.of("0", "COUNT", "x"), 1));
        assertThrows(IllegalArgumentException.class, () -> ScanUtil.parse(List.of("0", "COUNT", "0"), 1));
        assertThrows(IllegalArgumentException.class, () -> ScanUtil.parse(List.of("0", "FOO", "1"), 1));
    }
}
