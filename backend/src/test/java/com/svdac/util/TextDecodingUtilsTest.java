package com.svdac.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class TextDecodingUtilsTest {

    @Test
    void shouldDropUtf8Bom() {
        byte[] bytes = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'a', ';'};

        TextDecodingUtils.DecodedText decoded = TextDecodingUtils.decodeBestEffort(bytes);

        assertEquals("a;", decoded.text());
        assertNull(decoded.buildNotice("a.sv"));
    }

    @Test
    void shouldFallBackForInvalidUtf8() {
        byte[] bytes = "x = y; // café".getBytes(StandardCharsets.ISO_8859_1);

        TextDecodingUtils.DecodedText decoded = TextDecodingUtils.decodeBestEffort(bytes);

        assertTrue(decoded.usedFallbackCharset());
        assertEquals("x = y; // café", decoded.text());
        assertTrue(decoded.buildNotice("a.sv").contains("a.sv"));
    }

    @Test
    void shouldHandleEmptyInput() {
        assertEquals("", TextDecodingUtils.decodeBestEffort(new byte[0]).text());
    }
}
