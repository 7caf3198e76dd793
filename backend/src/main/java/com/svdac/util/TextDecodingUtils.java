package com.svdac.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * 文本解码工具：优先 UTF-8，识别 BOM，失败时按 ISO-8859-1 解码（HDL 源码基本是 ASCII）。
 */
public final class TextDecodingUtils {

    private TextDecodingUtils() {
    }

    public static DecodedText decodeBestEffort(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new DecodedText("", StandardCharsets.UTF_8.name(), false);
        }

        // UTF-8 BOM
        if (hasPrefix(bytes, (byte) 0xEF, (byte) 0xBB, (byte) 0xBF)) {
            return new DecodedText(
                    new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8),
                    "UTF-8 (BOM)",
                    false);
        }

        // UTF-16 BOM
        if (hasPrefix(bytes, (byte) 0xFF, (byte) 0xFE)) {
            return new DecodedText(
                    new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16LE),
                    "UTF-16LE (BOM)",
                    false);
        }
        if (hasPrefix(bytes, (byte) 0xFE, (byte) 0xFF)) {
            return new DecodedText(
                    new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE),
                    "UTF-16BE (BOM)",
                    false);
        }

        String utf8 = tryStrictDecode(bytes, StandardCharsets.UTF_8);
        if (utf8 != null) {
            return new DecodedText(utf8, StandardCharsets.UTF_8.name(), false);
        }

        // ISO-8859-1 可以解码任意字节
        return new DecodedText(new String(bytes, StandardCharsets.ISO_8859_1),
                StandardCharsets.ISO_8859_1.name(), true);
    }

    private static String tryStrictDecode(byte[] bytes, Charset charset) {
        try {
            CharsetDecoder decoder = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static boolean hasPrefix(byte[] bytes, byte... prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    public record DecodedText(String text, String charsetName, boolean usedFallbackCharset) {
        public String buildNotice(String fileName) {
            if (!usedFallbackCharset) {
                return null;
            }
            return "检测到 " + fileName + " 不是 UTF-8 编码，已按 " + charsetName + " 解码。";
        }
    }
}
