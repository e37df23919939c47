/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.codec;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * The compressed page envelope: base64 text of raw-deflated page XML.
 * The XML is percent-encoded before deflating, like JavaScript {@code
 * encodeURIComponent()} does, unless configured otherwise.
 */
final class Envelope {

    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private Envelope() {
        // no instances
    }

    /**
     * @param   text  base64 text; whitespace is ignored
     * @return  the page XML
     * @throws  DataFormatException  if the text cannot be decoded
     */
    static String decompress(String text) throws DataFormatException {
        byte[] deflated;
        try {
            deflated = Base64.getDecoder().decode(stripWhitespace(text));
        } catch (IllegalArgumentException e) {
            throw (DataFormatException)
                    new DataFormatException("Invalid base64: " + e.getMessage()).initCause(e);
        }

        String inflated = decodeUTF8(inflate(deflated));
        if (inflated.startsWith("<"))
            return inflated;

        return percentDecode(inflated);
    }

    static String compress(String xml, boolean uriEncode) {
        byte[] data = uriEncode
                      ? percentEncode(xml).getBytes(StandardCharsets.US_ASCII)
                      : xml.getBytes(StandardCharsets.UTF_8);
        return Base64.getEncoder().encodeToString(deflate(data));
    }

    private static String stripWhitespace(String text) {
        StringBuilder buf = new StringBuilder(text.length());
        for (int i = 0, len = text.length(); i < len; i++) {
            char ch = text.charAt(i);
            if (!Character.isWhitespace(ch)) {
                buf.append(ch);
            }
        }
        return buf.toString();
    }

    private static byte[] inflate(byte[] deflated) throws DataFormatException {
        Inflater inflater = new Inflater(true);
        try {
            // nowrap mode needs an extra "dummy" input byte
            byte[] input = new byte[deflated.length + 1];
            System.arraycopy(deflated, 0, input, 0, deflated.length);
            inflater.setInput(input);

            ByteArrayOutputStream out = new ByteArrayOutputStream(deflated.length * 4);
            byte[] buf = new byte[4096];
            while (!inflater.finished()) {
                int count = inflater.inflate(buf);
                if (count == 0 && (inflater.needsInput() || inflater.needsDictionary()))
                    throw new DataFormatException("Truncated deflate stream");

                out.write(buf, 0, count);
            }
            return out.toByteArray();
        } finally {
            inflater.end();
        }
    }

    private static byte[] deflate(byte[] data) {
        Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, true);
        try {
            deflater.setInput(data);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length / 2 + 16);
            byte[] buf = new byte[4096];
            while (!deflater.finished()) {
                int count = deflater.deflate(buf);
                out.write(buf, 0, count);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private static String decodeUTF8(byte[] bytes) throws DataFormatException {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw (DataFormatException)
                    new DataFormatException("Invalid UTF-8 content").initCause(e);
        }
    }

    /*
     * Inverse of encodeURIComponent(): %XX escapes are UTF-8 bytes.
     */
    static String percentDecode(String text) throws DataFormatException {
        if (text.indexOf('%') < 0)
            return text;

        ByteArrayOutputStream bytes = new ByteArrayOutputStream(text.length());
        for (int i = 0, len = text.length(); i < len; i++) {
            char ch = text.charAt(i);
            if (ch == '%') {
                if (i + 2 >= len)
                    throw new DataFormatException("Incomplete escape at " + i);

                int hi = Character.digit(text.charAt(i + 1), 16);
                int lo = Character.digit(text.charAt(i + 2), 16);
                if (hi < 0 || lo < 0)
                    throw new DataFormatException("Invalid escape at " + i
                            + ": " + text.substring(i, i + 3));

                bytes.write((hi << 4) | lo);
                i += 2;
            } else if (ch < 0x80) {
                bytes.write(ch);
            } else {
                int codePoint = text.codePointAt(i);
                byte[] utf8 = new String(Character.toChars(codePoint))
                        .getBytes(StandardCharsets.UTF_8);
                bytes.write(utf8, 0, utf8.length);
                i += Character.charCount(codePoint) - 1;
            }
        }
        return decodeUTF8(bytes.toByteArray());
    }

    static String percentEncode(String text) {
        byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
        StringBuilder buf = new StringBuilder(utf8.length * 3 / 2);
        for (byte b : utf8) {
            int ch = b & 0xFF;
            if (isUnreserved(ch)) {
                buf.append((char) ch);
            } else {
                buf.append('%').append(HEX_DIGITS[ch >> 4]).append(HEX_DIGITS[ch & 0xF]);
            }
        }
        return buf.toString();
    }

    private static boolean isUnreserved(int ch) {
        return ch >= 'a' && ch <= 'z'
                || ch >= 'A' && ch <= 'Z'
                || ch >= '0' && ch <= '9'
                || "-_.!~*'()".indexOf(ch) >= 0;
    }

}
