/*
 * Utf8DecoderTest.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of termwidth, a Unicode display width library.
 * For more information please visit https://www.nongnu.org/gumdrop/
 *
 * termwidth is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * termwidth is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with termwidth.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.termwidth;

import org.junit.Test;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Random;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link Utf8Decoder}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Utf8DecoderTest {

    private static byte[] bytes(int... values) {
        byte[] b = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            b[i] = (byte) values[i];
        }
        return b;
    }

    private static void assertDecoded(int codepoint, int length, DecodedCodepoint decoded) {
        assertEquals(codepoint, decoded.getCodepoint());
        assertEquals(length, decoded.getLength());
    }

    private static void assertError(DecodedCodepoint decoded) {
        assertDecoded(Utf8Decoder.REPLACEMENT, 1, decoded);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Well-formed sequences
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testAscii() {
        assertDecoded('A', 1, Utf8Decoder.decode(bytes('A'), 0, 1));
        assertDecoded(0, 1, Utf8Decoder.decode(bytes(0), 0, 1));
        assertDecoded(0x7f, 1, Utf8Decoder.decode(bytes(0x7f), 0, 1));
    }

    @Test
    public void testTwoBytes() {
        assertDecoded(0xe9, 2, Utf8Decoder.decode(bytes(0xc3, 0xa9), 0, 2));
        assertDecoded(0x80, 2, Utf8Decoder.decode(bytes(0xc2, 0x80), 0, 2));
        assertDecoded(0x7ff, 2, Utf8Decoder.decode(bytes(0xdf, 0xbf), 0, 2));
    }

    @Test
    public void testThreeBytes() {
        byte[] data = "永".getBytes(StandardCharsets.UTF_8);
        assertDecoded(0x6c38, 3, Utf8Decoder.decode(data, 0, data.length));
        assertDecoded(0x800, 3, Utf8Decoder.decode(bytes(0xe0, 0xa0, 0x80), 0, 3));
        assertDecoded(0xffff, 3, Utf8Decoder.decode(bytes(0xef, 0xbf, 0xbf), 0, 3));
    }

    @Test
    public void testFourBytes() {
        byte[] data = new String(Character.toChars(0x1f600)).getBytes(StandardCharsets.UTF_8);
        assertDecoded(0x1f600, 4, Utf8Decoder.decode(data, 0, data.length));
        assertDecoded(0x10000, 4, Utf8Decoder.decode(bytes(0xf0, 0x90, 0x80, 0x80), 0, 4));
        assertDecoded(0x10ffff, 4, Utf8Decoder.decode(bytes(0xf4, 0x8f, 0xbf, 0xbf), 0, 4));
    }

    @Test
    public void testSurrogateDecodedLeniently() {
        assertDecoded(0xd800, 3, Utf8Decoder.decode(bytes(0xed, 0xa0, 0x80), 0, 3));
    }

    @Test
    public void testDecodeAtOffset() {
        byte[] data = "aé永".getBytes(StandardCharsets.UTF_8);
        assertDecoded(0xe9, 2, Utf8Decoder.decode(data, 1, data.length));
        assertDecoded(0x6c38, 3, Utf8Decoder.decode(data, 3, data.length));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Malformed sequences
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testOverlongNul() {
        assertError(Utf8Decoder.decode(bytes(0xc0, 0x80), 0, 2));
    }

    @Test
    public void testOverlongThreeAndFourBytes() {
        assertError(Utf8Decoder.decode(bytes(0xe0, 0x80, 0xaf), 0, 3));
        assertError(Utf8Decoder.decode(bytes(0xf0, 0x80, 0x80, 0xaf), 0, 4));
        assertError(Utf8Decoder.decode(bytes(0xc1, 0xbf), 0, 2));
    }

    @Test
    public void testTruncated() {
        assertError(Utf8Decoder.decode(bytes(0xc3), 0, 1));
        assertError(Utf8Decoder.decode(bytes(0xe6, 0xb0), 0, 2));
        assertError(Utf8Decoder.decode(bytes(0xf0, 0x9f, 0x98), 0, 3));
    }

    @Test
    public void testTruncatedByLimit() {
        byte[] data = "永".getBytes(StandardCharsets.UTF_8);
        assertError(Utf8Decoder.decode(data, 0, 2));
    }

    @Test
    public void testBadContinuation() {
        assertError(Utf8Decoder.decode(bytes(0xc3, 0x41), 0, 2));
        assertError(Utf8Decoder.decode(bytes(0xe6, 0xb0, 0x41), 0, 3));
        assertError(Utf8Decoder.decode(bytes(0xe6, 0x41, 0xb8), 0, 3));
        assertError(Utf8Decoder.decode(bytes(0xf0, 0x9f, 0x98, 0xc0), 0, 4));
    }

    @Test
    public void testLoneContinuationByte() {
        assertError(Utf8Decoder.decode(bytes(0x80), 0, 1));
        assertError(Utf8Decoder.decode(bytes(0xbf, 0x80, 0x80, 0x80), 0, 4));
    }

    @Test
    public void testInvalidLeadBytes() {
        assertError(Utf8Decoder.decode(bytes(0xf8, 0x88, 0x80, 0x80, 0x80), 0, 5));
        assertError(Utf8Decoder.decode(bytes(0xff, 0x80, 0x80, 0x80), 0, 4));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testPositionAtLimit() {
        Utf8Decoder.decode(bytes('a'), 1, 1);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testLimitBeyondArray() {
        Utf8Decoder.decode(bytes('a'), 0, 2);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // ByteBuffer form
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testRelativeDecodeAdvancesPosition() {
        ByteBuffer buf = ByteBuffer.wrap("aé永".getBytes(StandardCharsets.UTF_8));
        assertEquals('a', Utf8Decoder.decode(buf));
        assertEquals(1, buf.position());
        assertEquals(0xe9, Utf8Decoder.decode(buf));
        assertEquals(3, buf.position());
        assertEquals(0x6c38, Utf8Decoder.decode(buf));
        assertFalse(buf.hasRemaining());
    }

    @Test
    public void testRelativeDecodeOverlongAdvancesOneByte() {
        ByteBuffer buf = ByteBuffer.wrap(bytes(0xc0, 0x80));
        assertEquals('?', Utf8Decoder.decode(buf));
        assertEquals(1, buf.position());
        assertEquals('?', Utf8Decoder.decode(buf));
        assertEquals(2, buf.position());
    }

    @Test
    public void testDirectBuffer() {
        byte[] data = "永".getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocateDirect(data.length);
        buf.put(data);
        buf.flip();
        assertDecoded(0x6c38, 3, Utf8Decoder.decode(buf, 0, buf.limit()));
        assertEquals(0, buf.position());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Progress
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testAlwaysReachesEnd() {
        Random random = new Random(20251018L);
        for (int trial = 0; trial < 500; trial++) {
            byte[] data = new byte[random.nextInt(64) + 1];
            random.nextBytes(data);
            int pos = 0;
            int steps = 0;
            while (pos < data.length) {
                DecodedCodepoint decoded = Utf8Decoder.decode(data, pos, data.length);
                assertTrue(decoded.getLength() >= 1 && decoded.getLength() <= 4);
                pos += decoded.getLength();
                steps++;
            }
            assertEquals(data.length, pos);
            assertTrue(steps <= data.length);
        }
    }

    @Test
    public void testAgreesWithStrictDecoderOnValidInput() {
        String text = "Grüße, 世界 😀 \u0301!";
        byte[] data = text.getBytes(StandardCharsets.UTF_8);
        int pos = 0;
        int index = 0;
        while (pos < data.length) {
            DecodedCodepoint decoded = Utf8Decoder.decode(data, pos, data.length);
            assertEquals(text.codePointAt(index), decoded.getCodepoint());
            index += Character.charCount(decoded.getCodepoint());
            pos += decoded.getLength();
        }
        assertEquals(text.length(), index);
    }

}
