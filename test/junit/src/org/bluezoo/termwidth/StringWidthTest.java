/*
 * StringWidthTest.java
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

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link StringWidth}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StringWidthTest {

    private CharWidthClassifier classifier;
    private StringWidth widths;
    private RecordingHandler log;

    @Before
    public void setUp() {
        RangeTableStore store = UnicodeRangeTableStore.getInstance();
        classifier = new CharWidthClassifier(store, WidthConfiguration.DEFAULT_OVERRIDES);
        widths = new StringWidth(classifier, new VersionResolver(store, null));
        log = RecordingHandler.attach(StringWidth.class);
    }

    @After
    public void tearDown() {
        log.detach();
    }

    private int width(String s) {
        return widths.width(s, 0, s.length(), "latest");
    }

    private int width(byte[] data, ByteEncoding encoding) {
        return widths.width(data, 0, data.length, encoding, "latest");
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Text
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testAscii() {
        assertEquals(11, width("hello world"));
    }

    @Test
    public void testMixedWidths() {
        assertEquals(3, width("永A"));
        assertEquals(11, width("日本語 text"));
    }

    @Test
    public void testEmpty() {
        assertEquals(0, width(""));
        assertEquals(0, widths.width("abc", 2, 2, "latest"));
    }

    @Test
    public void testCombiningAndControl() {
        assertEquals(1, width("e\u0301"));
        assertEquals(2, width("a\tb"));
        assertEquals(2, width("a\u200Bb"));
    }

    @Test
    public void testOverrides() {
        assertEquals(5, width("“x”"));
        assertEquals(3, width("a…"));
    }

    @Test
    public void testSubRange() {
        assertEquals(3, widths.width("永A永", 1, 3, "latest"));
        assertEquals(2, widths.width("永A永", 2, 3, "latest"));
    }

    @Test
    public void testSupplementaryCharacters() {
        assertEquals(2, width("😀"));
        assertEquals(4, width("😀😀"));
        assertEquals(2, width("𠀀"));
    }

    @Test
    public void testSurrogatePairSplitByRange() {
        String s = "😀";
        assertEquals(1, widths.width(s, 0, 1, "latest"));
        assertEquals(1, widths.width(s, 1, 2, "latest"));
    }

    @Test
    public void testVersion() {
        assertEquals(2, widths.width("😀", 0, 2, "14.0.0"));
        assertEquals(1, widths.width("😀", 0, 2, "3.2.0"));
        assertEquals(1, widths.width("😀", 0, 2, "4.0"));
    }

    @Test
    public void testStringBuilderInput() {
        StringBuilder buf = new StringBuilder("永");
        buf.append('A');
        assertEquals(3, widths.width(buf, 0, buf.length(), "latest"));
    }

    @Test
    public void testSumOfCharWidths() {
        String s = "Grüße 世界 \u0301\u200B—\t😀 …《》";
        int expected = 0;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            expected += classifier.width(cp, "14.0.0");
            i += Character.charCount(cp);
        }
        assertEquals(expected, width(s));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStartAfterEnd() {
        widths.width("abc", 2, 1, "latest");
    }

    @Test
    public void testInvalidRangeMessage() {
        try {
            widths.width("abc", 3, 0, "latest");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("3"));
        }
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testNegativeStart() {
        widths.width("abc", -1, 2, "latest");
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testEndBeyondText() {
        widths.width("abc", 0, 4, "latest");
    }

    // ─────────────────────────────────────────────────────────────────────────
    // UTF-8 bytes
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testUtf8() {
        assertEquals(3, width(utf8("永A"), ByteEncoding.UTF8));
        assertEquals(2, width(utf8("😀"), ByteEncoding.UTF8));
        assertEquals(0, log.records.size());
    }

    @Test
    public void testUtf8SubRange() {
        byte[] data = utf8("A永B");
        assertEquals(2, widths.width(data, 1, 4, ByteEncoding.UTF8, "latest"));
        assertEquals(0, widths.width(data, 2, 2, ByteEncoding.UTF8, "latest"));
    }

    @Test
    public void testUtf8Malformed() {
        byte[] data = { (byte) 0xc0, (byte) 0x80, 'A' };
        assertEquals(3, width(data, ByteEncoding.UTF8));
        assertEquals(1, log.count(Level.WARNING));
        assertNotNull(log.records.get(0).getThrown());
    }

    @Test
    public void testUtf8RangeInsideSequence() {
        byte[] data = utf8("永A");
        // B0 B8 41: two stray continuation bytes then A
        assertEquals(3, widths.width(data, 1, 4, ByteEncoding.UTF8, "latest"));
        assertEquals(1, log.count(Level.WARNING));
    }

    @Test
    public void testUtf8TruncatedAtEnd() {
        byte[] data = utf8("A永");
        // 41 E6 B0: A then a truncated sequence, two placeholders
        assertEquals(3, widths.width(data, 0, 3, ByteEncoding.UTF8, "latest"));
    }

    @Test
    public void testUtf8LenientSurrogate() {
        byte[] data = { 'a', (byte) 0xed, (byte) 0xa0, (byte) 0x80 };
        assertEquals(2, width(data, ByteEncoding.UTF8));
        assertEquals(1, log.count(Level.WARNING));
    }

    @Test
    public void testUtf8ByteBuffer() {
        ByteBuffer buf = ByteBuffer.wrap(utf8("xx永A"));
        buf.position(2);
        assertEquals(3, widths.width(buf, ByteEncoding.UTF8, "latest"));
        assertEquals(2, buf.position());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Fixed-width bytes
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testNarrowCountsBytes() {
        assertEquals(4, width(utf8("永A"), ByteEncoding.NARROW));
        assertEquals(2, widths.width(utf8("abcd"), 1, 3, ByteEncoding.NARROW, "latest"));
    }

    @Test
    public void testWideCountsBytes() {
        byte[] data = { (byte) 0xb1, (byte) 0xbe, 'A' };
        assertEquals(3, width(data, ByteEncoding.WIDE));
        assertEquals(0, widths.width(data, 3, 3, ByteEncoding.WIDE, "latest"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBytesStartAfterEnd() {
        widths.width(utf8("abc"), 2, 1, ByteEncoding.NARROW, "latest");
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testBytesEndBeyondArray() {
        widths.width(utf8("abc"), 0, 4, ByteEncoding.UTF8, "latest");
    }

}
