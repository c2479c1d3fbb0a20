/*
 * Utf8Decoder.java
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

import java.nio.ByteBuffer;

/**
 * Lenient decoder for UTF-8 byte sequences, one codepoint at a time.
 * <p>
 * Each call consumes exactly one well-formed sequence of 1 to 4 bytes.
 * If the sequence at the position is truncated by the limit, has a
 * continuation byte not of the form {@code 10xxxxxx}, is an overlong
 * encoding, or starts with a byte that cannot lead a sequence, the
 * decoder returns {@link #REPLACEMENT} and consumes exactly one byte.
 * Decoding a buffer from start to limit therefore always terminates.
 * <p>
 * Surrogate codepoints and values above U+10FFFF that are otherwise well
 * formed are returned as decoded.
 *
 * <h4>Usage</h4>
 * <pre>{@code
 * int pos = start;
 * while (pos < end) {
 *     DecodedCodepoint decoded = Utf8Decoder.decode(data, pos, end);
 *     process(decoded.getCodepoint());
 *     pos += decoded.getLength();
 * }
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Utf8Decoder {

    /** Placeholder returned for a malformed sequence. */
    public static final int REPLACEMENT = '?';

    private static final DecodedCodepoint ERROR = new DecodedCodepoint(REPLACEMENT, 1);

    private Utf8Decoder() {
        // Static utility class
    }

    /**
     * Decodes the codepoint starting at {@code pos} in a byte array.
     *
     * @param data the bytes
     * @param pos the index of the lead byte
     * @param limit the index after the last byte that may be read
     * @return the codepoint and number of bytes consumed
     * @throws IndexOutOfBoundsException if pos is not before limit or the
     *         limit exceeds the array
     */
    public static DecodedCodepoint decode(byte[] data, int pos, int limit) {
        if (limit > data.length) {
            throw new IndexOutOfBoundsException("limit " + limit + " exceeds length " + data.length);
        }
        return decode(ByteBuffer.wrap(data), pos, limit);
    }

    /**
     * Decodes the codepoint starting at absolute index {@code pos} in a
     * buffer. The buffer's position is not changed.
     *
     * @param buf the buffer
     * @param pos the index of the lead byte
     * @param limit the index after the last byte that may be read
     * @return the codepoint and number of bytes consumed
     * @throws IndexOutOfBoundsException if pos is not before limit or the
     *         limit exceeds the buffer's limit
     */
    public static DecodedCodepoint decode(ByteBuffer buf, int pos, int limit) {
        if (pos < 0 || pos >= limit || limit > buf.limit()) {
            throw new IndexOutOfBoundsException("position " + pos + ", limit " + limit);
        }
        int b1 = buf.get(pos) & 0xff;
        if ((b1 & 0x80) == 0) {
            return new DecodedCodepoint(b1, 1);
        }
        int available = limit - pos;
        if (available < 2) {
            return ERROR;
        }
        int b2 = buf.get(pos + 1) & 0xff;
        if ((b1 & 0xe0) == 0xc0) {
            if ((b2 & 0xc0) != 0x80) {
                return ERROR;
            }
            int c = ((b1 & 0x1f) << 6) | (b2 & 0x3f);
            return (c < 0x80) ? ERROR : new DecodedCodepoint(c, 2);
        }
        if (available < 3) {
            return ERROR;
        }
        int b3 = buf.get(pos + 2) & 0xff;
        if ((b1 & 0xf0) == 0xe0) {
            if ((b2 & 0xc0) != 0x80 || (b3 & 0xc0) != 0x80) {
                return ERROR;
            }
            int c = ((b1 & 0x0f) << 12) | ((b2 & 0x3f) << 6) | (b3 & 0x3f);
            return (c < 0x800) ? ERROR : new DecodedCodepoint(c, 3);
        }
        if (available < 4) {
            return ERROR;
        }
        int b4 = buf.get(pos + 3) & 0xff;
        if ((b1 & 0xf8) == 0xf0) {
            if ((b2 & 0xc0) != 0x80 || (b3 & 0xc0) != 0x80 || (b4 & 0xc0) != 0x80) {
                return ERROR;
            }
            int c = ((b1 & 0x07) << 18) | ((b2 & 0x3f) << 12) | ((b3 & 0x3f) << 6) | (b4 & 0x3f);
            return (c < 0x10000) ? ERROR : new DecodedCodepoint(c, 4);
        }
        // continuation byte or 0xf8-0xff in lead position
        return ERROR;
    }

    /**
     * Decodes the codepoint at the buffer's position and advances the
     * position past the bytes consumed.
     *
     * @param buf a buffer with at least one byte remaining
     * @return the codepoint, or {@link #REPLACEMENT}
     */
    public static int decode(ByteBuffer buf) {
        DecodedCodepoint decoded = decode(buf, buf.position(), buf.limit());
        buf.position(buf.position() + decoded.getLength());
        return decoded.getCodepoint();
    }

}
