/*
 * StringWidth.java
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
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sums the display widths of the codepoints in a range of text or bytes.
 * <p>
 * The Unicode version is resolved once per call. Text is indexed in UTF-16
 * code units: a surrogate pair lying wholly within the range counts as one
 * codepoint, an unpaired surrogate as a codepoint of its own.
 * <p>
 * UTF-8 bytes are first decoded strictly. If that fails the bytes are
 * decoded again leniently by {@link Utf8Decoder}, each malformed byte
 * counting as a {@code '?'}, and a warning is logged since the result may
 * be inaccurate (for instance when the range begins inside a multibyte
 * sequence).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StringWidth {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.termwidth.L10N");

    private static final Logger LOGGER = Logger.getLogger(StringWidth.class.getName());

    private final CharWidthClassifier classifier;
    private final VersionResolver resolver;

    /**
     * Creates a string width aggregator.
     *
     * @param classifier the per-codepoint classifier
     * @param resolver the version resolver
     */
    public StringWidth(CharWidthClassifier classifier, VersionResolver resolver) {
        this.classifier = classifier;
        this.resolver = resolver;
    }

    /**
     * Returns the display width of {@code text[start, end)}.
     *
     * @param text the text
     * @param start index of the first code unit
     * @param end index after the last code unit
     * @param version the requested Unicode version
     * @return the width in columns, never negative
     * @throws IllegalArgumentException if start &gt; end
     * @throws IndexOutOfBoundsException if the range is outside the text
     */
    public int width(CharSequence text, int start, int end, String version) {
        checkRange(start, end, text.length());
        if (start == end) {
            return 0;
        }
        return sum(text, start, end, resolver.resolve(version));
    }

    /**
     * Returns the display width of {@code data[start, end)} in the given
     * encoding. Fixed-width encodings count one column per byte.
     *
     * @param data the bytes
     * @param start index of the first byte
     * @param end index after the last byte
     * @param encoding the declared encoding
     * @param version the requested Unicode version
     * @return the width in columns, never negative
     * @throws IllegalArgumentException if start &gt; end
     * @throws IndexOutOfBoundsException if the range is outside the array
     */
    public int width(byte[] data, int start, int end, ByteEncoding encoding, String version) {
        checkRange(start, end, data.length);
        return width(ByteBuffer.wrap(data, start, end - start), encoding, version);
    }

    /**
     * Returns the display width of the bytes between the buffer's
     * position and limit. The buffer's position is not changed.
     *
     * @param buf the bytes
     * @param encoding the declared encoding
     * @param version the requested Unicode version
     * @return the width in columns, never negative
     */
    public int width(ByteBuffer buf, ByteEncoding encoding, String version) {
        int start = buf.position();
        int end = buf.limit();
        if (start == end) {
            return 0;
        }
        switch (encoding) {
            case UTF8:
                return utf8Width(buf, start, end, resolver.resolve(version));
            case NARROW:
            case WIDE:
                return end - start;
            default:
                throw new IllegalArgumentException(encoding.name());
        }
    }

    /**
     * Sums widths over a range of text already checked, with a resolved
     * version.
     */
    int sum(CharSequence text, int start, int end, String resolvedVersion) {
        int total = 0;
        int i = start;
        while (i < end) {
            int codepoint = codePointAt(text, i, end);
            total += classifier.width(codepoint, resolvedVersion);
            i += Character.charCount(codepoint);
        }
        return total;
    }

    /**
     * Returns the codepoint at index, combining a surrogate pair only if
     * both halves lie before the limit.
     */
    static int codePointAt(CharSequence text, int index, int limit) {
        char c = text.charAt(index);
        if (Character.isHighSurrogate(c) && index + 1 < limit) {
            char low = text.charAt(index + 1);
            if (Character.isLowSurrogate(low)) {
                return Character.toCodePoint(c, low);
            }
        }
        return c;
    }

    private int utf8Width(ByteBuffer buf, int start, int end, String resolvedVersion) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer chars = decoder.decode(buf.duplicate());
            return sum(chars, 0, chars.length(), resolvedVersion);
        } catch (CharacterCodingException e) {
            if (LOGGER.isLoggable(Level.WARNING)) {
                String msg = MessageFormat.format(L10N.getString("warn.decode_error"), e.toString());
                LOGGER.log(Level.WARNING, msg, e);
            }
        }
        int total = 0;
        int pos = start;
        while (pos < end) {
            DecodedCodepoint decoded = Utf8Decoder.decode(buf, pos, end);
            total += classifier.width(decoded.getCodepoint(), resolvedVersion);
            pos += decoded.getLength();
        }
        return total;
    }

    /**
     * Validates a code unit or byte range against a sequence length.
     */
    static void checkRange(int start, int end, int length) {
        if (start > end) {
            String msg = MessageFormat.format(L10N.getString("err.invalid_range"),
                    Integer.toString(start), Integer.toString(end));
            throw new IllegalArgumentException(msg);
        }
        if (start < 0 || end > length) {
            String msg = MessageFormat.format(L10N.getString("err.offset_out_of_bounds"),
                    Integer.toString(start), Integer.toString(end), Integer.toString(length));
            throw new IndexOutOfBoundsException(msg);
        }
    }

}
