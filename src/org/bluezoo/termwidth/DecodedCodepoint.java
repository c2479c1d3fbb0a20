/*
 * DecodedCodepoint.java
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

/**
 * Result of decoding one codepoint from a byte sequence.
 * Contains the codepoint and how many bytes were consumed to produce it.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DecodedCodepoint {

    private final int codepoint;
    private final int length;

    DecodedCodepoint(int codepoint, int length) {
        this.codepoint = codepoint;
        this.length = length;
    }

    /**
     * Returns the decoded codepoint, or {@link Utf8Decoder#REPLACEMENT}
     * if the bytes were malformed.
     */
    public int getCodepoint() {
        return codepoint;
    }

    /**
     * Returns the number of bytes consumed: 1 to 4, always 1 on error.
     */
    public int getLength() {
        return length;
    }

    @Override
    public String toString() {
        return String.format("U+%04X/%d", codepoint, length);
    }

}
