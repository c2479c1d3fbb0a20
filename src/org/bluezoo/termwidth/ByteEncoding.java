/*
 * ByteEncoding.java
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
 * Declared encoding of a byte buffer whose display width is measured.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum ByteEncoding {

    /**
     * UTF-8. Bytes are decoded and each codepoint classified.
     */
    UTF8(false),

    /**
     * A single-byte terminal encoding. Each byte counts as one column
     * without decoding.
     */
    NARROW(true),

    /**
     * A multibyte legacy terminal encoding. Each byte counts as one
     * column without decoding; a double-byte character occupies two
     * bytes and is displayed two columns wide.
     */
    WIDE(true);

    private final boolean fixedWidth;

    ByteEncoding(boolean fixedWidth) {
        this.fixedWidth = fixedWidth;
    }

    /**
     * Indicates whether the width of a buffer in this encoding is simply
     * its length in bytes.
     */
    public boolean isFixedWidth() {
        return fixedWidth;
    }

}
