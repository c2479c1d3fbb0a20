/*
 * CodepointRange.java
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
 * An inclusive range of Unicode codepoints sharing one width
 * classification.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CodepointRange {

    private final int start;
    private final int end;

    /**
     * Creates a new codepoint range.
     *
     * @param start the first codepoint in the range
     * @param end the last codepoint in the range (inclusive)
     * @throws IllegalArgumentException if start is negative or greater
     *         than end
     */
    public CodepointRange(int start, int end) {
        if (start < 0 || start > end) {
            throw new IllegalArgumentException("Invalid codepoint range: " + start + ".." + end);
        }
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * Indicates whether the given codepoint lies within this range.
     *
     * @param codepoint the codepoint to test
     * @return true if start &lt;= codepoint &lt;= end
     */
    public boolean contains(int codepoint) {
        return codepoint >= start && codepoint <= end;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CodepointRange)) {
            return false;
        }
        CodepointRange o = (CodepointRange) other;
        return start == o.start && end == o.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return String.format("U+%04X..U+%04X", start, end);
    }

}
