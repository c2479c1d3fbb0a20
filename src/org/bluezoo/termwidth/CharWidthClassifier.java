/*
 * CharWidthClassifier.java
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

import java.util.Set;

/**
 * Classifies single codepoints by the number of terminal columns they
 * occupy.
 * <p>
 * The version argument of each method must already be resolved to a
 * tabulated version; callers resolve once per string, not per
 * codepoint.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CharWidthClassifier {

    /** Raw result for C0 and C1 control characters. */
    public static final int NON_PRINTING = -1;

    private final RangeTableStore store;
    private final Set<Integer> overrides;

    /**
     * Creates a classifier.
     *
     * @param store the range tables
     * @param overrides codepoints forced to width 2
     */
    public CharWidthClassifier(RangeTableStore store, Set<Integer> overrides) {
        this.store = store;
        this.overrides = overrides;
    }

    /**
     * Returns the display width of a codepoint: 0, 1 or 2.
     * <p>
     * Override codepoints are 2; otherwise non-printing characters are
     * reported as 0.
     *
     * @param codepoint the codepoint
     * @param version a tabulated Unicode version
     * @return the width in columns
     */
    public int width(int codepoint, String version) {
        if (overrides.contains(codepoint)) {
            return 2;
        }
        int width = wcwidth(codepoint, version);
        return (width < 0) ? 0 : width;
    }

    /**
     * Returns the table-derived width of a codepoint without the override
     * policy: {@link #NON_PRINTING} for control characters, otherwise 0, 1
     * or 2.
     *
     * @param codepoint the codepoint
     * @param version a tabulated Unicode version
     * @return the raw width
     */
    public int wcwidth(int codepoint, String version) {
        if (store.isAlwaysZeroWidth(codepoint)) {
            return 0;
        }
        // C0 controls, DEL and C1 controls
        if (codepoint < 0x20 || (codepoint >= 0x7F && codepoint < 0xA0)) {
            return NON_PRINTING;
        }
        if (store.lookup(RangeTableKind.ZERO_WIDTH, version).contains(codepoint)) {
            return 0;
        }
        return store.lookup(RangeTableKind.WIDE, version).contains(codepoint) ? 2 : 1;
    }

}
