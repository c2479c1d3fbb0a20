/*
 * RangeTableStore.java
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

import java.util.List;

/**
 * Source of the static width data: the supported Unicode versions, the
 * range tables for each version, and the version-independent set of
 * zero-width codepoints.
 * <p>
 * Implementations must be immutable once constructed so that a single
 * instance may be shared between threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see UnicodeRangeTableStore
 */
public interface RangeTableStore {

    /**
     * Returns the supported version identifiers in ascending order.
     * The list is never empty; its last element is the latest version.
     *
     * @return unmodifiable list of versions
     */
    List<String> getVersions();

    /**
     * Returns the range table of the given kind for a supported version.
     *
     * @param kind the table kind
     * @param version a member of {@link #getVersions()}
     * @return the table
     * @throws IllegalArgumentException if the version is not supported
     */
    RangeTable lookup(RangeTableKind kind, String version);

    /**
     * Indicates whether the codepoint has zero width in every version.
     *
     * @param codepoint the codepoint
     * @return true if always zero width
     */
    boolean isAlwaysZeroWidth(int codepoint);

}
