/*
 * RangeTable.java
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable, sorted sequence of non-overlapping codepoint ranges.
 * <p>
 * Membership is tested by binary search over the ranges. The starts and
 * ends are held in parallel int arrays so that a lookup touches no objects.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class RangeTable {

    private final int[] starts;
    private final int[] ends;

    /**
     * Creates a table from the given ranges.
     *
     * @param ranges the ranges, ascending by start and non-overlapping
     * @throws IllegalArgumentException if the ranges are empty, unsorted
     *         or overlapping
     */
    public RangeTable(List<CodepointRange> ranges) {
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("Range table must not be empty");
        }
        int count = ranges.size();
        starts = new int[count];
        ends = new int[count];
        int previousEnd = -1;
        for (int i = 0; i < count; i++) {
            CodepointRange range = ranges.get(i);
            if (range.getStart() <= previousEnd) {
                throw new IllegalArgumentException("Range " + range + " overlaps or precedes previous range");
            }
            starts[i] = range.getStart();
            ends[i] = range.getEnd();
            previousEnd = range.getEnd();
        }
    }

    /**
     * Convenience factory taking pairs of inclusive bounds.
     *
     * @param bounds start, end, start, end...
     * @return the table
     */
    public static RangeTable of(int... bounds) {
        if (bounds.length % 2 != 0) {
            throw new IllegalArgumentException("Bounds must be given in pairs");
        }
        List<CodepointRange> ranges = new ArrayList<CodepointRange>(bounds.length / 2);
        for (int i = 0; i < bounds.length; i += 2) {
            ranges.add(new CodepointRange(bounds[i], bounds[i + 1]));
        }
        return new RangeTable(ranges);
    }

    /**
     * Indicates whether the codepoint falls within any range of this table.
     *
     * @param codepoint the codepoint to look up
     * @return true if the codepoint is a member of the table
     */
    public boolean contains(int codepoint) {
        int low = 0;
        int high = starts.length - 1;
        if (codepoint < starts[0] || codepoint > ends[high]) {
            return false;
        }
        while (high >= low) {
            int mid = (low + high) >>> 1;
            if (codepoint > ends[mid]) {
                low = mid + 1;
            } else if (codepoint < starts[mid]) {
                high = mid - 1;
            } else {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the number of ranges in this table.
     */
    public int size() {
        return starts.length;
    }

    /**
     * Returns the range at the given index.
     *
     * @param index the index, 0 &lt;= index &lt; size()
     * @return the range
     */
    public CodepointRange get(int index) {
        return new CodepointRange(starts[index], ends[index]);
    }

    /**
     * Returns the ranges of this table as an unmodifiable list.
     */
    public List<CodepointRange> getRanges() {
        List<CodepointRange> ranges = new ArrayList<CodepointRange>(starts.length);
        for (int i = 0; i < starts.length; i++) {
            ranges.add(new CodepointRange(starts[i], ends[i]));
        }
        return Collections.unmodifiableList(ranges);
    }

}
