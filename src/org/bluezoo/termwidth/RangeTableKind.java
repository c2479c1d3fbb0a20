/*
 * RangeTableKind.java
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
 * The versioned range tables consulted by the width classifier.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum RangeTableKind {

    /** East Asian Wide and Fullwidth characters, two columns. */
    WIDE("wide"),

    /** Non-spacing and enclosing marks, no columns. */
    ZERO_WIDTH("zero-width");

    /** Section name in the table resource files */
    final String sectionName;

    RangeTableKind(String sectionName) {
        this.sectionName = sectionName;
    }

    /**
     * Returns the kind for a table section name.
     *
     * @param name the section name, e.g. "wide"
     * @return the kind, or null if the name is not recognised
     */
    static RangeTableKind fromSectionName(String name) {
        for (RangeTableKind kind : values()) {
            if (kind.sectionName.equals(name)) {
                return kind;
            }
        }
        return null;
    }

}
