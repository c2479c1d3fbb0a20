/*
 * Alignment.java
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
 * The end of a string at which characters are removed or padding added.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum Alignment {

    /** The start of the string. */
    LEFT,

    /** The end of the string. */
    RIGHT;

}
