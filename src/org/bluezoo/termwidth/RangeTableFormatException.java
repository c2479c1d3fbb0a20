/*
 * RangeTableFormatException.java
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

import java.io.IOException;

/**
 * Exception thrown when a range table resource cannot be read or does
 * not satisfy the table invariants.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RangeTableFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception with the specified message.
     *
     * @param message the error message
     */
    public RangeTableFormatException(String message) {
        super(message);
    }

    /**
     * Creates a new exception with the specified message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public RangeTableFormatException(String message, Throwable cause) {
        super(message, cause);
    }

}
