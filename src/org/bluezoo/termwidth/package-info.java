/*
 * package-info.java
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

/**
 * Terminal display width of Unicode text.
 *
 * <p>This package computes how many columns of a monospaced terminal a
 * string occupies, and truncates or pads strings to a column width.
 * Each codepoint is 0, 1 or 2 columns wide according to versioned Unicode
 * range tables; widths of the codepoints in a string are summed.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.termwidth.DisplayWidth} - entry point for
 *       string and character widths and for fitting</li>
 *   <li>{@link org.bluezoo.termwidth.WidthConfiguration} - default and
 *       auto Unicode versions, override policy</li>
 *   <li>{@link org.bluezoo.termwidth.CharWidthClassifier} - width of one
 *       codepoint</li>
 *   <li>{@link org.bluezoo.termwidth.StringWidth} - width of text and of
 *       UTF-8 or fixed-width bytes</li>
 *   <li>{@link org.bluezoo.termwidth.StringFitter} - cut and pad to an
 *       exact width</li>
 *   <li>{@link org.bluezoo.termwidth.Utf8Decoder} - lenient one-codepoint
 *       UTF-8 decoder</li>
 *   <li>{@link org.bluezoo.termwidth.VersionResolver} - maps requested
 *       versions onto tabulated ones</li>
 *   <li>{@link org.bluezoo.termwidth.RangeTableStore} and
 *       {@link org.bluezoo.termwidth.UnicodeRangeTableStore} - the wide
 *       and zero-width range tables</li>
 * </ul>
 *
 * <h2>Classification</h2>
 *
 * <p>In order: codepoints of the override set are 2; codepoints of the
 * always-zero-width set (NUL, ZERO WIDTH SPACE, directional formatting
 * characters and similar) are 0; C0 and C1 control characters are 0;
 * non-spacing and enclosing marks are 0; East Asian Wide and Fullwidth
 * characters are 2; everything else is 1.
 *
 * <p>Combining sequences, grapheme clusters and bidirectional layout are
 * not considered.
 *
 * <h2>Logging</h2>
 *
 * <p>Invalid Unicode version requests and malformed UTF-8 input are
 * reported at {@code WARNING} level through {@code java.util.logging};
 * neither is an error.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.termwidth;
