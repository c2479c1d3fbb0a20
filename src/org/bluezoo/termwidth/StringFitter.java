/*
 * StringFitter.java
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

import java.text.MessageFormat;
import java.util.ResourceBundle;

/**
 * Truncates or pads a string to an exact display width.
 * <p>
 * The width of the string is computed once. Characters are then removed
 * from the cut side, one codepoint at a time, until the remainder fits;
 * a deficit (including one left by removing a wide character) is filled
 * by repeating the padding string at the pad side. With a padding string
 * one column wide the result is always exactly the requested width; a
 * wider padding string may overshoot by less than its own width.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StringFitter {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.termwidth.L10N");

    private final CharWidthClassifier classifier;
    private final VersionResolver resolver;
    private final StringWidth widths;

    public StringFitter(CharWidthClassifier classifier, VersionResolver resolver) {
        this.classifier = classifier;
        this.resolver = resolver;
        this.widths = new StringWidth(classifier, resolver);
    }

    /**
     * Fits a string to the given display width.
     *
     * @param s the string
     * @param width the target width in columns
     * @param cut the side from which characters are removed
     * @param pad the side at which padding is added
     * @param padding the padding unit, usually a single space
     * @param version the requested Unicode version
     * @return the fitted string
     * @throws IllegalArgumentException if width is negative, an argument
     *         other than version is null, or padding is needed and the
     *         padding string has no width
     */
    public String fit(String s, int width, Alignment cut, Alignment pad, String padding, String version) {
        if (width < 0) {
            String msg = MessageFormat.format(L10N.getString("err.negative_width"), Integer.toString(width));
            throw new IllegalArgumentException(msg);
        }
        if (s == null) {
            throw new IllegalArgumentException(MessageFormat.format(L10N.getString("err.null_argument"), "s"));
        }
        if (cut == null) {
            throw new IllegalArgumentException(MessageFormat.format(L10N.getString("err.null_argument"), "cut"));
        }
        if (pad == null) {
            throw new IllegalArgumentException(MessageFormat.format(L10N.getString("err.null_argument"), "pad"));
        }
        if (padding == null) {
            throw new IllegalArgumentException(MessageFormat.format(L10N.getString("err.null_argument"), "padding"));
        }
        String resolvedVersion = resolver.resolve(version);
        int length = s.length();
        int total = widths.sum(s, 0, length, resolvedVersion);
        if (total > width) {
            if (cut == Alignment.LEFT) {
                int i = 0;
                while (total > width) {
                    int codepoint = StringWidth.codePointAt(s, i, length);
                    total -= classifier.width(codepoint, resolvedVersion);
                    i += Character.charCount(codepoint);
                }
                s = s.substring(i);
            } else {
                int j = length;
                while (total > width) {
                    int codepoint = Character.codePointBefore(s, j);
                    total -= classifier.width(codepoint, resolvedVersion);
                    j -= Character.charCount(codepoint);
                }
                s = s.substring(0, j);
            }
        }
        if (total < width) {
            int padWidth = widths.sum(padding, 0, padding.length(), resolvedVersion);
            if (padWidth == 0) {
                String msg = MessageFormat.format(L10N.getString("err.zero_width_pad"), padding);
                throw new IllegalArgumentException(msg);
            }
            int count = (width - total + padWidth - 1) / padWidth;
            StringBuilder buf = new StringBuilder(s.length() + count * padding.length());
            if (pad == Alignment.RIGHT) {
                buf.append(s);
            }
            for (int i = 0; i < count; i++) {
                buf.append(padding);
            }
            if (pad == Alignment.LEFT) {
                buf.append(s);
            }
            s = buf.toString();
        }
        return s;
    }

}
