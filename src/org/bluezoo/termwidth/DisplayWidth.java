/*
 * DisplayWidth.java
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

import java.nio.ByteBuffer;

/**
 * Entry point for computing the terminal display width of text and for
 * fitting text to a column width.
 * <p>
 * An instance combines a {@link RangeTableStore} with a
 * {@link WidthConfiguration}. Every operation has a form taking an
 * explicit Unicode version; the others use the configuration's default
 * version.
 *
 * <h4>Usage</h4>
 * <pre>{@code
 * DisplayWidth dw = DisplayWidth.getInstance();
 * dw.width("永A");                  // 3
 * dw.charWidth('…');               // 2
 * dw.fit("AB", 5);                 // "AB   "
 *
 * DisplayWidth v9 = new DisplayWidth(WidthConfiguration.getDefault()
 *                                    .withDefaultVersion("9.0.0"));
 * }</pre>
 *
 * <h4>Thread Safety</h4>
 * <p>Instances are immutable and may be shared between threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DisplayWidth {

    /** Default target width of {@link #fit(String)}. */
    public static final int DEFAULT_FIT_WIDTH = 30;

    /** Default padding unit. */
    public static final String DEFAULT_PADDING = " ";

    private static class Holder {
        static final DisplayWidth INSTANCE = new DisplayWidth(WidthConfiguration.fromEnvironment());
    }

    private final WidthConfiguration configuration;
    private final VersionResolver resolver;
    private final CharWidthClassifier classifier;
    private final StringWidth stringWidth;
    private final StringFitter fitter;

    /**
     * Creates an instance using the bundled Unicode tables.
     *
     * @param configuration the configuration
     */
    public DisplayWidth(WidthConfiguration configuration) {
        this(UnicodeRangeTableStore.getInstance(), configuration);
    }

    /**
     * Creates an instance using the given tables.
     *
     * @param store the range tables
     * @param configuration the configuration
     */
    public DisplayWidth(RangeTableStore store, WidthConfiguration configuration) {
        this.configuration = configuration;
        this.resolver = new VersionResolver(store, configuration.getAutoVersion());
        this.classifier = new CharWidthClassifier(store, configuration.getOverrides());
        this.stringWidth = new StringWidth(classifier, resolver);
        this.fitter = new StringFitter(classifier, resolver);
    }

    /**
     * Returns the shared instance, configured from the environment by
     * {@link WidthConfiguration#fromEnvironment()}.
     */
    public static DisplayWidth getInstance() {
        return Holder.INSTANCE;
    }

    public WidthConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Resolves a requested version to the tabulated version used.
     *
     * @param version a version, "auto" or "latest"
     * @return the tabulated version
     */
    public String resolveVersion(String version) {
        return resolver.resolve(version);
    }

    public int width(CharSequence text) {
        return width(text, 0, text.length(), configuration.getDefaultVersion());
    }

    public int width(CharSequence text, String version) {
        return width(text, 0, text.length(), version);
    }

    public int width(CharSequence text, int start, int end) {
        return width(text, start, end, configuration.getDefaultVersion());
    }

    /**
     * Returns the display width of a range of text.
     *
     * @param text the text
     * @param start index of the first UTF-16 code unit
     * @param end index after the last code unit
     * @param version the Unicode version, "auto" or "latest"
     * @return the width in columns
     * @throws IllegalArgumentException if start &gt; end
     * @throws IndexOutOfBoundsException if the range lies outside the text
     */
    public int width(CharSequence text, int start, int end, String version) {
        return stringWidth.width(text, start, end, version);
    }

    public int width(byte[] data, ByteEncoding encoding) {
        return width(data, 0, data.length, encoding, configuration.getDefaultVersion());
    }

    /**
     * Returns the display width of a range of bytes in a declared
     * encoding.
     *
     * @param data the bytes
     * @param start index of the first byte
     * @param end index after the last byte
     * @param encoding the declared encoding
     * @param version the Unicode version, "auto" or "latest"
     * @return the width in columns
     * @throws IllegalArgumentException if start &gt; end
     * @throws IndexOutOfBoundsException if the range lies outside the array
     */
    public int width(byte[] data, int start, int end, ByteEncoding encoding, String version) {
        return stringWidth.width(data, start, end, encoding, version);
    }

    /**
     * Returns the display width of the remaining bytes of a buffer,
     * without changing its position.
     */
    public int width(ByteBuffer buf, ByteEncoding encoding) {
        return stringWidth.width(buf, encoding, configuration.getDefaultVersion());
    }

    public int charWidth(int codepoint) {
        return charWidth(codepoint, configuration.getDefaultVersion());
    }

    /**
     * Returns the display width of a single codepoint: 0, 1 or 2.
     *
     * @param codepoint the codepoint
     * @param version the Unicode version, "auto" or "latest"
     * @return the width in columns
     */
    public int charWidth(int codepoint, String version) {
        return classifier.width(codepoint, resolver.resolve(version));
    }

    /**
     * Fits a string to {@value #DEFAULT_FIT_WIDTH} columns, cutting at the
     * left and padding with spaces at the right.
     */
    public String fit(String s) {
        return fit(s, DEFAULT_FIT_WIDTH);
    }

    /**
     * Fits a string to the given width, cutting at the left and padding
     * with spaces at the right.
     */
    public String fit(String s, int width) {
        return fit(s, width, Alignment.LEFT, Alignment.RIGHT, DEFAULT_PADDING);
    }

    public String fit(String s, int width, Alignment cut, Alignment pad, String padding) {
        return fit(s, width, cut, pad, padding, configuration.getDefaultVersion());
    }

    /**
     * Truncates or pads a string to the given display width.
     *
     * @param s the string
     * @param width the target width, not negative
     * @param cut the side from which characters are removed
     * @param pad the side at which padding is added
     * @param padding the padding unit
     * @param version the Unicode version, "auto" or "latest"
     * @return a string of the target width when padding is one column
     *         wide
     * @see StringFitter
     */
    public String fit(String s, int width, Alignment cut, Alignment pad, String padding, String version) {
        return fitter.fit(s, width, cut, pad, padding, version);
    }

}
