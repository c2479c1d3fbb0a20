/*
 * WidthConfiguration.java
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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable settings for display width computation.
 * <p>
 * A configuration holds:
 * <dl>
 * <dt>default version</dt>
 * <dd>the Unicode version used when a caller does not name one,
 * {@value VersionResolver#LATEST} unless changed</dd>
 * <dt>auto version</dt>
 * <dd>the version that {@value VersionResolver#AUTO} stands for,
 * {@value VersionResolver#LATEST} unless changed or read from the
 * environment by {@link #fromEnvironment()}</dd>
 * <dt>overrides</dt>
 * <dd>codepoints displayed two columns wide regardless of the Unicode
 * tables: typographic quotation marks, ellipsis, middle dot, em dash,
 * double angle brackets and the four arrows. This is a display policy for
 * CJK terminal fonts, not a Unicode property.</dd>
 * </dl>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class WidthConfiguration {

    /** System property naming the version that "auto" stands for. */
    public static final String VERSION_PROPERTY = "org.bluezoo.termwidth.unicodeVersion";

    /** Environment variable consulted when the system property is unset. */
    public static final String VERSION_ENVIRONMENT = "UNICODE_VERSION";

    /** The default override set. */
    public static final Set<Integer> DEFAULT_OVERRIDES = Collections.unmodifiableSet(new TreeSet<Integer>(Arrays.asList(
        0x2018, // LEFT SINGLE QUOTATION MARK
        0x2019, // RIGHT SINGLE QUOTATION MARK
        0x201C, // LEFT DOUBLE QUOTATION MARK
        0x201D, // RIGHT DOUBLE QUOTATION MARK
        0x2026, // HORIZONTAL ELLIPSIS
        0x00B7, // MIDDLE DOT
        0x2014, // EM DASH
        0x300A, // LEFT DOUBLE ANGLE BRACKET
        0x300B, // RIGHT DOUBLE ANGLE BRACKET
        0x2190, // LEFTWARDS ARROW
        0x2191, // UPWARDS ARROW
        0x2192, // RIGHTWARDS ARROW
        0x2193  // DOWNWARDS ARROW
    )));

    private static final WidthConfiguration DEFAULT =
        new WidthConfiguration(VersionResolver.LATEST, VersionResolver.LATEST, DEFAULT_OVERRIDES);

    private final String defaultVersion;
    private final String autoVersion;
    private final Set<Integer> overrides;

    private WidthConfiguration(String defaultVersion, String autoVersion, Set<Integer> overrides) {
        this.defaultVersion = defaultVersion;
        this.autoVersion = autoVersion;
        this.overrides = overrides;
    }

    /**
     * Returns the default configuration: latest version, default overrides.
     */
    public static WidthConfiguration getDefault() {
        return DEFAULT;
    }

    /**
     * Returns a configuration whose auto version is taken from the
     * {@value #VERSION_PROPERTY} system property or, failing that, the
     * {@value #VERSION_ENVIRONMENT} environment variable.
     * The environment is read once, here.
     *
     * @return the configuration
     */
    public static WidthConfiguration fromEnvironment() {
        String version = System.getProperty(VERSION_PROPERTY);
        if (version == null || version.isEmpty()) {
            version = System.getenv(VERSION_ENVIRONMENT);
        }
        if (version == null || version.isEmpty()) {
            return DEFAULT;
        }
        return DEFAULT.withAutoVersion(version);
    }

    public String getDefaultVersion() {
        return defaultVersion;
    }

    public String getAutoVersion() {
        return autoVersion;
    }

    /**
     * Returns the override codepoints as an unmodifiable sorted set.
     */
    public Set<Integer> getOverrides() {
        return overrides;
    }

    /**
     * Indicates whether the codepoint is forced to two columns.
     */
    public boolean isOverride(int codepoint) {
        return overrides.contains(codepoint);
    }

    /**
     * Returns a copy using the given version when none is requested.
     *
     * @param version a version, {@value VersionResolver#AUTO} or
     *        {@value VersionResolver#LATEST}
     */
    public WidthConfiguration withDefaultVersion(String version) {
        if (version == null) {
            throw new NullPointerException("version");
        }
        return new WidthConfiguration(version, autoVersion, overrides);
    }

    /**
     * Returns a copy in which {@value VersionResolver#AUTO} stands for the
     * given version.
     *
     * @param version a version or {@value VersionResolver#LATEST}
     */
    public WidthConfiguration withAutoVersion(String version) {
        if (version == null) {
            throw new NullPointerException("version");
        }
        return new WidthConfiguration(defaultVersion, version, overrides);
    }

    /**
     * Returns a copy with the given override codepoints. An empty
     * collection disables overriding.
     *
     * @param codepoints the codepoints to display two columns wide
     */
    public WidthConfiguration withOverrides(Collection<Integer> codepoints) {
        Set<Integer> copy = Collections.unmodifiableSet(new TreeSet<Integer>(codepoints));
        return new WidthConfiguration(defaultVersion, autoVersion, copy);
    }

    @Override
    public String toString() {
        return "WidthConfiguration[defaultVersion=" + defaultVersion
            + ", autoVersion=" + autoVersion
            + ", overrides=" + overrides.size() + "]";
    }

}
