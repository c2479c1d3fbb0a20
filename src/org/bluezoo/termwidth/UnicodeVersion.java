/*
 * UnicodeVersion.java
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

import java.math.BigInteger;
import java.util.Arrays;

/**
 * A dotted version number such as 9.0.0, compared component by component.
 * <p>
 * Versions of different lengths compare as tuples: when one is a prefix of
 * the other the shorter one is lower, so 9.0 &lt; 9.0.0. Components are
 * arbitrarily large integers, possibly negative.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
final class UnicodeVersion implements Comparable<UnicodeVersion> {

    private final BigInteger[] components;

    private UnicodeVersion(BigInteger[] components) {
        this.components = components;
    }

    /**
     * Parses a version string.
     *
     * @param text the dotted version, e.g. "14.0.0"
     * @return the version
     * @throws IllegalArgumentException if any component is not an integer
     */
    static UnicodeVersion parse(String text) {
        String[] parts = text.split("\\.", -1);
        BigInteger[] components = new BigInteger[parts.length];
        for (int i = 0; i < parts.length; i++) {
            components[i] = new BigInteger(parts[i].trim());
        }
        return new UnicodeVersion(components);
    }

    /**
     * Indicates whether this version equals the leading components of
     * the other, e.g. 9 is a prefix of 9.0.0.
     */
    boolean isPrefixOf(UnicodeVersion other) {
        if (components.length > other.components.length) {
            return false;
        }
        for (int i = 0; i < components.length; i++) {
            if (!components[i].equals(other.components[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compareTo(UnicodeVersion other) {
        int length = Math.min(components.length, other.components.length);
        for (int i = 0; i < length; i++) {
            int c = components[i].compareTo(other.components[i]);
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(components.length, other.components.length);
    }

    @Override
    public boolean equals(Object other) {
        return (other instanceof UnicodeVersion)
            && Arrays.equals(components, ((UnicodeVersion) other).components);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(components);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < components.length; i++) {
            if (i > 0) {
                buf.append('.');
            }
            buf.append(components[i]);
        }
        return buf.toString();
    }

}
