/*
 * UnicodeRangeTableStore.java
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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Range table store backed by the table resources shipped with this
 * package.
 * <p>
 * The resources live under {@code tables/} beside this class:
 * <dl>
 * <dt>{@code versions}</dt>
 * <dd>supported Unicode versions, one per line, ascending</dd>
 * <dt>{@code <version>.txt}</dt>
 * <dd>{@code [wide]} and {@code [zero-width]} sections, each a list of
 * inclusive hexadecimal ranges in the form {@code 1100..115F}</dd>
 * <dt>{@code always-zero-width}</dt>
 * <dd>hexadecimal codepoints of zero width in every version</dd>
 * </dl>
 * In every file, text following {@code #} is a comment and blank lines
 * are ignored.
 * <p>
 * The shared instance returned by {@link #getInstance()} is loaded once,
 * on first use, and is immutable thereafter.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class UnicodeRangeTableStore implements RangeTableStore {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.termwidth.L10N");

    private static final Logger LOGGER = Logger.getLogger(UnicodeRangeTableStore.class.getName());

    static final String TABLES = "tables/";
    static final String VERSIONS = "versions";
    static final String ALWAYS_ZERO_WIDTH = "always-zero-width";

    private static final int MAX_CODEPOINT = 0x10FFFF;

    private final List<String> versions;
    private final Map<String,Map<RangeTableKind,RangeTable>> tables;
    private final int[] alwaysZeroWidth;

    private UnicodeRangeTableStore(List<String> versions,
                                   Map<String,Map<RangeTableKind,RangeTable>> tables,
                                   int[] alwaysZeroWidth) {
        this.versions = Collections.unmodifiableList(versions);
        this.tables = tables;
        this.alwaysZeroWidth = alwaysZeroWidth;
    }

    private static class Holder {
        static final UnicodeRangeTableStore INSTANCE = loadDefault();

        private static UnicodeRangeTableStore loadDefault() {
            try {
                return load();
            } catch (IOException e) {
                throw new IllegalStateException(e.getMessage(), e);
            }
        }
    }

    /**
     * Returns the shared store loaded from the bundled resources.
     *
     * @return the shared store
     * @throws IllegalStateException if the bundled tables are unreadable
     */
    public static UnicodeRangeTableStore getInstance() {
        return Holder.INSTANCE;
    }

    /**
     * Loads a new store from the bundled resources.
     *
     * @return the store
     * @throws RangeTableFormatException if a resource is missing or malformed
     * @throws IOException if a resource cannot be read
     */
    public static UnicodeRangeTableStore load() throws IOException {
        List<String> versions = new ArrayList<String>();
        String versionsName = TABLES + VERSIONS;
        try (BufferedReader in = open(versionsName)) {
            String line;
            while ((line = in.readLine()) != null) {
                line = stripComment(line);
                if (!line.isEmpty()) {
                    versions.add(line);
                }
            }
        }
        if (versions.isEmpty()) {
            String msg = MessageFormat.format(L10N.getString("err.no_versions"), versionsName);
            throw new RangeTableFormatException(msg);
        }
        checkVersions(versionsName, versions);
        Map<String,Map<RangeTableKind,RangeTable>> tables = new HashMap<String,Map<RangeTableKind,RangeTable>>();
        for (String version : versions) {
            String name = TABLES + version + ".txt";
            try (BufferedReader in = open(name)) {
                tables.put(version, parseTables(name, in));
            }
        }
        int[] alwaysZeroWidth;
        String zeroName = TABLES + ALWAYS_ZERO_WIDTH;
        try (BufferedReader in = open(zeroName)) {
            alwaysZeroWidth = parseCodepoints(zeroName, in);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString("fine.tables_loaded"), versions);
            LOGGER.fine(msg);
        }
        return new UnicodeRangeTableStore(versions, tables, alwaysZeroWidth);
    }

    /**
     * Versions must parse and be listed in strictly ascending order.
     */
    static void checkVersions(String name, List<String> versions) throws RangeTableFormatException {
        UnicodeVersion previous = null;
        for (int i = 0; i < versions.size(); i++) {
            String version = versions.get(i);
            UnicodeVersion current;
            try {
                current = UnicodeVersion.parse(version);
            } catch (IllegalArgumentException e) {
                String msg = MessageFormat.format(L10N.getString("err.malformed_line"),
                        name, Integer.toString(i + 1), version);
                throw new RangeTableFormatException(msg, e);
            }
            if (previous != null && previous.compareTo(current) >= 0) {
                String msg = MessageFormat.format(L10N.getString("err.unordered_version"), name, version);
                throw new RangeTableFormatException(msg);
            }
            previous = current;
        }
    }

    private static BufferedReader open(String name) throws IOException {
        InputStream in = UnicodeRangeTableStore.class.getResourceAsStream(name);
        if (in == null) {
            String msg = MessageFormat.format(L10N.getString("err.missing_resource"), name);
            throw new RangeTableFormatException(msg);
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.US_ASCII));
    }

    /**
     * Parses one version's table file.
     *
     * @param name the resource name, for error messages
     * @param reader the table source
     * @return a table for every kind
     */
    static Map<RangeTableKind,RangeTable> parseTables(String name, Reader reader) throws IOException {
        BufferedReader in = (reader instanceof BufferedReader) ? (BufferedReader) reader : new BufferedReader(reader);
        Map<RangeTableKind,List<CodepointRange>> sections = new EnumMap<RangeTableKind,List<CodepointRange>>(RangeTableKind.class);
        List<CodepointRange> current = null;
        int previousEnd = -1;
        int lineNumber = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            line = stripComment(line);
            if (line.isEmpty()) {
                continue;
            }
            if (line.charAt(0) == '[') {
                if (line.charAt(line.length() - 1) != ']') {
                    throw malformed(name, lineNumber, line);
                }
                String sectionName = line.substring(1, line.length() - 1).trim();
                RangeTableKind kind = RangeTableKind.fromSectionName(sectionName);
                if (kind == null) {
                    String msg = MessageFormat.format(L10N.getString("err.unknown_section"),
                            name, Integer.toString(lineNumber), sectionName);
                    throw new RangeTableFormatException(msg);
                }
                current = sections.get(kind);
                if (current == null) {
                    current = new ArrayList<CodepointRange>();
                    sections.put(kind, current);
                    previousEnd = -1;
                } else {
                    previousEnd = current.isEmpty() ? -1 : current.get(current.size() - 1).getEnd();
                }
                continue;
            }
            if (current == null) {
                String msg = MessageFormat.format(L10N.getString("err.range_outside_section"),
                        name, Integer.toString(lineNumber));
                throw new RangeTableFormatException(msg);
            }
            CodepointRange range = parseRange(name, lineNumber, line);
            if (range.getStart() <= previousEnd) {
                String msg = MessageFormat.format(L10N.getString("err.unordered_range"),
                        name, Integer.toString(lineNumber), range);
                throw new RangeTableFormatException(msg);
            }
            current.add(range);
            previousEnd = range.getEnd();
        }
        Map<RangeTableKind,RangeTable> result = new EnumMap<RangeTableKind,RangeTable>(RangeTableKind.class);
        for (RangeTableKind kind : RangeTableKind.values()) {
            List<CodepointRange> ranges = sections.get(kind);
            if (ranges == null || ranges.isEmpty()) {
                String msg = MessageFormat.format(L10N.getString("err.missing_section"), name, kind.sectionName);
                throw new RangeTableFormatException(msg);
            }
            result.put(kind, new RangeTable(ranges));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Parses a list of single codepoints, returning them sorted.
     *
     * @param name the resource name, for error messages
     * @param reader the source
     * @return the sorted codepoints
     */
    static int[] parseCodepoints(String name, Reader reader) throws IOException {
        BufferedReader in = (reader instanceof BufferedReader) ? (BufferedReader) reader : new BufferedReader(reader);
        int[] codepoints = new int[32];
        int count = 0;
        int lineNumber = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            line = stripComment(line);
            if (line.isEmpty()) {
                continue;
            }
            int codepoint = parseCodepoint(name, lineNumber, line, line);
            if (count == codepoints.length) {
                codepoints = Arrays.copyOf(codepoints, count * 2);
            }
            codepoints[count++] = codepoint;
        }
        codepoints = Arrays.copyOf(codepoints, count);
        Arrays.sort(codepoints);
        return codepoints;
    }

    private static CodepointRange parseRange(String name, int lineNumber, String line)
            throws RangeTableFormatException {
        int dots = line.indexOf("..");
        if (dots < 0) {
            throw malformed(name, lineNumber, line);
        }
        int start = parseCodepoint(name, lineNumber, line, line.substring(0, dots));
        int end = parseCodepoint(name, lineNumber, line, line.substring(dots + 2));
        if (start > end) {
            throw malformed(name, lineNumber, line);
        }
        return new CodepointRange(start, end);
    }

    private static int parseCodepoint(String name, int lineNumber, String line, String text)
            throws RangeTableFormatException {
        try {
            int codepoint = Integer.parseInt(text.trim(), 16);
            if (codepoint < 0 || codepoint > MAX_CODEPOINT) {
                throw malformed(name, lineNumber, line);
            }
            return codepoint;
        } catch (NumberFormatException e) {
            String msg = MessageFormat.format(L10N.getString("err.malformed_line"),
                    name, Integer.toString(lineNumber), line);
            throw new RangeTableFormatException(msg, e);
        }
    }

    private static RangeTableFormatException malformed(String name, int lineNumber, String line) {
        String msg = MessageFormat.format(L10N.getString("err.malformed_line"),
                name, Integer.toString(lineNumber), line);
        return new RangeTableFormatException(msg);
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        if (hash >= 0) {
            line = line.substring(0, hash);
        }
        return line.trim();
    }

    @Override
    public List<String> getVersions() {
        return versions;
    }

    @Override
    public RangeTable lookup(RangeTableKind kind, String version) {
        Map<RangeTableKind,RangeTable> versionTables = tables.get(version);
        if (versionTables == null) {
            String msg = MessageFormat.format(L10N.getString("err.unsupported_version"), version);
            throw new IllegalArgumentException(msg);
        }
        return versionTables.get(kind);
    }

    @Override
    public boolean isAlwaysZeroWidth(int codepoint) {
        return Arrays.binarySearch(alwaysZeroWidth, codepoint) >= 0;
    }

}
