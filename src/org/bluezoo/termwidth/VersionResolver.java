/*
 * VersionResolver.java
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
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Logger;

/**
 * Maps a requested Unicode version onto one of the versions for which the
 * store has tables.
 * <p>
 * Resolution never fails. The requested value is handled as follows:
 * <ol>
 * <li>{@value #AUTO} is replaced by the configured auto version, itself
 * {@value #LATEST} when unset or also {@value #AUTO}</li>
 * <li>{@value #LATEST} selects the last tabulated version</li>
 * <li>a tabulated version is returned unchanged</li>
 * <li>an unparseable value logs a warning and selects the latest
 * version</li>
 * <li>a value at or below the earliest version logs a warning and
 * selects the earliest version</li>
 * <li>otherwise the tabulated versions are scanned in ascending order: a
 * value that is a prefix of the next version (9 for 9.0.0) selects that
 * version, and a value lower than the next version selects the current
 * one</li>
 * <li>a value beyond the last version selects the latest version</li>
 * </ol>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class VersionResolver {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.termwidth.L10N");

    private static final Logger LOGGER = Logger.getLogger(VersionResolver.class.getName());

    /** Requests the configured version. */
    public static final String AUTO = "auto";

    /** Requests the highest tabulated version. */
    public static final String LATEST = "latest";

    private final RangeTableStore store;
    private final String autoVersion;

    /**
     * Creates a resolver over the given store.
     *
     * @param store the table store
     * @param autoVersion the version that {@value #AUTO} stands for, or
     *        null for {@value #LATEST}
     */
    public VersionResolver(RangeTableStore store, String autoVersion) {
        this.store = store;
        this.autoVersion = (autoVersion == null || AUTO.equals(autoVersion)) ? LATEST : autoVersion;
    }

    /**
     * Returns the version that {@value #AUTO} stands for.
     */
    public String getAutoVersion() {
        return autoVersion;
    }

    /**
     * Resolves a requested version to a tabulated one.
     *
     * @param requested the requested version, {@value #AUTO} or
     *        {@value #LATEST}; null is taken as {@value #LATEST}
     * @return a member of the store's version list
     */
    public String resolve(String requested) {
        String given = (requested == null) ? LATEST : requested;
        if (AUTO.equals(given)) {
            given = autoVersion;
        }
        List<String> versions = store.getVersions();
        String latest = versions.get(versions.size() - 1);
        if (LATEST.equals(given)) {
            return latest;
        }
        if (versions.contains(given)) {
            return given;
        }
        UnicodeVersion cmpGiven;
        try {
            cmpGiven = UnicodeVersion.parse(given);
        } catch (IllegalArgumentException e) {
            String msg = MessageFormat.format(L10N.getString("warn.invalid_version"), given, latest);
            LOGGER.warning(msg);
            return latest;
        }
        String earliest = versions.get(0);
        if (cmpGiven.compareTo(UnicodeVersion.parse(earliest)) <= 0) {
            String msg = MessageFormat.format(L10N.getString("warn.version_too_low"), given, earliest);
            LOGGER.warning(msg);
            return earliest;
        }
        for (int i = 0; i < versions.size() - 1; i++) {
            String next = versions.get(i + 1);
            UnicodeVersion cmpNext = UnicodeVersion.parse(next);
            if (cmpGiven.isPrefixOf(cmpNext)) {
                return next;
            }
            if (cmpNext.compareTo(cmpGiven) > 0) {
                return versions.get(i);
            }
        }
        return latest;
    }

}
