/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.pglens.agent.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Represents a PostgreSQL engine version.
 *
 * <p>Only the leading {@code major.minor[.patch]} of the server version string is considered,
 * vendor suffixes such as {@code "(Debian 16.10-1.pgdg13+1)"} are ignored.
 */
public record PostgresVersion(int major, int minor, int patch, String rawVersion) {
    private static final Pattern PG_VERSION_REGEX = Pattern.compile(
            "^\\s*v?(\\d+)\\.(\\d+)(?:\\.(\\d+))?"
    );

    private static final int MAJOR_GROUP = 1;
    private static final int MINOR_GROUP = 2;
    private static final int PATCH_GROUP = 3;

    private static final int STATS_SINCE_MAJOR = 17;

    /**
     * Parse version from {@code SHOW server_version} output.
     *
     * @param versionString The server version string
     * @return Parsed version or null if parsing fails
     */
    public static PostgresVersion parse(String versionString) {
        if (versionString == null || versionString.isBlank()) {
            return null;
        }
        final String input = versionString.trim();
        final Matcher matcher = PG_VERSION_REGEX.matcher(input);
        if (!matcher.find()) {
            return null;
        }
        final int major = Integer.parseInt(matcher.group(MAJOR_GROUP));
        final int minor = Integer.parseInt(matcher.group(MINOR_GROUP));
        final String patchGroup = matcher.group(PATCH_GROUP);
        final int patch = patchGroup != null ? Integer.parseInt(patchGroup) : 0;
        return new PostgresVersion(major, minor, patch, input);
    }

    /**
     * Parse version, failing when the string has no leading numeric version.
     *
     * @param versionString The server version string
     * @return Parsed version (never null)
     * @throws IllegalArgumentException If no version pattern is found
     */
    public static PostgresVersion parseStrict(String versionString) {
        PostgresVersion version = parse(versionString);
        if (version == null) {
            throw new IllegalArgumentException(
                    "failed to parse database engine version: " + versionString);
        }
        return version;
    }

    /**
     * PostgreSQL 17 added {@code pg_stat_statements.stats_since}; earlier versions only
     * expose the global {@code pg_stat_statements_info.stats_reset}.
     */
    public boolean isAtLeastVersion17() {
        return major >= STATS_SINCE_MAJOR;
    }

    public String fullVersion() {
        return major + "." + minor + "." + patch;
    }
}
