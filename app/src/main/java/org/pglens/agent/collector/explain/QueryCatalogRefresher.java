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
package org.pglens.agent.collector.explain;

import lombok.extern.slf4j.Slf4j;
import org.pglens.agent.model.PostgresVersion;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Repopulates the active set from {@code pg_stat_statements}.
 *
 * <p>For every row: a denylisted identity is reported as skipped and not queued; a finished
 * identity is queued again only when its call counter moved, where a lower counter only
 * counts when the statistics were reset after the recorded reset; anything else is queued.
 */
@Slf4j
public class QueryCatalogRefresher {

    /**
     * Maintenance databases of managed PostgreSQL offerings.
     */
    public static final List<String> PROVIDER_EXCLUDED_DATABASES = List.of(
            "rdsadmin", "azure_maintenance", "azure_sys", "cloudsqladmin");

    static final String SELECT_STATS_RESET = "SELECT stats_reset FROM pg_stat_statements_info";

    private static final String SELECT_QUERIES_TEMPLATE = """
            SELECT
                d.datname,
                s.queryid,
                s.query,
                s.calls,
                %s
            FROM pg_stat_statements s
                JOIN pg_database d ON s.dbid = d.oid AND NOT d.datistemplate AND d.datallowconn
            WHERE s.queryid IS NOT NULL AND s.query IS NOT NULL
                AND d.datname NOT IN %s
            """;

    private static final String STATS_SINCE_COLUMN = "s.stats_since";
    private static final String STATS_SINCE_PLACEHOLDER = "NOW() AT TIME ZONE 'UTC' AS stats_since";

    private final PostgresVersion version;
    private final Set<String> excludeDatabases;
    private final QueryCandidateCache cache;
    private final OutcomeRouter router;

    public QueryCatalogRefresher(PostgresVersion version,
                                 Set<String> excludeDatabases,
                                 QueryCandidateCache cache,
                                 OutcomeRouter router) {
        this.version = version;
        this.excludeDatabases = excludeDatabases;
        this.cache = cache;
        this.router = router;
    }

    /**
     * Read the catalog and queue candidates.
     *
     * @param connection     Catalog connection (never null, already open)
     * @param generatedAt    Tick start time, RFC 3339
     * @param perScrapeRatio Fraction of the active set to process per tick
     * @return Batch size for the following ticks, {@code ceil(active * ratio)}
     * @throws SQLException If the catalog cannot be read; rows already applied stay applied
     */
    public int refresh(Connection connection, String generatedAt, double perScrapeRatio) throws SQLException {
        boolean statsSincePerStatement = version.isAtLeastVersion17();
        Instant globalReset = statsSincePerStatement ? null : fetchGlobalStatsReset(connection);
        String sql = buildSelectStatement(statsSincePerStatement);

        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                String datname = rs.getString(1);
                String queryId = rs.getString(2);
                String queryText = rs.getString(3);
                long calls = rs.getLong(4);
                Instant statsReset = statsSincePerStatement ? toInstant(rs.getTimestamp(5)) : globalReset;

                apply(QueryCandidate.of(datname, queryId, queryText, calls, statsReset), generatedAt);
            }
        } catch (SQLException e) {
            throw new SQLException("failed to fetch queries for explain plans: " + e.getMessage(),
                    e.getSQLState(), e);
        }

        int active = cache.count(CacheBucket.ACTIVE);
        int batchSize = batchSize(active, perScrapeRatio);
        log.debug("Populated query cache: {} active, {} finished, {} denylisted, batch size {}",
                active, cache.count(CacheBucket.FINISHED), cache.count(CacheBucket.DENYLISTED), batchSize);
        return batchSize;
    }

    private void apply(QueryCandidate candidate, String generatedAt) {
        QueryKey key = candidate.key();
        CacheBucket bucket = cache.bucketOf(key).orElse(null);

        if (bucket == CacheBucket.DENYLISTED) {
            router.route(candidate, generatedAt, AttemptOutcome.skipped(OutcomeRouter.REASON_DENYLISTED));
            return;
        }

        if (bucket == CacheBucket.FINISHED) {
            QueryCandidate previous = cache.get(key).orElseThrow();
            if (candidate.calls() == previous.calls()) {
                return;
            }
            if (candidate.calls() < previous.calls() && !isAfter(candidate.statsReset(), previous.statsReset())) {
                log.debug("Call count of query {} in {} went down without a statistics reset, skipping",
                        key.queryId(), key.database());
                return;
            }
        }

        cache.enqueue(candidate);
    }

    private Instant fetchGlobalStatsReset(Connection connection) throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(SELECT_STATS_RESET)) {
            if (!rs.next()) {
                throw new SQLException("failed to fetch stats reset time for explain plans: no rows");
            }
            return toInstant(rs.getTimestamp(1));
        } catch (SQLException e) {
            if (e.getMessage() != null && e.getMessage().startsWith("failed to fetch stats reset time")) {
                throw e;
            }
            throw new SQLException("failed to fetch stats reset time for explain plans: " + e.getMessage(),
                    e.getSQLState(), e);
        }
    }

    String buildSelectStatement(boolean statsSincePerStatement) {
        return SELECT_QUERIES_TEMPLATE.formatted(
                statsSincePerStatement ? STATS_SINCE_COLUMN : STATS_SINCE_PLACEHOLDER,
                buildExcludedDatabasesClause(excludeDatabases));
    }

    /**
     * Build the {@code ('a', 'b')} list of excluded databases, provider databases first.
     */
    static String buildExcludedDatabasesClause(Set<String> excludeDatabases) {
        Set<String> names = new LinkedHashSet<>(PROVIDER_EXCLUDED_DATABASES);
        if (excludeDatabases != null) {
            excludeDatabases.stream()
                    .filter(name -> name != null && !name.isBlank())
                    .sorted()
                    .forEach(names::add);
        }
        return names.stream()
                .map(name -> "'" + name.replace("'", "''") + "'")
                .collect(Collectors.joining(", ", "(", ")"));
    }

    /**
     * @return {@code ceil(active * perScrapeRatio)}
     */
    static int batchSize(int active, double perScrapeRatio) {
        return (int) Math.ceil(active * perScrapeRatio);
    }

    private static boolean isAfter(Instant candidate, Instant previous) {
        if (candidate == null) {
            return false;
        }
        return previous == null || candidate.isAfter(previous);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
