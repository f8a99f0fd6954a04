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
import org.pglens.agent.sql.SqlLexer;
import org.pglens.agent.sql.SqlToken;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;

/**
 * Runs the EXPLAIN protocol for one candidate on its own connection.
 *
 * <p>Protocol: {@code PREPARE}, {@code SET search_path}, {@code SET plan_cache_mode},
 * {@code EXPLAIN (FORMAT JSON) EXECUTE}, then {@code DEALLOCATE} once the statement was
 * prepared. The connection is closed on every path.
 */
@Slf4j
public class ExplainExecutor {

    static final String EXPLAIN_PREFIX = "EXPLAIN (FORMAT JSON) EXECUTE ";
    static final String SET_PLAN_CACHE_MODE = "SET plan_cache_mode = force_generic_plan";

    private final ExplainConnectionFactory connectionFactory;

    public ExplainExecutor(ExplainConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    /**
     * Fetch the native JSON plan of the candidate.
     *
     * @param candidate Validated candidate
     * @return The single JSON column returned by EXPLAIN, may be empty
     * @throws ExplainException If any step fails
     */
    public String fetchExplainPlanJson(QueryCandidate candidate) throws ExplainException {
        DedicatedConnection dedicated = openConnection(candidate.database());
        try (dedicated) {
            return explain(dedicated.connection(), candidate);
        }
    }

    private DedicatedConnection openConnection(String database) throws ExplainException {
        try {
            return connectionFactory.open(database);
        } catch (IllegalArgumentException e) {
            throw new ExplainException("failed to replace database name in connection url: " + e.getMessage(), e);
        } catch (SQLException e) {
            throw new ExplainException("failed to get connection: " + e.getMessage(), e);
        }
    }

    private String explain(Connection connection, QueryCandidate candidate) throws ExplainException {
        String name = preparedStatementName(candidate.queryId());
        String prepare = "PREPARE " + name + " AS " + candidate.queryText();

        try (Statement stmt = connection.createStatement()) {
            log.debug("Preparing statement {}: {}", name, prepare);
            try {
                stmt.execute(prepare);
            } catch (SQLException e) {
                throw new ExplainException("failed to prepare explain plan: " + e.getMessage(), e);
            }

            try {
                execute(stmt, "SET search_path TO " + quoteIdentifier(candidate.database()) + ", public",
                        "failed to set search path: ");
                execute(stmt, SET_PLAN_CACHE_MODE, "failed to set plan cache mode: ");
                return runExplain(stmt, buildExplainStatement(name, candidate.queryText()));
            } finally {
                deallocate(stmt, name);
            }
        } catch (SQLException e) {
            throw new ExplainException("failed to prepare explain plan: " + e.getMessage(), e);
        }
    }

    private static void execute(Statement stmt, String sql, String failurePrefix) throws ExplainException {
        try {
            stmt.execute(sql);
        } catch (SQLException e) {
            throw new ExplainException(failurePrefix + e.getMessage(), e);
        }
    }

    private static String runExplain(Statement stmt, String explain) throws ExplainException {
        try (ResultSet rs = stmt.executeQuery(explain)) {
            if (!rs.next()) {
                throw new ExplainException("failed to scan explain plan json: no rows returned");
            }
            String json = rs.getString(1);
            return json == null ? "" : json;
        } catch (SQLException e) {
            throw new ExplainException("failed to run explain plan: " + e.getMessage(), e);
        }
    }

    private static void deallocate(Statement stmt, String name) {
        try {
            stmt.execute("DEALLOCATE " + name);
        } catch (SQLException e) {
            log.error("Failed to deallocate explain plan {}: {}", name, e.getMessage());
        }
    }

    /**
     * Deterministic prepared statement name, {@code explain_plan_<query id>} with every
     * character outside {@code [A-Za-z0-9_]} replaced by {@code _}.
     */
    static String preparedStatementName(String queryId) {
        return ("explain_plan_" + queryId).replaceAll("[^A-Za-z0-9_]", "_");
    }

    /**
     * Build the EXPLAIN statement, passing {@code null} for each positional parameter.
     */
    static String buildExplainStatement(String name, String queryText) {
        int parameters = countParameters(queryText);
        if (parameters == 0) {
            return EXPLAIN_PREFIX + name;
        }
        return EXPLAIN_PREFIX + name + "(" + String.join(",", Collections.nCopies(parameters, "null")) + ")";
    }

    /**
     * Number of parameters the prepared statement takes: the highest {@code $n} marker
     * outside literals and comments.
     */
    static int countParameters(String queryText) {
        int highest = 0;
        for (SqlToken token : SqlLexer.tokenizeLenient(queryText)) {
            if (token.kind() != SqlToken.Kind.PARAMETER) {
                continue;
            }
            try {
                highest = Math.max(highest, Integer.parseInt(token.text().substring(1)));
            } catch (NumberFormatException e) {
                log.debug("Ignoring parameter marker {}: {}", token.text(), e.getMessage());
            }
        }
        return highest;
    }

    private static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
