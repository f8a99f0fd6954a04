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

import java.time.Instant;

/**
 * A statement observed in {@code pg_stat_statements}.
 *
 * @param database     Database the statement ran in
 * @param queryId      {@code pg_stat_statements.queryid}
 * @param queryText    Normalized statement text, may be truncated
 * @param calls        Number of executions since the last statistics reset
 * @param statsReset   When the call counter last started counting
 * @param failureCount Number of times the candidate was denylisted
 */
public record QueryCandidate(String database,
                             String queryId,
                             String queryText,
                             long calls,
                             Instant statsReset,
                             int failureCount) {

    public static QueryCandidate of(String database, String queryId, String queryText,
                                    long calls, Instant statsReset) {
        return new QueryCandidate(database, queryId, queryText, calls, statsReset, 0);
    }

    public QueryKey key() {
        return new QueryKey(database, queryId);
    }

    QueryCandidate withFailure() {
        return new QueryCandidate(database, queryId, queryText, calls, statsReset, failureCount + 1);
    }
}
