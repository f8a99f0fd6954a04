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

import org.pglens.agent.sql.ReservedKeywordDetector;
import org.pglens.agent.sql.SqlLexerException;

import java.util.Optional;

/**
 * Rejects statements that cannot or must not be explained, before any database round trip.
 * Every rejection is recoverable.
 */
public class QueryValidator {

    static final String TRUNCATION_MARKER = "...";
    static final String REASON_TRUNCATED = "query is truncated";
    static final String REASON_RESERVED_WORD = "query contains reserved word";

    private final ReservedKeywordDetector keywordDetector;

    public QueryValidator(ReservedKeywordDetector keywordDetector) {
        this.keywordDetector = keywordDetector;
    }

    /**
     * @return The rejection outcome, or empty when the statement may be explained
     */
    public Optional<AttemptOutcome> validate(QueryCandidate candidate) {
        String queryText = candidate.queryText();
        if (queryText.endsWith(TRUNCATION_MARKER)) {
            return Optional.of(AttemptOutcome.skipped(REASON_TRUNCATED));
        }
        try {
            if (keywordDetector.containsReservedKeywords(queryText)) {
                return Optional.of(AttemptOutcome.skipped(REASON_RESERVED_WORD));
            }
        } catch (SqlLexerException e) {
            return Optional.of(AttemptOutcome.error(
                    "failed to check for reserved keywords: " + e.getMessage(), false));
        }
        return Optional.empty();
    }
}
