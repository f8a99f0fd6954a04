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

import org.junit.jupiter.api.Test;
import org.pglens.agent.output.ProcessingResult;
import org.pglens.agent.sql.ReservedKeywordDetector;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QueryValidatorTest {

    private final QueryValidator validator = new QueryValidator(new ReservedKeywordDetector());

    private static QueryCandidate candidate(String queryText) {
        return QueryCandidate.of("testdb", "1", queryText, 1, null);
    }

    @Test
    void testValidate_PlainSelect_Accepted() {
        assertTrue(validator.validate(candidate("SELECT * FROM users WHERE id = $1")).isEmpty());
    }

    @Test
    void testValidate_Truncated_Skipped() {
        Optional<AttemptOutcome> outcome = validator.validate(candidate("SELECT * FROM users WHERE name IN ($1, $2, ..."));

        assertTrue(outcome.isPresent());
        assertEquals(ProcessingResult.SKIPPED, outcome.get().result());
        assertEquals("query is truncated", outcome.get().reason());
        assertFalse(outcome.get().nonRecoverable());
    }

    @Test
    void testValidate_TruncatedWinsOverUnterminatedLiteral() {
        Optional<AttemptOutcome> outcome = validator.validate(candidate("SELECT 'abc..."));

        assertEquals("query is truncated", outcome.orElseThrow().reason());
    }

    @Test
    void testValidate_ReservedWord_Skipped() {
        Optional<AttemptOutcome> outcome = validator.validate(candidate("UPDATE users SET name = $1 WHERE id = $2"));

        assertEquals(ProcessingResult.SKIPPED, outcome.orElseThrow().result());
        assertEquals("query contains reserved word", outcome.get().reason());
        assertFalse(outcome.get().nonRecoverable());
    }

    @Test
    void testValidate_DetectorError_RecoverableError() {
        Optional<AttemptOutcome> outcome = validator.validate(candidate("SELECT \"broken FROM t"));

        assertEquals(ProcessingResult.ERROR, outcome.orElseThrow().result());
        assertTrue(outcome.get().reason().startsWith("failed to check for reserved keywords: "));
        assertFalse(outcome.get().nonRecoverable());
    }
}
