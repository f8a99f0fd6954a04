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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pglens.agent.metrics.ExplainMetrics;
import org.pglens.agent.output.EntryHandler;
import org.pglens.agent.output.ExplainPlanNode;
import org.pglens.agent.output.ExplainPlanNodeDetails;
import org.pglens.agent.output.ExplainPlanOutput;
import org.pglens.agent.output.ExplainPlanOutputs;
import org.pglens.agent.output.LogEntry;
import org.pglens.agent.output.ProcessingResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OutcomeRouterTest {

    private static final String GENERATED_AT = "2026-10-19T10:00:00Z";
    private static final QueryCandidate CANDIDATE = QueryCandidate.of("testdb", "123", "SELECT 1", 1, null);

    private final List<LogEntry> entries = new ArrayList<>();
    private final ExplainPlanOutputs outputs = new ExplainPlanOutputs(new ObjectMapper());
    private SimpleMeterRegistry registry;
    private OutcomeRouter router;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        ExplainMetrics metrics = new ExplainMetrics(registry);
        metrics.init();
        EntryHandler handler = entries::add;
        router = new OutcomeRouter("16.4.0", outputs, handler, metrics,
                Clock.fixed(Instant.parse(GENERATED_AT), ZoneOffset.UTC));
    }

    private double outputCount(String result) {
        return registry.get("pglens_explain_outputs_total").tag("result", result).counter().count();
    }

    @Test
    void testRoute_Success_EmitsPlan() throws Exception {
        ExplainPlanNode plan = new ExplainPlanNode("Result",
                ExplainPlanNodeDetails.builder().estimatedRows(1).estimatedCost(0.01).build(), null);

        AttemptOutcome routed = router.route(CANDIDATE, GENERATED_AT, AttemptOutcome.success(plan));

        assertEquals(ProcessingResult.SUCCESS, routed.result());
        assertEquals(1, entries.size());
        LogEntry entry = entries.get(0);
        assertEquals("explain_plan_output", entry.op());
        assertEquals("info", entry.level());
        assertTrue(entry.message().startsWith("schema=\"testdb\" digest=\"123\" explain_plan_output=\""));

        ExplainPlanOutput decoded = outputs.decodeLogLine(entry.line());
        assertEquals("PostgreSQL", decoded.metadata().databaseEngine());
        assertEquals("16.4.0", decoded.metadata().databaseVersion());
        assertEquals("123", decoded.metadata().queryIdentifier());
        assertEquals(GENERATED_AT, decoded.metadata().generatedAt());
        assertEquals("", decoded.metadata().processingResultReason());
        assertEquals(plan, decoded.plan());
        assertEquals(1.0, outputCount("success"));
    }

    @Test
    void testRoute_Skipped_EmitsReasonWithoutPlan() throws Exception {
        router.route(CANDIDATE, GENERATED_AT, AttemptOutcome.skipped("query is truncated"));

        ExplainPlanOutput decoded = outputs.decodeLogLine(entries.get(0).line());
        assertEquals(ProcessingResult.SKIPPED, decoded.metadata().processingResult());
        assertEquals("query is truncated", decoded.metadata().processingResultReason());
        assertNull(decoded.plan());
        assertEquals(1.0, outputCount("skipped"));
    }

    @Test
    void testRoute_MarshalFailure_BecomesNonRecoverableError() throws Exception {
        // Setup
        ExplainPlanOutputs failing = mock(ExplainPlanOutputs.class);
        when(failing.logMessage(any(), any(), any()))
                .thenThrow(new JsonProcessingException("boom") {
                })
                .thenReturn("schema=\"testdb\" digest=\"123\" explain_plan_output=\"\"");
        ExplainMetrics metrics = new ExplainMetrics(registry);
        metrics.init();
        OutcomeRouter failingRouter = new OutcomeRouter("16.4.0", failing, entries::add, metrics, Clock.systemUTC());

        // Execute
        AttemptOutcome routed = failingRouter.route(CANDIDATE, GENERATED_AT,
                AttemptOutcome.success(new ExplainPlanNode("Result", null, null)));

        // Verify
        assertEquals(ProcessingResult.ERROR, routed.result());
        assertTrue(routed.nonRecoverable());
        assertTrue(routed.reason().startsWith("failed to marshal explain plan output"));
        assertEquals(1, entries.size());
    }

    @Test
    void testRoute_SinkFailure_Logged() {
        EntryHandler broken = entry -> {
            throw new IllegalStateException("sink closed");
        };
        ExplainMetrics metrics = new ExplainMetrics(registry);
        metrics.init();
        OutcomeRouter brokenRouter = new OutcomeRouter("16.4.0", outputs, broken, metrics, Clock.systemUTC());

        AttemptOutcome routed = brokenRouter.route(CANDIDATE, GENERATED_AT, AttemptOutcome.error("timeout", false));

        assertEquals(ProcessingResult.ERROR, routed.result());
        assertFalse(routed.nonRecoverable());
    }
}
