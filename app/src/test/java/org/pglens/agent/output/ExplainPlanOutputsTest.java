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
package org.pglens.agent.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExplainPlanOutputsTest {

    private final ExplainPlanOutputs outputs = new ExplainPlanOutputs(new ObjectMapper());

    private static ExplainPlanOutput successOutput() {
        ExplainPlanNode scan = new ExplainPlanNode("Seq Scan",
                ExplainPlanNodeDetails.builder().estimatedRows(10).estimatedCost(1.5).alias("u").build(),
                List.of());
        ExplainPlanNode join = new ExplainPlanNode("Hash Join",
                ExplainPlanNodeDetails.builder().estimatedRows(5).estimatedCost(2.0)
                        .joinType("Inner").joinAlgorithm(JoinAlgorithm.HASH).build(),
                List.of(scan));
        return new ExplainPlanOutput(
                new ExplainPlanMetadata("PostgreSQL", "16.4.0", "123", "2026-10-19T10:00:00Z",
                        ProcessingResult.SUCCESS, ""),
                join);
    }

    @Test
    void testDecodeLogLine_JoinAlgorithmsOfOtherProducers() throws IOException {
        String json = "{\"metadata\":{\"databaseEngine\":\"PostgreSQL\",\"databaseVersion\":\"16.4.0\","
                + "\"queryIdentifier\":\"7\",\"generatedAt\":\"2026-10-19T10:00:00Z\","
                + "\"processingResult\":\"success\",\"processingResultReason\":\"\"},"
                + "\"plan\":{\"operation\":\"Nested Loop Join\",\"details\":{\"joinAlgorithm\":\"nested_loop\"},"
                + "\"children\":[{\"operation\":\"Merge Join\",\"details\":{\"joinAlgorithm\":\"merge\"}}]}}";
        String line = "level=info op=explain_plan_output explain_plan_output=\""
                + Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8)) + "\"";

        ExplainPlanOutput output = outputs.decodeLogLine(line);

        assertEquals(JoinAlgorithm.NESTED_LOOP, output.plan().details().joinAlgorithm());
        assertEquals(JoinAlgorithm.MERGE, output.plan().children().get(0).details().joinAlgorithm());
    }

    @Test
    void testToJson_FieldNamesAndOmittedValues() throws Exception {
        String json = outputs.toJson(successOutput());

        assertTrue(json.startsWith("{\"metadata\":{\"databaseEngine\":\"PostgreSQL\",\"databaseVersion\":\"16.4.0\","
                + "\"queryIdentifier\":\"123\",\"generatedAt\":\"2026-10-19T10:00:00Z\","
                + "\"processingResult\":\"success\",\"processingResultReason\":\"\"}"));
        assertTrue(json.contains("\"operation\":\"Hash Join\""));
        assertTrue(json.contains("\"joinAlgorithm\":\"hash\""));
        assertTrue(json.contains("\"estimatedCost\":1.5"));
        assertFalse(json.contains("keyUsed"));
        assertFalse(json.contains("\"children\":[]"));
    }

    @Test
    void testToJson_SkippedHasNoPlan() throws Exception {
        ExplainPlanOutput skipped = new ExplainPlanOutput(
                new ExplainPlanMetadata("PostgreSQL", "16.4.0", "123", "2026-10-19T10:00:00Z",
                        ProcessingResult.SKIPPED, "query is truncated"),
                null);

        String json = outputs.toJson(skipped);

        assertFalse(json.contains("\"plan\""));
        assertTrue(json.contains("\"processingResult\":\"skipped\""));
    }

    @Test
    void testLogMessage_Format() throws Exception {
        ExplainPlanOutput output = successOutput();

        String message = outputs.logMessage("testdb", "123", output);

        String encoded = Base64.getEncoder().encodeToString(outputs.toJson(output).getBytes(StandardCharsets.UTF_8));
        assertEquals("schema=\"testdb\" digest=\"123\" explain_plan_output=\"" + encoded + "\"", message);
    }

    @Test
    void testDecodeLogLine() throws Exception {
        ExplainPlanOutput output = successOutput();
        String line = LogEntry.info(null, "explain_plan_output", outputs.logMessage("testdb", "123", output)).line();

        ExplainPlanOutput decoded = outputs.decodeLogLine(line);

        assertEquals(output, decoded);
    }

    @Test
    void testDecodeLogLine_MissingField_Throws() {
        assertThrows(IOException.class, () -> outputs.decodeLogLine("level=info op=explain_plan_output schema=\"x\""));
    }

    @Test
    void testDecodeLogLine_InvalidBase64_Throws() {
        assertThrows(IOException.class, () -> outputs.decodeLogLine("explain_plan_output=\"%%%\""));
    }
}
