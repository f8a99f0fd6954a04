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
package org.pglens.agent.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pglens.agent.output.ProcessingResult;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExplainMetricsTest {

    private SimpleMeterRegistry registry;
    private ExplainMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ExplainMetrics(registry);
        metrics.init();
    }

    @Test
    void testIncrementOutput_CountsPerResult() {
        metrics.incrementOutput(ProcessingResult.SUCCESS);
        metrics.incrementOutput(ProcessingResult.SUCCESS);
        metrics.incrementOutput(ProcessingResult.SKIPPED);

        assertEquals(2.0, registry.get("pglens_explain_outputs_total").tag("result", "success").counter().count());
        assertEquals(1.0, registry.get("pglens_explain_outputs_total").tag("result", "skipped").counter().count());
        assertEquals(0.0, registry.get("pglens_explain_outputs_total").tag("result", "error").counter().count());
    }

    @Test
    void testUpdateCacheSizes() {
        metrics.updateCacheSizes(3, 10, 1);
        metrics.setBatchSize(2);

        assertEquals(3.0, registry.get("pglens_explain_cache_size").tag("bucket", "active").gauge().value());
        assertEquals(10.0, registry.get("pglens_explain_cache_size").tag("bucket", "finished").gauge().value());
        assertEquals(1.0, registry.get("pglens_explain_cache_size").tag("bucket", "denylisted").gauge().value());
        assertEquals(2.0, registry.get("pglens_explain_batch_size").gauge().value());
    }

    @Test
    void testRecordExplainDuration() {
        metrics.recordExplainDuration(Duration.ofMillis(250));

        assertEquals(1, registry.get("pglens_explain_duration_seconds").timer().count());
    }
}
