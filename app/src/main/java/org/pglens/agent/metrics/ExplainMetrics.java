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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.pglens.agent.common.Constants;
import org.pglens.agent.common.MetricNameBuilder;
import org.pglens.agent.output.ProcessingResult;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics of the EXPLAIN plan sampling engine
 */
@ApplicationScoped
public class ExplainMetrics {

    private static final String NAME_OUTPUTS = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPLAIN, "outputs_total");
    private static final String NAME_DURATION = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPLAIN, "duration_seconds");
    private static final String NAME_CACHE_SIZE = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPLAIN, "cache_size");
    private static final String NAME_BATCH_SIZE = MetricNameBuilder.build(Constants.SUBSYSTEM_EXPLAIN, "batch_size");

    private final MeterRegistry registry;

    private final Map<ProcessingResult, Counter> outputCounters = new EnumMap<>(ProcessingResult.class);
    private final AtomicInteger activeSize = new AtomicInteger();
    private final AtomicInteger finishedSize = new AtomicInteger();
    private final AtomicInteger denylistedSize = new AtomicInteger();
    private final AtomicInteger batchSize = new AtomicInteger();

    private Timer explainTimer;

    @Inject
    public ExplainMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        for (ProcessingResult result : ProcessingResult.values()) {
            outputCounters.put(result, Counter.builder(NAME_OUTPUTS)
                    .tag("result", result.value())
                    .description("Number of explain plan outputs emitted")
                    .register(registry));
        }
        explainTimer = Timer.builder(NAME_DURATION)
                .description("Duration of one EXPLAIN protocol run in seconds")
                .register(registry);
        registerCacheGauge("active", activeSize);
        registerCacheGauge("finished", finishedSize);
        registerCacheGauge("denylisted", denylistedSize);
        Gauge.builder(NAME_BATCH_SIZE, batchSize, AtomicInteger::get)
                .description("Number of queries explained per collection tick")
                .register(registry);
    }

    private void registerCacheGauge(String bucket, AtomicInteger value) {
        Gauge.builder(NAME_CACHE_SIZE, value, AtomicInteger::get)
                .tag("bucket", bucket)
                .description("Number of queries per explain cache bucket")
                .register(registry);
    }

    public void incrementOutput(ProcessingResult result) {
        outputCounters.get(result).increment();
    }

    public void recordExplainDuration(Duration duration) {
        explainTimer.record(duration);
    }

    public void updateCacheSizes(int active, int finished, int denylisted) {
        activeSize.set(active);
        finishedSize.set(finished);
        denylistedSize.set(denylisted);
    }

    public void setBatchSize(int size) {
        batchSize.set(size);
    }
}
