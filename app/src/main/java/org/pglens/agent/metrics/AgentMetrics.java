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
import lombok.extern.slf4j.Slf4j;
import org.pglens.agent.common.Constants;
import org.pglens.agent.common.MetricNameBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Internal agent metrics
 */
@Slf4j
@ApplicationScoped
public class AgentMetrics {

    private static final String NAME_TOTAL_SCRAPED = MetricNameBuilder.build(Constants.SUBSYSTEM_AGENT, "total_scraped");
    private static final String NAME_TOTAL_ERROR = MetricNameBuilder.build(Constants.SUBSYSTEM_AGENT, "total_error");
    private static final String NAME_COLLECTOR_ERROR = MetricNameBuilder.build(Constants.SUBSYSTEM_AGENT, "collector_error");
    private static final String NAME_SCRAPE_DURATION = MetricNameBuilder.build(Constants.SUBSYSTEM_AGENT, "scrape_duration_seconds");
    private static final String NAME_UPTIME = MetricNameBuilder.build(Constants.SUBSYSTEM_AGENT, "uptime_seconds");
    private static final String NAME_UP = MetricNameBuilder.build("up");

    private final AtomicReference<Double> databaseUpGaugeValue = new AtomicReference<>(0.0);
    private final Instant startTime = Instant.now();

    private final MeterRegistry registry;

    private Counter tickCounter;
    private Counter tickErrorCounter;
    private Timer tickDurationTimer;

    @Inject
    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    public void init() {
        tickCounter = Counter.builder(NAME_TOTAL_SCRAPED)
                .description("Total number of collection ticks")
                .register(registry);
        tickErrorCounter = Counter.builder(NAME_TOTAL_ERROR)
                .description("Total number of collection errors")
                .register(registry);
        Gauge.builder(NAME_UP, databaseUpGaugeValue::get)
                .description("Whether the monitored PostgreSQL server is reachable (1=up, 0=down)")
                .register(registry);
        tickDurationTimer = Timer.builder(NAME_SCRAPE_DURATION)
                .description("Duration of the last collection tick in seconds")
                .register(registry);
        Gauge.builder(NAME_UPTIME, () -> Duration.between(startTime, Instant.now()).toSeconds())
                .description("Duration in seconds since the agent started")
                .register(registry);
        log.info("Agent metrics initialized");
    }

    public void incrementTotalScraped() {
        tickCounter.increment();
    }

    public void incrementTotalError() {
        tickErrorCounter.increment();
    }

    /**
     * Increment the error counter of one collector.
     *
     * @param collectorName Name of the collector that failed
     */
    public void incrementCollectorError(String collectorName) {
        Counter.builder(NAME_COLLECTOR_ERROR)
                .tag("collector", collectorName)
                .description("Number of errors per collector")
                .register(registry)
                .increment();
    }

    public void recordScrapeDuration(Duration duration) {
        tickDurationTimer.record(duration);
    }

    public void setDatabaseUp(boolean up) {
        databaseUpGaugeValue.set(up ? 1.0 : 0.0);
    }
}
