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
package org.pglens.agent.collector;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.pglens.agent.config.OrchestratorConfig;
import org.pglens.agent.metrics.AgentMetrics;
import org.pglens.agent.model.PostgresVersion;
import org.pglens.agent.pg.DatabaseService;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs every enabled collector once per tick.
 *
 * <p>Ticks never overlap: a tick requested while another one is running is skipped.
 */
@Slf4j
@ApplicationScoped
public class CollectorOrchestrator {

    private final Lock tickLock = new ReentrantLock();
    private final AtomicReference<CycleResult> lastSuccessfulCycle = new AtomicReference<>();
    private final AtomicBoolean stopped = new AtomicBoolean();

    private final OrchestratorConfig config;
    private final DatabaseService databaseService;
    private final AgentMetrics agentMetrics;
    private final List<Collector> activeCollectors;

    @Inject
    public CollectorOrchestrator(OrchestratorConfig config,
                                 DatabaseService databaseService,
                                 AgentMetrics agentMetrics,
                                 Instance<Collector> collectors) {
        this.config = config;
        this.databaseService = databaseService;
        this.agentMetrics = agentMetrics;
        this.activeCollectors = initializeCollectors(collectors);
        log.info("{} enabled collectors", activeCollectors.size());
    }

    private List<Collector> initializeCollectors(Iterable<Collector> collectors) {
        List<Collector> enabled = new ArrayList<>();
        for (Collector collector : collectors) {
            if (collector.isEnabled()) {
                enabled.add(collector);
                log.info("Enabled collector: {}", collector.getName());
            } else {
                log.debug("Disabled collector: {}", collector.getName());
            }
        }
        return List.copyOf(enabled);
    }

    /**
     * Run one tick unless another tick is in progress or the orchestrator was stopped.
     *
     * @return The tick's result, empty if the tick was skipped
     */
    public Optional<CycleResult> tick() {
        if (stopped.get()) {
            log.debug("Orchestrator stopped, skipping tick");
            return Optional.empty();
        }
        if (!tickLock.tryLock()) {
            CycleResult last = lastSuccessfulCycle.get();
            if (last != null) {
                log.debug("Collection tick already in progress, last successful tick started {} ago", last.getAge());
            } else {
                log.debug("Collection tick already in progress");
            }
            return Optional.empty();
        }

        try {
            CycleResult result = performTickInternal();
            if (result.successful()) {
                lastSuccessfulCycle.set(result);
            }
            return Optional.of(result);
        } finally {
            tickLock.unlock();
        }
    }

    private CycleResult performTickInternal() {
        Instant start = Instant.now();
        agentMetrics.incrementTotalScraped();
        log.debug("Starting collection tick");

        try {
            PostgresVersion version = verifyDatabaseAndVersion();
            if (version == null) {
                return CycleResult.failed(start);
            }

            collectFromAll(version);
            return CycleResult.successful(start);

        } catch (SQLException e) {
            log.error("Database error during collection tick: {}", e.getMessage(), e);
            agentMetrics.setDatabaseUp(false);
            agentMetrics.incrementTotalError();
            return CycleResult.failed(start, e);
        } catch (Exception e) {
            log.error("Unexpected error during collection tick: {}", e.getMessage(), e);
            agentMetrics.incrementTotalError();
            return CycleResult.failed(start, e);
        } finally {
            recordDuration(start);
        }
    }

    private PostgresVersion verifyDatabaseAndVersion() throws SQLException {
        int maxAttempts = config.connectionRetryAttempts();
        Duration retryDelay = config.connectionRetryDelay();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                if (!databaseService.testConnection()) {
                    if (attempt < maxAttempts) {
                        log.warn("Database connection test failed (attempt {}/{}), retrying in {}",
                                attempt, maxAttempts, retryDelay.multipliedBy(attempt));
                        Thread.sleep(retryDelay.multipliedBy(attempt).toMillis());
                        continue;
                    }
                    log.error("Database connection test failed after {} attempts", maxAttempts);
                    agentMetrics.setDatabaseUp(false);
                    agentMetrics.incrementTotalError();
                    return null;
                }

                PostgresVersion version = databaseService.detectVersion();
                if (version == null) {
                    log.error("Failed to detect PostgreSQL version");
                    agentMetrics.setDatabaseUp(false);
                    agentMetrics.incrementTotalError();
                    return null;
                }

                agentMetrics.setDatabaseUp(true);
                if (attempt > 1) {
                    log.info("Database connection restored after {} attempts", attempt);
                }
                return version;

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SQLException("Connection retry interrupted", e);
            }
        }

        return null;
    }

    private void collectFromAll(PostgresVersion version) throws SQLException {
        try (Connection connection = databaseService.getPooledConnection()) {
            int failures = 0;
            for (Collector collector : activeCollectors) {
                if (stopped.get()) {
                    break;
                }
                if (!executeCollector(collector, connection, version)) {
                    failures++;
                    checkCircuitBreaker(failures);
                }
            }
            if (failures > 0) {
                log.warn("Collection tick completed with {} collector failures", failures);
            }
        }
    }

    /**
     * @return true if the collector completed
     */
    private boolean executeCollector(Collector collector, Connection connection, PostgresVersion version) {
        long collectionStart = System.currentTimeMillis();
        try {
            log.debug("Running collector: {}", collector.getName());
            collector.collect(connection, version);
            return true;
        } catch (Exception e) {
            log.error("Error running collector {}: {}", collector.getName(), e.getMessage(), e);
            agentMetrics.incrementTotalError();
            agentMetrics.incrementCollectorError(collector.getName());
            return false;
        } finally {
            long duration = System.currentTimeMillis() - collectionStart;
            log.debug("Collector {} completed in {} ms", collector.getName(), duration);
        }
    }

    private void checkCircuitBreaker(int failures) throws SQLException {
        // Too many collector failures in one tick usually means the database itself is in trouble
        if (config.circuitBreakerEnabled() && failures >= config.collectorFailureThreshold()) {
            log.error("Too many collector failures ({}), circuit breaker triggered - " +
                    "assuming database issue, stopping remaining collectors", failures);
            throw new SQLException("Multiple collectors failed, possible database issue");
        }
    }

    private void recordDuration(Instant start) {
        Duration duration = Duration.between(start, Instant.now());
        agentMetrics.recordScrapeDuration(duration);
        log.debug("Collection tick completed in {} ms", duration.toMillis());
    }

    /**
     * Stop all collectors. Later ticks are skipped. Safe to call more than once.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        for (Collector collector : activeCollectors) {
            try {
                collector.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping collector {}: {}", collector.getName(), e.getMessage(), e);
            }
        }
        log.info("Collector orchestrator stopped");
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public int getActiveCollectorCount() {
        return activeCollectors.size();
    }
}
