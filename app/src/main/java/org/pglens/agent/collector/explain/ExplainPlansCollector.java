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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.pglens.agent.collector.Collector;
import org.pglens.agent.config.ExplainPlansConfig;
import org.pglens.agent.metrics.ExplainMetrics;
import org.pglens.agent.model.PostgresVersion;
import org.pglens.agent.output.EntryHandler;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Set;

/**
 * Collector that drives the {@link ExplainPlanEngine}.
 *
 * <p>The engine is built on the first tick, from {@code app.explain-plans.engine-version} when
 * set and from the detected server version otherwise. An engine that cannot be built disables
 * the collector for the lifetime of the process.
 */
@Slf4j
@ApplicationScoped
public class ExplainPlansCollector implements Collector {

    static final String NAME = "explain_plans";

    private final ExplainPlansConfig config;
    private final ExplainConnectionFactory connectionFactory;
    private final EntryHandler entryHandler;
    private final ExplainMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private ExplainPlanEngine engine;
    private boolean disabled;

    @Inject
    public ExplainPlansCollector(ExplainPlansConfig config,
                                 ExplainConnectionFactory connectionFactory,
                                 EntryHandler entryHandler,
                                 ExplainMetrics metrics,
                                 ObjectMapper objectMapper) {
        this(config, connectionFactory, entryHandler, metrics, objectMapper, Clock.systemUTC());
    }

    ExplainPlansCollector(ExplainPlansConfig config,
                          ExplainConnectionFactory connectionFactory,
                          EntryHandler entryHandler,
                          ExplainMetrics metrics,
                          ObjectMapper objectMapper,
                          Clock clock) {
        this.config = config;
        this.connectionFactory = connectionFactory;
        this.entryHandler = entryHandler;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return config.enabled();
    }

    @Override
    public void collect(Connection connection, PostgresVersion version) throws SQLException {
        ExplainPlanEngine current = engine(version);
        if (current == null) {
            return;
        }
        current.fetchExplainPlans(connection);
    }

    private ExplainPlanEngine engine(PostgresVersion detected) {
        if (engine != null || disabled) {
            return engine;
        }
        String engineVersion = config.engineVersion()
                .filter(v -> !v.isBlank())
                .orElse(detected.rawVersion());
        try {
            engine = new ExplainPlanEngine(ExplainPlanEngineArgs.builder()
                    .engineVersion(engineVersion)
                    .perScrapeRatio(config.perCollectRatio())
                    .excludeDatabases(config.excludeDatabases().orElse(Set.of()))
                    .connectionFactory(connectionFactory)
                    .entryHandler(entryHandler)
                    .metrics(metrics)
                    .objectMapper(objectMapper)
                    .clock(clock)
                    .build());
            log.info("Explain plan engine created for PostgreSQL {}", engine.version().fullVersion());
        } catch (IllegalArgumentException e) {
            disabled = true;
            log.error("Failed to create explain plan engine, collector disabled: {}", e.getMessage());
        }
        return engine;
    }

    @Override
    public void stop() {
        if (engine != null) {
            engine.stop();
        }
        disabled = true;
    }

    boolean isDisabled() {
        return disabled;
    }
}
