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
package org.pglens.agent.bootstrap;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.pglens.agent.collector.CollectorOrchestrator;
import org.pglens.agent.config.ExplainPlansConfig;
import org.pglens.agent.model.PostgresVersion;
import org.pglens.agent.pg.DatabaseService;

import java.util.Set;

/**
 * Application lifecycle bean that initializes the agent on startup
 * and schedules periodic collection.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>Startup: Print banner, log configuration, detect database version</li>
 *   <li>Runtime: Periodic ticks via scheduler</li>
 *   <li>Shutdown: Stop the orchestrator and its collectors</li>
 * </ol>
 */
@Slf4j
@ApplicationScoped
public class AgentApp {
    private final DatabaseService databaseService;
    private final CollectorOrchestrator orchestrator;
    private final ExplainPlansConfig explainPlansConfig;
    private final Banners banner;

    @Inject
    public AgentApp(DatabaseService databaseService,
                    CollectorOrchestrator orchestrator,
                    ExplainPlansConfig explainPlansConfig,
                    Banners banner) {
        this.databaseService = databaseService;
        this.orchestrator = orchestrator;
        this.explainPlansConfig = explainPlansConfig;
        this.banner = banner;
    }

    void onStartup(@Observes StartupEvent event) {
        banner.printHeader();
        logConfiguration();
        // Non-fatal: the first tick detects the version again
        detectAndLogVersion();
        banner.printFooter();
    }

    void onShutdown(@Observes ShutdownEvent event) {
        banner.printShutdown();
        orchestrator.stop();
    }

    private void logConfiguration() {
        log.info("Configuration:");
        log.info("  Collect interval:       {}", explainPlansConfig.collectInterval());
        log.info("  Per-collect ratio:      {}", explainPlansConfig.perCollectRatio());
        log.info("  Excluded databases:     {}", explainPlansConfig.excludeDatabases().orElse(Set.of()));
        log.info("  Active collectors:      {}", orchestrator.getActiveCollectorCount());
        log.info("  Database URL:           {}", maskSensitiveInfo(databaseService.getUrl()));
    }

    /**
     * Mask sensitive information in connection strings for logging.
     *
     * @param url Database connection URL
     * @return Masked URL with password hidden
     */
    static String maskSensitiveInfo(String url) {
        if (url == null) {
            return "not configured";
        }
        return url.replaceAll("password=[^&\\s]+", "password=***")
                .replaceAll(":[^:/@]+@", ":***@");
    }

    private void detectAndLogVersion() {
        try {
            PostgresVersion version = databaseService.detectVersion();
            if (version != null) {
                log.info("Database connection successful:");
                log.info("  PostgreSQL version:     {}", version.rawVersion());
                log.info("  Major.Minor.Patch:      {}", version.fullVersion());
                if (!version.isAtLeastVersion17()) {
                    log.info("  Statement reset times are taken from pg_stat_statements_info");
                }
            } else {
                log.warn("Could not detect PostgreSQL version on startup");
                log.warn("Will retry on first tick - check database connectivity");
            }
        } catch (Exception e) {
            log.warn("Error detecting PostgreSQL version on startup: {}", e.getMessage());
            log.warn("Will retry on first tick");
            log.debug("Version detection error details:", e);
        }
    }

    /**
     * Periodic collection tick.
     *
     * <p>Uses the interval configured in app.explain-plans.collect-interval.
     * Concurrent execution is skipped so ticks never overlap.
     */
    @Scheduled(every = "${app.explain-plans.collect-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void schedulePeriodicTick() {
        log.debug("Periodic collection tick triggered");
        try {
            orchestrator.tick();
        } catch (Exception e) {
            // Don't rethrow - we want the scheduler to keep running
            log.error("Unexpected error in scheduled tick: {}", e.getMessage(), e);
        }
    }
}
