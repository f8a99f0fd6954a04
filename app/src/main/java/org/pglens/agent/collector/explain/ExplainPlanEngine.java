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
import lombok.extern.slf4j.Slf4j;
import org.pglens.agent.metrics.ExplainMetrics;
import org.pglens.agent.model.PostgresVersion;
import org.pglens.agent.output.ExplainPlanNode;
import org.pglens.agent.output.ExplainPlanOutputs;
import org.pglens.agent.sql.ReservedKeywordDetector;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Samples EXPLAIN plans of the statements recorded in {@code pg_stat_statements}.
 *
 * <p>Each tick drains at most {@code batchSize} candidates from the active set, one at a time.
 * When the active set is empty the catalog is read again first. Every processed candidate
 * leaves the active set for the finished set or, after a non-recoverable failure, for the
 * denylist.
 *
 * <p>Not thread-safe: ticks must be serialized by the caller.
 */
@Slf4j
public class ExplainPlanEngine {

    private final PostgresVersion version;
    private final double perScrapeRatio;
    private final QueryCandidateCache cache = new QueryCandidateCache();
    private final QueryCatalogRefresher refresher;
    private final QueryValidator validator;
    private final ExplainExecutor executor;
    private final ExplainFailureClassifier classifier = new ExplainFailureClassifier();
    private final PlanTreeNormalizer normalizer;
    private final OutcomeRouter router;
    private final ExplainMetrics metrics;
    private final Clock clock;

    private volatile boolean stopped;
    private int batchSize;

    /**
     * @throws IllegalArgumentException If the engine version cannot be parsed or the ratio is out of range
     */
    public ExplainPlanEngine(ExplainPlanEngineArgs args) {
        this.version = PostgresVersion.parseStrict(args.engineVersion());
        if (args.perScrapeRatio() < 0.0 || args.perScrapeRatio() > 1.0 || Double.isNaN(args.perScrapeRatio())) {
            throw new IllegalArgumentException(
                    "per scrape ratio must be between 0.0 and 1.0, got " + args.perScrapeRatio());
        }
        this.perScrapeRatio = args.perScrapeRatio();
        if (perScrapeRatio == 0.0) {
            log.warn("Per scrape ratio is 0.0, no explain plans will be collected");
        }
        this.metrics = Objects.requireNonNull(args.metrics(), "metrics");
        this.clock = args.clock() != null ? args.clock() : Clock.systemUTC();

        ObjectMapper objectMapper = args.objectMapper() != null ? args.objectMapper() : new ObjectMapper();
        Set<String> excludeDatabases = args.excludeDatabases() != null ? args.excludeDatabases() : Set.of();

        this.router = new OutcomeRouter(version.fullVersion(), new ExplainPlanOutputs(objectMapper),
                Objects.requireNonNull(args.entryHandler(), "entryHandler"), metrics, clock);
        this.refresher = new QueryCatalogRefresher(version, excludeDatabases, cache, router);
        this.validator = new QueryValidator(new ReservedKeywordDetector());
        this.executor = new ExplainExecutor(Objects.requireNonNull(args.connectionFactory(), "connectionFactory"));
        this.normalizer = new PlanTreeNormalizer(objectMapper);
    }

    /**
     * Run one tick.
     *
     * @param connection Catalog connection (never null, already open)
     * @throws SQLException If the catalog refresh fails; candidates are retried on the next tick
     */
    public void fetchExplainPlans(Connection connection) throws SQLException {
        if (stopped) {
            return;
        }
        String generatedAt = formatTimestamp(clock.instant());

        try {
            if (!cache.hasActive()) {
                refresh(connection, generatedAt);
            }

            List<QueryCandidate> batch = cache.activeCandidates(batchSize);
            log.debug("Processing {} explain plan candidates", batch.size());
            for (QueryCandidate candidate : batch) {
                if (stopped) {
                    log.debug("Explain plan engine stopped, leaving the rest of the batch queued");
                    break;
                }
                process(candidate, generatedAt);
            }
        } finally {
            metrics.updateCacheSizes(cache.count(CacheBucket.ACTIVE), cache.count(CacheBucket.FINISHED),
                    cache.count(CacheBucket.DENYLISTED));
        }
    }

    private void refresh(Connection connection, String generatedAt) throws SQLException {
        try {
            refresher.refresh(connection, generatedAt, perScrapeRatio);
        } finally {
            // rows applied before a failure stay queued and must be drained by later ticks
            batchSize = QueryCatalogRefresher.batchSize(cache.count(CacheBucket.ACTIVE), perScrapeRatio);
            metrics.setBatchSize(batchSize);
        }
    }

    private void process(QueryCandidate candidate, String generatedAt) {
        AttemptOutcome outcome = AttemptOutcome.error("explain attempt did not complete", false);
        try {
            outcome = router.route(candidate, generatedAt, attempt(candidate));
        } catch (RuntimeException e) {
            log.error("Unexpected error explaining query {} in {}: {}",
                    candidate.queryId(), candidate.database(), e.getMessage(), e);
            outcome = router.route(candidate, generatedAt,
                    AttemptOutcome.error("unexpected error: " + e.getMessage(), false));
        } finally {
            cache.complete(candidate, CacheTransition.classify(outcome));
        }
    }

    private AttemptOutcome attempt(QueryCandidate candidate) {
        Optional<AttemptOutcome> rejected = validator.validate(candidate);
        if (rejected.isPresent()) {
            return rejected.get();
        }

        String explainJson;
        Instant start = clock.instant();
        try {
            explainJson = executor.fetchExplainPlanJson(candidate);
        } catch (ExplainException e) {
            boolean nonRecoverable = classifier.isNonRecoverable(e);
            log.debug("Failed to fetch explain plan json for query {} in {} (non-recoverable: {}): {}",
                    candidate.queryId(), candidate.database(), nonRecoverable, e.getMessage());
            return AttemptOutcome.error(e.getMessage(), nonRecoverable);
        } finally {
            metrics.recordExplainDuration(Duration.between(start, clock.instant()));
        }

        if (explainJson.isBlank()) {
            log.error("Explain plan json of query {} in {} is empty", candidate.queryId(), candidate.database());
            return AttemptOutcome.error("explain plan json is empty", true);
        }

        if (log.isDebugEnabled()) {
            log.debug("Native explain plan of query {} in {}: {}", candidate.queryId(), candidate.database(),
                    Base64.getEncoder().encodeToString(
                            normalizer.redactNativePlan(explainJson).getBytes(StandardCharsets.UTF_8)));
        }

        try {
            ExplainPlanNode plan = normalizer.normalize(explainJson);
            return AttemptOutcome.success(plan);
        } catch (PlanNormalizationException e) {
            log.error("Failed to create explain plan output for query {} in {}: {}",
                    candidate.queryId(), candidate.database(), e.getMessage());
            return AttemptOutcome.error("failed to create explain plan output: " + e.getMessage(), true);
        }
    }

    /**
     * Stop processing. Safe to call more than once; the current candidate is finished first.
     */
    public void stop() {
        if (!stopped) {
            stopped = true;
            log.info("Explain plan engine stopped");
        }
    }

    public boolean isStopped() {
        return stopped;
    }

    public PostgresVersion version() {
        return version;
    }

    QueryCandidateCache cache() {
        return cache;
    }

    int batchSize() {
        return batchSize;
    }

    static String formatTimestamp(Instant instant) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(
                instant.truncatedTo(ChronoUnit.SECONDS).atOffset(ZoneOffset.UTC));
    }
}
