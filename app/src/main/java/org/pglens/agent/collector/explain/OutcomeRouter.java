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
import lombok.extern.slf4j.Slf4j;
import org.pglens.agent.common.Constants;
import org.pglens.agent.metrics.ExplainMetrics;
import org.pglens.agent.output.EntryHandler;
import org.pglens.agent.output.ExplainPlanMetadata;
import org.pglens.agent.output.ExplainPlanOutput;
import org.pglens.agent.output.ExplainPlanOutputs;
import org.pglens.agent.output.LogEntry;
import org.pglens.agent.output.ProcessingResult;

import java.time.Clock;

/**
 * Turns an attempt outcome into exactly one output record and hands it to the log sink.
 */
@Slf4j
public class OutcomeRouter {

    public static final String REASON_DENYLISTED = "query denylisted";

    private final String databaseVersion;
    private final ExplainPlanOutputs outputs;
    private final EntryHandler entryHandler;
    private final ExplainMetrics metrics;
    private final Clock clock;

    public OutcomeRouter(String databaseVersion,
                         ExplainPlanOutputs outputs,
                         EntryHandler entryHandler,
                         ExplainMetrics metrics,
                         Clock clock) {
        this.databaseVersion = databaseVersion;
        this.outputs = outputs;
        this.entryHandler = entryHandler;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Emit the output for one candidate.
     *
     * <p>A successful outcome whose output cannot be serialized is emitted as a
     * non-recoverable error instead.
     *
     * @param candidate   Candidate the outcome belongs to
     * @param generatedAt Tick start time, RFC 3339
     * @param outcome     Outcome of the attempt
     * @return The outcome actually emitted
     */
    public AttemptOutcome route(QueryCandidate candidate, String generatedAt, AttemptOutcome outcome) {
        ExplainPlanOutput output = new ExplainPlanOutput(
                new ExplainPlanMetadata(
                        Constants.DATABASE_ENGINE,
                        databaseVersion,
                        candidate.queryId(),
                        generatedAt,
                        outcome.result(),
                        outcome.reason()),
                outcome.result() == ProcessingResult.SUCCESS ? outcome.plan() : null);

        String message;
        try {
            message = outputs.logMessage(candidate.database(), candidate.queryId(), output);
        } catch (JsonProcessingException e) {
            log.error("Failed to marshal explain plan output for query {} in {}: {}",
                    candidate.queryId(), candidate.database(), e.getOriginalMessage());
            if (outcome.result() == ProcessingResult.SUCCESS) {
                return route(candidate, generatedAt,
                        AttemptOutcome.error("failed to marshal explain plan output: " + e.getOriginalMessage(), true));
            }
            return outcome;
        }

        try {
            entryHandler.send(LogEntry.info(clock.instant(), Constants.OP_EXPLAIN_PLAN_OUTPUT, message));
            metrics.incrementOutput(outcome.result());
        } catch (RuntimeException e) {
            log.error("Failed to send explain plan output for query {} in {}: {}",
                    candidate.queryId(), candidate.database(), e.getMessage(), e);
        }
        return outcome;
    }
}
