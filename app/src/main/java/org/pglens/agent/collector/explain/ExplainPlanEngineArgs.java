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
import lombok.Builder;
import org.pglens.agent.metrics.ExplainMetrics;
import org.pglens.agent.output.EntryHandler;

import java.time.Clock;
import java.util.Set;

/**
 * Construction arguments of an {@link ExplainPlanEngine}.
 *
 * @param engineVersion     Server version string, vendor suffixes allowed
 * @param perScrapeRatio    Fraction of the active set processed per tick, 0.0 to 1.0
 * @param excludeDatabases  Databases never considered, in addition to the provider databases
 * @param connectionFactory Opens the dedicated per-candidate connections
 * @param entryHandler      Log sink receiving the outputs
 * @param metrics           Engine metrics
 * @param objectMapper      JSON mapper, defaults to a plain {@link ObjectMapper}
 * @param clock             Time source, defaults to UTC system time
 */
@Builder
public record ExplainPlanEngineArgs(String engineVersion,
                                    double perScrapeRatio,
                                    Set<String> excludeDatabases,
                                    ExplainConnectionFactory connectionFactory,
                                    EntryHandler entryHandler,
                                    ExplainMetrics metrics,
                                    ObjectMapper objectMapper,
                                    Clock clock) {
}
