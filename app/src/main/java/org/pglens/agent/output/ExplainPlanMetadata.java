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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Metadata block of an {@link ExplainPlanOutput}.
 *
 * @param databaseEngine         Always {@code PostgreSQL}
 * @param databaseVersion        Engine version as {@code major.minor.patch}
 * @param queryIdentifier        {@code pg_stat_statements.queryid}
 * @param generatedAt            Tick start time, RFC 3339
 * @param processingResult       Outcome of the attempt
 * @param processingResultReason Reason for a skip or an error, empty on success
 */
@JsonPropertyOrder({"databaseEngine", "databaseVersion", "queryIdentifier", "generatedAt",
        "processingResult", "processingResultReason"})
public record ExplainPlanMetadata(String databaseEngine,
                                  String databaseVersion,
                                  String queryIdentifier,
                                  String generatedAt,
                                  ProcessingResult processingResult,
                                  String processingResultReason) {
}
