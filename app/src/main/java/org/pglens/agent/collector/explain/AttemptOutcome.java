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

import org.pglens.agent.output.ExplainPlanNode;
import org.pglens.agent.output.ProcessingResult;

/**
 * Result of processing one candidate.
 *
 * @param result         Processing result reported in the output
 * @param reason         Skip or error reason, empty on success
 * @param plan           Normalized plan, only set on success
 * @param nonRecoverable Whether the candidate must be denylisted
 */
public record AttemptOutcome(ProcessingResult result, String reason, ExplainPlanNode plan, boolean nonRecoverable) {

    public static AttemptOutcome success(ExplainPlanNode plan) {
        return new AttemptOutcome(ProcessingResult.SUCCESS, "", plan, false);
    }

    public static AttemptOutcome skipped(String reason) {
        return new AttemptOutcome(ProcessingResult.SKIPPED, reason, null, false);
    }

    public static AttemptOutcome error(String reason, boolean nonRecoverable) {
        return new AttemptOutcome(ProcessingResult.ERROR, reason, null, nonRecoverable);
    }
}
