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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;

import java.util.List;

/**
 * Per-node details of a normalized plan. Absent values are not serialized.
 *
 * @param estimatedRows Planner row estimate
 * @param estimatedCost Cost of this node alone, children excluded, rounded to 2 decimals
 * @param alias         Relation alias
 * @param keyUsed       Index used by the node
 * @param joinType      Join type such as {@code Inner} or {@code Left}
 * @param joinAlgorithm Join algorithm, only set for hash joins
 * @param condition     Redacted filter expression
 * @param groupByKeys   Group keys
 * @param sortKeys      Sort keys
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"estimatedRows", "estimatedCost", "alias", "keyUsed", "joinType", "joinAlgorithm",
        "condition", "groupByKeys", "sortKeys"})
public record ExplainPlanNodeDetails(long estimatedRows,
                                     Double estimatedCost,
                                     String alias,
                                     String keyUsed,
                                     String joinType,
                                     JoinAlgorithm joinAlgorithm,
                                     String condition,
                                     List<String> groupByKeys,
                                     List<String> sortKeys) {

    public ExplainPlanNodeDetails {
        groupByKeys = groupByKeys == null ? null : List.copyOf(groupByKeys);
        sortKeys = sortKeys == null ? null : List.copyOf(sortKeys);
    }
}
