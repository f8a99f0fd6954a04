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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One node of the plan returned by {@code EXPLAIN (FORMAT JSON)}. Fields not listed are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PgPlanNode(@JsonProperty("Node Type") String nodeType,
                         @JsonProperty("Alias") String alias,
                         @JsonProperty("Relation Name") String relationName,
                         @JsonProperty("Parent Relationship") String parentRelationship,
                         @JsonProperty("Partial Mode") String partialMode,
                         @JsonProperty("Strategy") String strategy,
                         @JsonProperty("Parallel Aware") boolean parallelAware,
                         @JsonProperty("Join Type") String joinType,
                         @JsonProperty("Hash Cond") String hashCond,
                         @JsonProperty("Filter") String filter,
                         @JsonProperty("Startup Cost") double startupCost,
                         @JsonProperty("Total Cost") double totalCost,
                         @JsonProperty("Plan Rows") long planRows,
                         @JsonProperty("Plan Width") long planWidth,
                         @JsonProperty("Group Key") List<String> groupKey,
                         @JsonProperty("Sort Key") List<String> sortKey,
                         @JsonProperty("Index Name") String indexName,
                         @JsonProperty("Plans") List<PgPlanNode> plans) {

    public PgPlanNode {
        plans = plans == null ? List.of() : List.copyOf(plans);
    }

    /**
     * Top-level element of the EXPLAIN JSON array.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PgExplainPlan(@JsonProperty("Plan") PgPlanNode plan) {
    }
}
