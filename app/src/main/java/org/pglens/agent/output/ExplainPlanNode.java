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

import java.util.List;

/**
 * One node of a normalized plan tree. Immutable once built.
 *
 * @param operation Operation label, e.g. {@code Finalize Group Aggregate}
 * @param details   Node details
 * @param children  Child nodes in planner order (never null)
 */
@JsonPropertyOrder({"operation", "details", "children"})
public record ExplainPlanNode(String operation,
                              ExplainPlanNodeDetails details,
                              @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ExplainPlanNode> children) {

    public ExplainPlanNode {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
