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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.pglens.agent.output.ExplainPlanNode;
import org.pglens.agent.output.ExplainPlanNodeDetails;
import org.pglens.agent.output.JoinAlgorithm;
import org.pglens.agent.sql.SqlRedactor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts PostgreSQL's native JSON plan into the engine-neutral plan tree.
 */
public class PlanTreeNormalizer {

    private static final TypeReference<List<PgPlanNode.PgExplainPlan>> EXPLAIN_JSON = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public PlanTreeNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse and normalize an {@code EXPLAIN (FORMAT JSON)} result.
     *
     * @param explainJson Single-element JSON array wrapping a {@code Plan} object
     * @return Root of the normalized tree
     * @throws PlanNormalizationException If the JSON is invalid or has no plan
     */
    public ExplainPlanNode normalize(String explainJson) throws PlanNormalizationException {
        List<PgPlanNode.PgExplainPlan> plans;
        try {
            plans = objectMapper.readValue(explainJson, EXPLAIN_JSON);
        } catch (JsonProcessingException e) {
            throw new PlanNormalizationException("failed to parse explain plan json: " + e.getOriginalMessage(), e);
        }
        if (plans == null || plans.isEmpty() || plans.get(0) == null || plans.get(0).plan() == null) {
            throw new PlanNormalizationException("explain plan json contains no plan");
        }
        return toNode(plans.get(0).plan());
    }

    /**
     * Redact every string value of the native plan JSON, for logging.
     *
     * @param explainJson Native plan JSON
     * @return Redacted JSON, or the redacted raw text when the input is not valid JSON
     */
    public String redactNativePlan(String explainJson) {
        try {
            JsonNode root = objectMapper.readTree(explainJson);
            redactStrings(root);
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            return SqlRedactor.redact(explainJson);
        }
    }

    private static void redactStrings(JsonNode node) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isTextual()) {
                    field.setValue(TextNode.valueOf(SqlRedactor.redact(field.getValue().asText())));
                } else {
                    redactStrings(field.getValue());
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                if (array.get(i).isTextual()) {
                    array.set(i, TextNode.valueOf(SqlRedactor.redact(array.get(i).asText())));
                } else {
                    redactStrings(array.get(i));
                }
            }
        }
    }

    ExplainPlanNode toNode(PgPlanNode node) {
        ExplainPlanNodeDetails details = ExplainPlanNodeDetails.builder()
                .estimatedRows(node.planRows())
                .estimatedCost(exclusiveCost(node))
                .groupByKeys(nonEmpty(node.groupKey()))
                .sortKeys(nonEmpty(node.sortKey()))
                .joinType(nonBlank(node.joinType()))
                .condition(node.filter() == null || node.filter().isEmpty() ? null : SqlRedactor.redact(node.filter()))
                .alias(nonBlank(node.alias()))
                .keyUsed(nonBlank(node.indexName()))
                .joinAlgorithm("Hash Join".equalsIgnoreCase(node.nodeType()) ? JoinAlgorithm.HASH : null)
                .build();

        List<ExplainPlanNode> children = new ArrayList<>(node.plans().size());
        for (PgPlanNode child : node.plans()) {
            children.add(toNode(child));
        }
        return new ExplainPlanNode(operation(node), details, children);
    }

    /**
     * Operation label: partial mode, strategy term, {@code Parallel}, then the node type.
     */
    static String operation(PgPlanNode node) {
        StringBuilder label = new StringBuilder();
        if (node.partialMode() != null && !node.partialMode().isEmpty()) {
            label.append(node.partialMode()).append(' ');
        }
        String strategy = node.strategy();
        if (strategy != null && !strategy.isEmpty()) {
            if ("Sorted".equals(strategy)) {
                label.append("Group ");
            } else if (!"Plain".equals(strategy)) {
                label.append(strategy).append(' ');
            }
        }
        if (node.parallelAware()) {
            label.append("Parallel ");
        }
        label.append(node.nodeType() == null ? "" : node.nodeType());
        return label.toString();
    }

    /**
     * Cost of the node alone: its total cost minus the total cost of each direct child,
     * rounded half-up to 2 decimals and never negative.
     */
    static double exclusiveCost(PgPlanNode node) {
        double cost = node.totalCost();
        for (PgPlanNode child : node.plans()) {
            cost -= child.totalCost();
        }
        double rounded = BigDecimal.valueOf(cost).setScale(2, RoundingMode.HALF_UP).doubleValue();
        return rounded <= 0 ? 0.0 : rounded;
    }

    private static String nonBlank(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static List<String> nonEmpty(List<String> values) {
        return values == null || values.isEmpty() ? null : values;
    }
}
