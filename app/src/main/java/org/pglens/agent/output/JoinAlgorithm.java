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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Join algorithms of the output schema shared with plan consumers.
 *
 * <p>Only {@link #HASH} is derived from native plans today; the other values keep
 * {@link ExplainPlanOutputs#decodeLogLine(String)} able to read every line the schema allows.
 */
public enum JoinAlgorithm {
    HASH("hash"),
    MERGE("merge"),
    NESTED_LOOP("nested_loop");

    private final String value;

    JoinAlgorithm(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
