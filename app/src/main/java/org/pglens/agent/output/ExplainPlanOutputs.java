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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes {@link ExplainPlanOutput}s into the logfmt payload shipped to the log sink
 * and decodes them back.
 *
 * <p>Payload format: {@code schema="<database>" digest="<query id>" explain_plan_output="<base64 json>"}.
 */
public class ExplainPlanOutputs {

    private static final Pattern OUTPUT_FIELD = Pattern.compile("explain_plan_output=\"([^\"]*)\"");

    private final ObjectMapper objectMapper;

    public ExplainPlanOutputs() {
        this(new ObjectMapper());
    }

    public ExplainPlanOutputs(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Serialize the output to JSON.
     *
     * @throws JsonProcessingException If the output cannot be serialized
     */
    public String toJson(ExplainPlanOutput output) throws JsonProcessingException {
        return objectMapper.writeValueAsString(output);
    }

    /**
     * Build the logfmt payload for one output.
     *
     * @param schemaName Database the query ran in
     * @param digest     Query identifier
     * @param output     Output to encode
     * @return logfmt payload
     * @throws JsonProcessingException If the output cannot be serialized
     */
    public String logMessage(String schemaName, String digest, ExplainPlanOutput output)
            throws JsonProcessingException {
        String encoded = Base64.getEncoder().encodeToString(toJson(output).getBytes(StandardCharsets.UTF_8));
        return "schema=\"%s\" digest=\"%s\" explain_plan_output=\"%s\"".formatted(schemaName, digest, encoded);
    }

    /**
     * Extract the output from a logfmt line or payload built by {@link #logMessage}.
     *
     * @param line logfmt line
     * @return Decoded output
     * @throws IOException If the line has no output field or the field cannot be decoded
     */
    public ExplainPlanOutput decodeLogLine(String line) throws IOException {
        Matcher matcher = OUTPUT_FIELD.matcher(line);
        if (!matcher.find()) {
            throw new IOException("log line has no explain_plan_output field");
        }
        byte[] json;
        try {
            json = Base64.getDecoder().decode(matcher.group(1));
        } catch (IllegalArgumentException e) {
            throw new IOException("failed to decode base64 explain plan output: " + e.getMessage(), e);
        }
        return objectMapper.readValue(json, ExplainPlanOutput.class);
    }
}
