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
package org.pglens.agent.sql;

import lombok.experimental.UtilityClass;

/**
 * Replaces literal values in SQL text with {@code ?} placeholders.
 *
 * <p>String, dollar-quoted and numeric literals are replaced. Identifiers, {@code $n}
 * parameter markers, casts, comments and whitespace are kept verbatim.
 */
@UtilityClass
public final class SqlRedactor {

    public static final String PLACEHOLDER = "?";

    /**
     * Redact all literals. Never fails, truncated input is redacted up to its end.
     *
     * @param sql SQL text, may be a full statement or an expression fragment
     * @return Redacted text, or the input itself when null or empty
     */
    public static String redact(String sql) {
        if (sql == null || sql.isEmpty()) {
            return sql;
        }
        StringBuilder redacted = new StringBuilder(sql.length());
        for (SqlToken token : SqlLexer.tokenizeLenient(sql)) {
            redacted.append(token.isLiteral() ? PLACEHOLDER : token.text());
        }
        return redacted.toString();
    }
}
