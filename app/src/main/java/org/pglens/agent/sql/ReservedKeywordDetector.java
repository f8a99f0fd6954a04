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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Detects keywords that make a statement unsafe or pointless to EXPLAIN.
 *
 * <p>Only word tokens are matched, so keywords inside string literals, quoted identifiers
 * or comments never count. A keyword is exempt when the significant tokens immediately
 * preceding it equal its exemption prefixes, most recent first.
 */
public class ReservedKeywordDetector {

    /**
     * Write, DDL, transaction and session keywords, with their exemption prefixes.
     */
    public static final Map<String, List<String>> EXPLAIN_RESERVED_WORD_DENYLIST = Map.ofEntries(
            // DML
            Map.entry("INSERT", List.of()),
            Map.entry("UPDATE", List.of("FOR")),
            Map.entry("DELETE", List.of()),
            Map.entry("REPLACE", List.of()),
            Map.entry("MERGE", List.of()),
            Map.entry("UPSERT", List.of()),
            // DDL
            Map.entry("CREATE", List.of()),
            Map.entry("ALTER", List.of()),
            Map.entry("DROP", List.of()),
            Map.entry("RENAME", List.of()),
            Map.entry("TRUNCATE", List.of()),
            // transaction control
            Map.entry("BEGIN", List.of()),
            Map.entry("COMMIT", List.of()),
            Map.entry("ROLLBACK", List.of()),
            Map.entry("SAVEPOINT", List.of()),
            Map.entry("TRANSACTION", List.of()),
            // database and schema management
            Map.entry("USE", List.of()),
            Map.entry("DATABASE", List.of()),
            Map.entry("SCHEMA", List.of()),
            // maintenance
            Map.entry("REINDEX", List.of()),
            Map.entry("ANALYZE", List.of()),
            Map.entry("OPTIMIZE", List.of()),
            // permissions
            Map.entry("GRANT", List.of()),
            Map.entry("REVOKE", List.of()),
            // MySQL write modifiers
            Map.entry("LOAD", List.of()),
            Map.entry("DELAYED", List.of()),
            Map.entry("IGNORE", List.of()),
            Map.entry("LOW_PRIORITY", List.of()),
            Map.entry("HIGH_PRIORITY", List.of()),
            Map.entry("QUICK", List.of()),
            // PostgreSQL commands
            Map.entry("COPY", List.of()),
            Map.entry("VACUUM", List.of()),
            Map.entry("CLUSTER", List.of()),
            Map.entry("LISTEN", List.of()),
            Map.entry("NOTIFY", List.of()),
            Map.entry("DISCARD", List.of()),
            Map.entry("PREPARE", List.of()),
            Map.entry("EXECUTE", List.of()),
            Map.entry("DEALLOCATE", List.of()),
            Map.entry("RESET", List.of()),
            Map.entry("SET", List.of()),
            Map.entry("UNLISTEN", List.of()),
            Map.entry("DECLARE", List.of()),
            Map.entry("CLOSE", List.of()),
            Map.entry("EXPLAIN", List.of())
    );

    private final Map<String, List<String>> denylist;

    public ReservedKeywordDetector() {
        this(EXPLAIN_RESERVED_WORD_DENYLIST);
    }

    public ReservedKeywordDetector(Map<String, List<String>> denylist) {
        Map<String, List<String>> normalized = new HashMap<>();
        denylist.forEach((keyword, prefixes) -> normalized.put(
                keyword.toUpperCase(Locale.ROOT),
                prefixes.stream().map(p -> p.toUpperCase(Locale.ROOT)).toList()));
        this.denylist = Map.copyOf(normalized);
    }

    /**
     * Check whether the statement contains a denylisted keyword.
     *
     * @param sql Statement text
     * @return true if a non-exempt denylisted keyword is present
     * @throws SqlLexerException If the statement cannot be tokenized
     */
    public boolean containsReservedKeywords(String sql) throws SqlLexerException {
        List<String> previous = new ArrayList<>();
        for (SqlToken token : SqlLexer.tokenize(sql)) {
            if (token.isTrivia()) {
                continue;
            }
            String text = token.text().toUpperCase(Locale.ROOT);
            if (token.kind() == SqlToken.Kind.WORD) {
                List<String> prefixes = denylist.get(text);
                if (prefixes != null && !isExempt(prefixes, previous)) {
                    return true;
                }
            }
            previous.add(text);
        }
        return false;
    }

    private static boolean isExempt(List<String> prefixes, List<String> previous) {
        if (prefixes.isEmpty() || previous.size() < prefixes.size()) {
            return false;
        }
        for (int i = 0; i < prefixes.size(); i++) {
            if (!prefixes.get(i).equals(previous.get(previous.size() - 1 - i))) {
                return false;
            }
        }
        return true;
    }
}
