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

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether an EXPLAIN failure will keep failing for the same statement.
 *
 * <p>Non-recoverable failures are matched on the message chain and on the SQLSTATE of any
 * {@link SQLException} in the cause chain. Everything else (timeouts, dropped connections)
 * is recoverable.
 */
public class ExplainFailureClassifier {

    static final List<String> NON_RECOVERABLE_MESSAGES = List.of(
            "permission denied",
            "pg_hba.conf rejects connection for host",
            "no pg_hba.conf entry for host",
            "syntax error"
    );

    // insufficient_privilege, syntax_error, invalid_authorization_specification
    static final Set<String> NON_RECOVERABLE_SQL_STATES = Set.of("42501", "42601", "28000");

    public boolean isNonRecoverable(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof SQLException sqlException
                    && sqlException.getSQLState() != null
                    && NON_RECOVERABLE_SQL_STATES.contains(sqlException.getSQLState())) {
                return true;
            }
            String message = t.getMessage();
            if (message == null) {
                continue;
            }
            String lower = message.toLowerCase(Locale.ROOT);
            for (String marker : NON_RECOVERABLE_MESSAGES) {
                if (lower.contains(marker)) {
                    return true;
                }
            }
        }
        return false;
    }
}
