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

import java.time.Instant;

/**
 * A structured log line handed to an {@link EntryHandler}.
 *
 * @param timestamp When the entry was built
 * @param level     Log level, e.g. {@code info}
 * @param op        Operation that produced the entry
 * @param message   logfmt key/value payload
 */
public record LogEntry(Instant timestamp, String level, String op, String message) {

    public static LogEntry info(Instant timestamp, String op, String message) {
        return new LogEntry(timestamp, "info", op, message);
    }

    /**
     * @return The full logfmt line, {@code level=<level> op=<op> <message>}
     */
    public String line() {
        return "level=" + level + " op=" + op + " " + message;
    }
}
