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

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * A connection used for exactly one EXPLAIN attempt, together with whatever owns it.
 *
 * <p>Closing closes the connection first and then releases the owner.
 */
@Slf4j
public final class DedicatedConnection implements AutoCloseable {

    private final Connection connection;
    private final Runnable release;

    public DedicatedConnection(Connection connection, Runnable release) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.release = release;
    }

    public DedicatedConnection(Connection connection) {
        this(connection, null);
    }

    public Connection connection() {
        return connection;
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close explain connection: {}", e.getMessage());
        } finally {
            if (release != null) {
                release.run();
            }
        }
    }
}
