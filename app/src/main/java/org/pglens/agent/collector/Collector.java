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
package org.pglens.agent.collector;

import org.pglens.agent.model.PostgresVersion;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Interface for periodic collectors driven by the {@link CollectorOrchestrator}.
 *
 * <p><b>Thread Safety:</b> ticks are serialized by the orchestrator, so implementations
 * are never called concurrently.
 */
public interface Collector {

    /**
     * Get the name of this collector.
     *
     * <p>Used for logging, identification, and the {@code collector} metric tag.
     *
     * @return Collector name (should be unique and descriptive)
     */
    String getName();

    /**
     * Run one collection tick.
     *
     * @param connection Pooled catalog connection (never null, already open)
     * @param version    PostgreSQL version information (never null)
     * @throws SQLException If a database operation fails (will be logged by orchestrator)
     */
    void collect(Connection connection, PostgresVersion version) throws SQLException;

    /**
     * Check if this collector is enabled.
     *
     * <p>Disabled collectors are not called by the orchestrator.
     *
     * @return {@code true} if enabled, {@code false} otherwise
     */
    boolean isEnabled();

    /**
     * Release resources and stop processing. Must be idempotent.
     */
    default void stop() {
    }
}
