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
package org.pglens.agent.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration of the EXPLAIN plan sampling collector.
 */
@ConfigMapping(prefix = "app.explain-plans")
public interface ExplainPlansConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * Interval between two collection ticks.
     *
     * @return Collect interval (default: 1 minute)
     */
    @WithDefault("1m")
    Duration collectInterval();

    /**
     * Fraction of the queued queries explained per tick, between 0.0 and 1.0.
     * 0.0 reads the catalog once and never explains anything.
     *
     * @return Per-collect ratio (default: 1.0)
     */
    @WithDefault("1.0")
    double perCollectRatio();

    /**
     * Database names never considered for EXPLAIN, in addition to the provider databases.
     */
    Optional<Set<String>> excludeDatabases();

    /**
     * Overrides the engine version read from {@code SHOW server_version}.
     */
    Optional<String> engineVersion();
}
