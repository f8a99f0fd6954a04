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

import java.time.Duration;
import java.time.Instant;

/**
 * Result of one collection tick.
 *
 * @param timestamp  When the tick started
 * @param successful Whether the tick completed successfully
 * @param error      Optional error if the tick failed
 */
public record CycleResult(Instant timestamp, boolean successful, Throwable error) {

    public static CycleResult successful(Instant start) {
        return new CycleResult(start, true, null);
    }

    public static CycleResult failed(Instant start) {
        return new CycleResult(start, false, null);
    }

    public static CycleResult failed(Instant start, Throwable error) {
        return new CycleResult(start, false, error);
    }

    /**
     * Get the age of this result.
     *
     * @return Duration since the tick started
     */
    public Duration getAge() {
        return Duration.between(timestamp, Instant.now());
    }
}
