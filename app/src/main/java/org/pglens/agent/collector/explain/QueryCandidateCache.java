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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Active set, finished set and denylist of query candidates, kept in one map so that
 * an identity always belongs to exactly one bucket.
 *
 * <p>Not thread-safe. Only the collection tick touches it.
 */
public class QueryCandidateCache {

    private final Map<QueryKey, Entry> entries = new LinkedHashMap<>();

    /**
     * @return The candidate's bucket, empty if the identity has never been seen
     */
    public Optional<CacheBucket> bucketOf(QueryKey key) {
        Entry entry = entries.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.bucket());
    }

    /**
     * @return The candidate last recorded for the identity, empty if never seen
     */
    public Optional<QueryCandidate> get(QueryKey key) {
        Entry entry = entries.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.candidate());
    }

    /**
     * Queue the candidate, replacing whatever was recorded for its identity.
     */
    public void enqueue(QueryCandidate candidate) {
        entries.put(candidate.key(), new Entry(candidate, CacheBucket.ACTIVE));
    }

    /**
     * Move a processed candidate out of the active set.
     *
     * @param candidate  Candidate that was processed
     * @param transition Target bucket
     */
    public void complete(QueryCandidate candidate, CacheTransition transition) {
        QueryCandidate recorded = transition == CacheTransition.DENYLISTED ? candidate.withFailure() : candidate;
        entries.put(candidate.key(), new Entry(recorded, transition.bucket()));
    }

    /**
     * Snapshot of up to {@code limit} active candidates, in insertion order.
     */
    public List<QueryCandidate> activeCandidates(int limit) {
        List<QueryCandidate> active = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (active.size() >= limit) {
                break;
            }
            if (entry.bucket() == CacheBucket.ACTIVE) {
                active.add(entry.candidate());
            }
        }
        return active;
    }

    public int count(CacheBucket bucket) {
        int count = 0;
        for (Entry entry : entries.values()) {
            if (entry.bucket() == bucket) {
                count++;
            }
        }
        return count;
    }

    public boolean hasActive() {
        return count(CacheBucket.ACTIVE) > 0;
    }

    private record Entry(QueryCandidate candidate, CacheBucket bucket) {
    }
}
