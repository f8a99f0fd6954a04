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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pglens.agent.config.ExplainPlansConfig;
import org.pglens.agent.metrics.ExplainMetrics;
import org.pglens.agent.model.PostgresVersion;
import org.pglens.agent.output.EntryHandler;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExplainPlansCollectorTest {

    @Mock
    private ExplainPlansConfig config;

    @Mock
    private ExplainConnectionFactory connectionFactory;

    @Mock
    private EntryHandler entryHandler;

    @Mock
    private Connection connection;

    @Mock
    private Statement statement;

    @Mock
    private ResultSet resultSet;

    private ExplainPlansCollector collector;

    @BeforeEach
    void setUp() {
        ExplainMetrics metrics = new ExplainMetrics(new SimpleMeterRegistry());
        metrics.init();
        collector = new ExplainPlansCollector(config, connectionFactory, entryHandler, metrics,
                new ObjectMapper(), Clock.fixed(Instant.parse("2026-10-19T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void testGetName() {
        assertEquals("explain_plans", collector.getName());
    }

    @Test
    void testIsEnabled_FollowsConfig() {
        when(config.enabled()).thenReturn(false);

        assertFalse(collector.isEnabled());
    }

    @Test
    void testCollect_DetectedVersion_ReadsCatalog() throws Exception {
        // Setup
        when(config.engineVersion()).thenReturn(Optional.empty());
        when(config.perCollectRatio()).thenReturn(1.0);
        when(config.excludeDatabases()).thenReturn(Optional.of(Set.of("reporting")));
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(contains("'reporting'"))).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(false);

        // Execute
        collector.collect(connection, PostgresVersion.parse("17.2"));

        // Verify - 17+ reads stats_since per statement, no global reset query
        verify(statement).executeQuery(contains("s.stats_since"));
        verify(statement, never()).executeQuery(QueryCatalogRefresher.SELECT_STATS_RESET);
        verifyNoInteractions(connectionFactory, entryHandler);
        assertFalse(collector.isDisabled());
    }

    @Test
    void testCollect_ConfiguredVersionOverridesDetected() throws Exception {
        // Setup
        when(config.engineVersion()).thenReturn(Optional.of("16.4"));
        when(config.perCollectRatio()).thenReturn(1.0);
        when(config.excludeDatabases()).thenReturn(Optional.empty());
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(anyString())).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, false);

        // Execute
        collector.collect(connection, PostgresVersion.parse("17.2"));

        // Verify - 16 falls back to the global reset time
        verify(statement).executeQuery(QueryCatalogRefresher.SELECT_STATS_RESET);
    }

    @Test
    void testCollect_InvalidRatio_DisablesCollector() throws Exception {
        // Setup
        when(config.engineVersion()).thenReturn(Optional.empty());
        when(config.perCollectRatio()).thenReturn(2.0);
        when(config.excludeDatabases()).thenReturn(Optional.empty());

        // Execute
        collector.collect(connection, PostgresVersion.parse("17.2"));
        collector.collect(connection, PostgresVersion.parse("17.2"));

        // Verify
        assertTrue(collector.isDisabled());
        verifyNoInteractions(connection);
        verify(config, times(1)).perCollectRatio();
    }

    @Test
    void testStop_DisablesFurtherCollection() throws Exception {
        collector.stop();
        collector.collect(connection, PostgresVersion.parse("17.2"));

        assertTrue(collector.isDisabled());
        verifyNoInteractions(connection);
    }
}
