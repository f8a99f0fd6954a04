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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExplainExecutorTest {

    private static final String PLAN_JSON = "[{\"Plan\": {\"Node Type\": \"Result\", \"Total Cost\": 0.01}}]";

    @Mock
    private ExplainConnectionFactory connectionFactory;

    @Mock
    private Connection connection;

    @Mock
    private Statement statement;

    @Mock
    private ResultSet resultSet;

    @Mock
    private Runnable release;

    private ExplainExecutor executor;

    @BeforeEach
    void setUp() throws SQLException {
        executor = new ExplainExecutor(connectionFactory);
        lenient().when(connectionFactory.open("testdb")).thenReturn(new DedicatedConnection(connection, release));
        lenient().when(connection.createStatement()).thenReturn(statement);
    }

    @Test
    void testFetch_NoParameters_ProtocolInOrder() throws Exception {
        // Setup
        when(statement.executeQuery(anyString())).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getString(1)).thenReturn(PLAN_JSON);
        QueryCandidate candidate = QueryCandidate.of("testdb", "123456", "SELECT * FROM users", 1, null);

        // Execute
        String json = executor.fetchExplainPlanJson(candidate);

        // Verify
        assertEquals(PLAN_JSON, json);
        InOrder inOrder = inOrder(statement, connection, release);
        inOrder.verify(statement).execute("PREPARE explain_plan_123456 AS SELECT * FROM users");
        inOrder.verify(statement).execute("SET search_path TO \"testdb\", public");
        inOrder.verify(statement).execute("SET plan_cache_mode = force_generic_plan");
        inOrder.verify(statement).executeQuery("EXPLAIN (FORMAT JSON) EXECUTE explain_plan_123456");
        inOrder.verify(statement).execute("DEALLOCATE explain_plan_123456");
        inOrder.verify(connection).close();
        inOrder.verify(release).run();
    }

    @Test
    void testFetch_WithParameters_PassesNulls() throws Exception {
        when(statement.executeQuery(anyString())).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getString(1)).thenReturn(PLAN_JSON);
        QueryCandidate candidate = QueryCandidate.of("testdb", "-42",
                "SELECT * FROM users WHERE id = $1 AND status = $2 AND note <> '$3'", 1, null);

        executor.fetchExplainPlanJson(candidate);

        verify(statement).executeQuery("EXPLAIN (FORMAT JSON) EXECUTE explain_plan__42(null,null)");
    }

    @Test
    void testFetch_PrepareFails_NoDeallocateButConnectionClosed() throws Exception {
        // Setup
        when(statement.execute(startsWith("PREPARE"))).thenThrow(new SQLException("ERROR: syntax error at or near \"FROM\""));
        QueryCandidate candidate = QueryCandidate.of("testdb", "1", "SELECT FROM FROM", 1, null);

        // Execute
        ExplainException exception = assertThrows(ExplainException.class, () -> executor.fetchExplainPlanJson(candidate));

        // Verify
        assertTrue(exception.getMessage().startsWith("failed to prepare explain plan: "));
        verify(statement, never()).execute(startsWith("DEALLOCATE"));
        verify(connection).close();
        verify(release).run();
    }

    @Test
    void testFetch_ExplainFails_StillDeallocates() throws Exception {
        when(statement.executeQuery(anyString())).thenThrow(new SQLException("canceling statement due to statement timeout"));
        QueryCandidate candidate = QueryCandidate.of("testdb", "7", "SELECT 1", 1, null);

        ExplainException exception = assertThrows(ExplainException.class, () -> executor.fetchExplainPlanJson(candidate));

        assertTrue(exception.getMessage().startsWith("failed to run explain plan: "));
        verify(statement).execute("DEALLOCATE explain_plan_7");
        verify(connection).close();
    }

    @Test
    void testFetch_SearchPathFails_StillDeallocates() throws Exception {
        lenient().when(statement.execute(startsWith("SET search_path"))).thenThrow(new SQLException("boom"));
        QueryCandidate candidate = QueryCandidate.of("testdb", "7", "SELECT 1", 1, null);

        ExplainException exception = assertThrows(ExplainException.class, () -> executor.fetchExplainPlanJson(candidate));

        assertEquals("failed to set search path: boom", exception.getMessage());
        verify(statement).execute("DEALLOCATE explain_plan_7");
    }

    @Test
    void testFetch_DeallocateFails_ResultStillReturned() throws Exception {
        lenient().when(statement.execute(startsWith("DEALLOCATE"))).thenThrow(new SQLException("connection lost"));
        when(statement.executeQuery(anyString())).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getString(1)).thenReturn(PLAN_JSON);
        QueryCandidate candidate = QueryCandidate.of("testdb", "7", "SELECT 1", 1, null);

        assertEquals(PLAN_JSON, executor.fetchExplainPlanJson(candidate));
        verify(connection).close();
    }

    @Test
    void testFetch_ConnectionFails_Wrapped() throws Exception {
        when(connectionFactory.open("otherdb")).thenThrow(new SQLException("FATAL: no pg_hba.conf entry for host"));
        QueryCandidate candidate = QueryCandidate.of("otherdb", "7", "SELECT 1", 1, null);

        ExplainException exception = assertThrows(ExplainException.class, () -> executor.fetchExplainPlanJson(candidate));

        assertTrue(exception.getMessage().startsWith("failed to get connection: "));
    }

    @Test
    void testFetch_NoDatabaseSegment_Wrapped() throws Exception {
        when(connectionFactory.open("otherdb")).thenThrow(new IllegalArgumentException("no database name found in connection url"));
        QueryCandidate candidate = QueryCandidate.of("otherdb", "7", "SELECT 1", 1, null);

        ExplainException exception = assertThrows(ExplainException.class, () -> executor.fetchExplainPlanJson(candidate));

        assertTrue(exception.getMessage().startsWith("failed to replace database name in connection url: "));
    }

    @Test
    void testPreparedStatementName_NormalizesNonAlphanumerics() {
        assertEquals("explain_plan_123456", ExplainExecutor.preparedStatementName("123456"));
        assertEquals("explain_plan__8817230946", ExplainExecutor.preparedStatementName("-8817230946"));
    }

    @Test
    void testCountParameters_HighestMarkerOutsideLiterals() {
        assertEquals(0, ExplainExecutor.countParameters("SELECT 1"));
        assertEquals(2, ExplainExecutor.countParameters("SELECT $1, $2, $1"));
        assertEquals(1, ExplainExecutor.countParameters("SELECT $1 /* $5 */, '$9'"));
    }
}
