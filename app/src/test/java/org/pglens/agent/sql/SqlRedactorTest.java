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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlRedactorTest {

    @Test
    void testRedact_StringAndCast() {
        assertEquals("(to_date = ?::date)", SqlRedactor.redact("(to_date = '9999-01-01'::date)"));
    }

    @Test
    void testRedact_Numbers() {
        assertEquals("(status = ?) AND (amount > ?)", SqlRedactor.redact("(status = 42) AND (amount > 1.5e3)"));
    }

    @Test
    void testRedact_KeepsParametersIdentifiersAndComments() {
        String sql = "SELECT \"t1\".id /* 5 */ FROM t1 WHERE id = $1";

        assertEquals(sql, SqlRedactor.redact(sql));
    }

    @Test
    void testRedact_DollarQuotedString() {
        assertEquals("SELECT ?", SqlRedactor.redact("SELECT $tag$secret$tag$"));
    }

    @Test
    void testRedact_TruncatedInput() {
        assertEquals("WHERE name = ?", SqlRedactor.redact("WHERE name = 'unterminated..."));
    }

    @Test
    void testRedact_NullAndEmpty() {
        assertNull(SqlRedactor.redact(null));
        assertEquals("", SqlRedactor.redact(""));
    }
}
