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
package org.pglens.agent.bootstrap;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AgentAppTest {

    @Test
    void testMaskSensitiveInfo_PasswordParameter() {
        assertEquals("jdbc:postgresql://localhost:5432/postgres?user=agent&password=***",
                AgentApp.maskSensitiveInfo("jdbc:postgresql://localhost:5432/postgres?user=agent&password=s3cret"));
    }

    @Test
    void testMaskSensitiveInfo_UserInfo() {
        assertEquals("postgresql://agent:***@db:5432/postgres",
                AgentApp.maskSensitiveInfo("postgresql://agent:s3cret@db:5432/postgres"));
    }

    @Test
    void testMaskSensitiveInfo_Null() {
        assertEquals("not configured", AgentApp.maskSensitiveInfo(null));
    }

    @Test
    void testCenterText() {
        Banners banners = new Banners(20);

        assertEquals("       pglens", banners.centerText("pglens"));
        assertEquals("a very long text that exceeds", banners.centerText("a very long text that exceeds"));
    }
}
