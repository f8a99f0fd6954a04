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

/**
 * A lexical token of a PostgreSQL statement. Concatenating the text of all tokens
 * of a statement yields the original statement.
 */
public record SqlToken(Kind kind, String text) {

    public enum Kind {
        WHITESPACE,
        LINE_COMMENT,
        BLOCK_COMMENT,
        STRING,
        DOLLAR_STRING,
        QUOTED_IDENTIFIER,
        NUMBER,
        PARAMETER,
        WORD,
        OPERATOR
    }

    public boolean isTrivia() {
        return kind == Kind.WHITESPACE || kind == Kind.LINE_COMMENT || kind == Kind.BLOCK_COMMENT;
    }

    public boolean isLiteral() {
        return kind == Kind.STRING || kind == Kind.DOLLAR_STRING || kind == Kind.NUMBER;
    }
}
