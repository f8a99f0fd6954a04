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

import java.util.ArrayList;
import java.util.List;

/**
 * Splits PostgreSQL statement text into {@link SqlToken}s.
 *
 * <p>Recognizes whitespace, {@code --} and {@code /* *}{@code /} comments, single-quoted
 * strings (including {@code E'...'} escape strings), dollar-quoted strings, double-quoted
 * identifiers, numeric literals, {@code $n} parameter markers, words and operators.
 *
 * <p>In strict mode an unterminated string, dollar-quoted string or quoted identifier is an
 * error. In lenient mode it extends to the end of the input, which is what truncated
 * statement texts from {@code pg_stat_statements} need. Comments are always lenient.
 */
public final class SqlLexer {

    private final String input;
    private final boolean strict;
    private int pos;

    private SqlLexer(String input, boolean strict) {
        this.input = input;
        this.strict = strict;
    }

    /**
     * Tokenize, failing on unterminated literals and quoted identifiers.
     *
     * @param sql Statement text (never null)
     * @return Tokens in input order
     * @throws SqlLexerException If a literal or quoted identifier is not terminated
     */
    public static List<SqlToken> tokenize(String sql) throws SqlLexerException {
        return new SqlLexer(sql, true).run();
    }

    /**
     * Tokenize without ever failing.
     *
     * @param sql Statement text (never null)
     * @return Tokens in input order
     */
    public static List<SqlToken> tokenizeLenient(String sql) {
        try {
            return new SqlLexer(sql, false).run();
        } catch (SqlLexerException e) {
            throw new IllegalStateException("lenient lexer must not fail", e);
        }
    }

    private List<SqlToken> run() throws SqlLexerException {
        List<SqlToken> tokens = new ArrayList<>();
        while (pos < input.length()) {
            tokens.add(next());
        }
        return tokens;
    }

    private SqlToken next() throws SqlLexerException {
        int start = pos;
        char c = input.charAt(pos);

        if (Character.isWhitespace(c)) {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
            return token(SqlToken.Kind.WHITESPACE, start);
        }
        if (c == '-' && peek(1) == '-') {
            int end = input.indexOf('\n', pos);
            pos = end < 0 ? input.length() : end;
            return token(SqlToken.Kind.LINE_COMMENT, start);
        }
        if (c == '/' && peek(1) == '*') {
            return blockComment(start);
        }
        if ((c == 'E' || c == 'e') && peek(1) == '\'') {
            pos++;
            return quoted(SqlToken.Kind.STRING, '\'', true, start);
        }
        if (c == '\'') {
            return quoted(SqlToken.Kind.STRING, '\'', false, start);
        }
        if (c == '"') {
            return quoted(SqlToken.Kind.QUOTED_IDENTIFIER, '"', false, start);
        }
        if (c == '$') {
            return dollar(start);
        }
        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            return number(start);
        }
        if (isWordStart(c)) {
            pos++;
            while (pos < input.length() && isWordPart(input.charAt(pos))) {
                pos++;
            }
            return token(SqlToken.Kind.WORD, start);
        }
        if (c == ':' && peek(1) == ':') {
            pos += 2;
            return token(SqlToken.Kind.OPERATOR, start);
        }
        pos++;
        return token(SqlToken.Kind.OPERATOR, start);
    }

    // block comments nest; an unterminated comment runs to the end of the input
    private SqlToken blockComment(int start) {
        int depth = 0;
        while (pos < input.length()) {
            if (input.charAt(pos) == '/' && peek(1) == '*') {
                depth++;
                pos += 2;
            } else if (input.charAt(pos) == '*' && peek(1) == '/') {
                depth--;
                pos += 2;
                if (depth == 0) {
                    break;
                }
            } else {
                pos++;
            }
        }
        return token(SqlToken.Kind.BLOCK_COMMENT, start);
    }

    private SqlToken quoted(SqlToken.Kind kind, char quote, boolean backslashEscapes, int start)
            throws SqlLexerException {
        pos++;
        while (pos < input.length()) {
            char ch = input.charAt(pos);
            if (backslashEscapes && ch == '\\') {
                pos = Math.min(pos + 2, input.length());
                continue;
            }
            if (ch == quote) {
                if (peek(1) == quote) {
                    pos += 2;
                    continue;
                }
                pos++;
                return token(kind, start);
            }
            pos++;
        }
        return unterminated(kind, start);
    }

    private SqlToken dollar(int start) throws SqlLexerException {
        if (isDigit(peek(1))) {
            pos++;
            while (pos < input.length() && isDigit(input.charAt(pos))) {
                pos++;
            }
            return token(SqlToken.Kind.PARAMETER, start);
        }

        int tagEnd = pos + 1;
        while (tagEnd < input.length() && isTagPart(input.charAt(tagEnd))) {
            tagEnd++;
        }
        if (tagEnd >= input.length() || input.charAt(tagEnd) != '$') {
            pos++;
            return token(SqlToken.Kind.OPERATOR, start);
        }

        String tag = input.substring(pos, tagEnd + 1);
        int closing = input.indexOf(tag, tagEnd + 1);
        if (closing < 0) {
            return unterminated(SqlToken.Kind.DOLLAR_STRING, start);
        }
        pos = closing + tag.length();
        return token(SqlToken.Kind.DOLLAR_STRING, start);
    }

    private SqlToken number(int start) {
        while (pos < input.length() && isDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos < input.length() && input.charAt(pos) == '.' && peek(1) != '.') {
            pos++;
            while (pos < input.length() && isDigit(input.charAt(pos))) {
                pos++;
            }
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int exponent = pos + 1;
            if (exponent < input.length() && (input.charAt(exponent) == '+' || input.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < input.length() && isDigit(input.charAt(exponent))) {
                pos = exponent;
                while (pos < input.length() && isDigit(input.charAt(pos))) {
                    pos++;
                }
            }
        }
        return token(SqlToken.Kind.NUMBER, start);
    }

    private SqlToken unterminated(SqlToken.Kind kind, int start) throws SqlLexerException {
        if (strict) {
            throw new SqlLexerException("unterminated " + describe(kind) + " at position " + start);
        }
        pos = input.length();
        return token(kind, start);
    }

    private SqlToken token(SqlToken.Kind kind, int start) {
        return new SqlToken(kind, input.substring(start, pos));
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private static String describe(SqlToken.Kind kind) {
        return switch (kind) {
            case QUOTED_IDENTIFIER -> "quoted identifier";
            case DOLLAR_STRING -> "dollar-quoted string";
            default -> "string literal";
        };
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static boolean isTagPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
