/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.expression;

import com.rendo.interlocking.api.exceptions.MalformedExpressionException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a lock expression cell into tokens.
 *
 * <p>Alternatives are tried in priority order at every position: double brackets,
 * single brackets, the timer clause {@code 但 N秒}, the keywords {@code 但} and
 * {@code 又は}, and runs of upper-case letters, digits and the half-width katakana
 * {@code ｲ}/{@code ﾛ}. Whitespace, including the ideographic space, only separates
 * tokens. Anything else is a malformed table.
 */
public class LockExpressionTokenizer {

    private static final Pattern TOKEN_PATTERN = Pattern.compile(
            "(\\[\\[|\\]\\]|\\(\\(|\\)\\)|[\\[\\]{}()])"
                    + "|(但[\\s\u3000]+\\d+秒)"
                    + "|(但)"
                    + "|(又は)"
                    + "|([A-Z0-9ｲﾛ]+)"
                    + "|([\\s\u3000]+)");

    /**
     * Tokenizes {@code expression}.
     *
     * @param expression raw cell text, may be null or blank
     * @param stationId  station being compiled, for error reporting
     * @param subject    lever or row identity, for error reporting
     * @return tokens in source order
     * @throws MalformedExpressionException on a character no token can start with
     */
    public List<Token> tokenize(String expression, String stationId, String subject) {
        List<Token> tokens = new ArrayList<>();
        if (expression == null || expression.isEmpty()) {
            return tokens;
        }

        Matcher matcher = TOKEN_PATTERN.matcher(expression);
        int position = 0;
        while (position < expression.length()) {
            matcher.region(position, expression.length());
            if (!matcher.lookingAt()) {
                throw new MalformedExpressionException(
                        "Unexpected character '" + expression.charAt(position) + "' at offset " + position
                                + " in '" + expression + "'",
                        stationId, subject);
            }

            String text = matcher.group();
            if (matcher.group(1) != null) {
                tokens.add(new Token(bracketType(text), text, position));
            } else if (matcher.group(2) != null) {
                tokens.add(new Token(TokenType.TIMER, text, position));
            } else if (matcher.group(3) != null) {
                tokens.add(new Token(TokenType.BUT, text, position));
            } else if (matcher.group(4) != null) {
                tokens.add(new Token(TokenType.OR, text, position));
            } else if (matcher.group(5) != null) {
                tokens.add(new Token(TokenType.NAME, text, position));
            }
            position = matcher.end();
        }
        return tokens;
    }

    private static TokenType bracketType(String text) {
        return switch (text) {
            case "[", "[[" -> TokenType.OPEN_STATION_BRACKET;
            case "]", "]]" -> TokenType.CLOSE_STATION_BRACKET;
            case "((" -> TokenType.OPEN_TOTAL_CONTROL;
            case "))" -> TokenType.CLOSE_TOTAL_CONTROL;
            case "{" -> TokenType.OPEN_BRACE;
            case "}" -> TokenType.CLOSE_BRACE;
            case "(" -> TokenType.OPEN_PAREN;
            case ")" -> TokenType.CLOSE_PAREN;
            default -> throw new IllegalArgumentException("Not a bracket: " + text);
        };
    }
}
