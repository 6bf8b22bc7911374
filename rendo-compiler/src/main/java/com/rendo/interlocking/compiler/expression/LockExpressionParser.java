/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.expression;

import com.rendo.interlocking.api.exceptions.MalformedExpressionException;
import com.rendo.interlocking.api.exceptions.MissingUpstreamDataException;
import com.rendo.interlocking.api.model.NR;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for the lock columns of an interlocking table.
 *
 * <p>Grammar, applied left to right until an unconsumed closing bracket:
 * <ul>
 *   <li>{@code { … }} groups without adding a node</li>
 *   <li>{@code (( … ))} is total control, sourced elsewhere, and is discarded</li>
 *   <li>{@code [ … ]} and {@code [[ … ]]} move the content to the first or second
 *       adjacent station of the compiled station</li>
 *   <li>{@code ( … )} reverses its single item, or in route lock mode becomes an AND
 *       tagged reversed</li>
 *   <li>{@code 但 N秒} sets the timer of the preceding item</li>
 *   <li>{@code left 但 right} becomes {@code OR(left, NOT(right))}</li>
 *   <li>{@code left 又は right} becomes {@code OR(left, right…)}</li>
 * </ul>
 *
 * <p>Each step takes an immutable {@link TokenCursor} and returns the items it built with
 * the cursor after them; the parser keeps no mutable state and can be reused.
 */
public class LockExpressionParser {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final String stationId;
    private final List<String> adjacentStations;
    private final LockExpressionTokenizer tokenizer = new LockExpressionTokenizer();

    /**
     * @param stationId        station whose table is compiled
     * @param adjacentStations ordered adjacent stations addressed by {@code [} and {@code [[}
     */
    public LockExpressionParser(String stationId, List<String> adjacentStations) {
        this.stationId = stationId;
        this.adjacentStations = List.copyOf(adjacentStations);
    }

    /**
     * Parses one lock cell.
     *
     * @param expression cell text
     * @param mode       parse mode of the column
     * @param subject    lever or row identity for error messages
     * @return in default mode exactly one root item; in route lock mode one item per group
     * @throws MalformedExpressionException on structural errors
     * @throws MissingUpstreamDataException when a bracket addresses a missing adjacent station
     */
    public List<LockItem> parse(String expression, ParseMode mode, String subject) {
        List<Token> tokens = tokenizer.tokenize(expression, stationId, subject);
        Context context = new Context(stationId, NR.NORMAL, false, mode, subject);

        ParseResult result = parseSequence(TokenCursor.of(tokens), context);
        if (!result.cursor().atEnd()) {
            Token stray = result.cursor().peek();
            throw malformed("Unmatched '" + stray.text() + "' at offset " + stray.position()
                    + " in '" + expression + "'", subject);
        }

        if (mode == ParseMode.ROUTE_LOCK) {
            return result.items();
        }
        return List.of(LockItem.groupByAnd(result.items()));
    }

    public List<LockItem> parse(String expression, ParseMode mode) {
        return parse(expression, mode, expression);
    }

    private ParseResult parseSequence(TokenCursor start, Context context) {
        List<LockItem> result = new ArrayList<>();
        TokenCursor cursor = start;

        while (!cursor.atEnd()) {
            Token token = cursor.peek();
            if (token.type().isClosing()) {
                break;
            }

            switch (token.type()) {
                case OPEN_BRACE -> {
                    ParseResult inner = parseSequence(cursor.advance(), context);
                    cursor = expectClose(inner.cursor(), TokenType.CLOSE_BRACE, "}", context);
                    result.addAll(inner.items());
                }
                case OPEN_TOTAL_CONTROL -> {
                    ParseResult inner = parseSequence(cursor.advance(), context.asTotalControl());
                    cursor = expectClose(inner.cursor(), TokenType.CLOSE_TOTAL_CONTROL, "))", context);
                }
                case OPEN_STATION_BRACKET -> {
                    int run = token.runLength();
                    Context target = context.atStation(adjacentStation(run, context));
                    ParseResult inner = parseSequence(cursor.advance(), target);
                    cursor = expectStationClose(inner.cursor(), run, context);
                    result.addAll(inner.items());
                }
                case OPEN_PAREN -> {
                    ParseResult parsed = parseParenthesis(cursor, context);
                    cursor = parsed.cursor();
                    result.addAll(parsed.items());
                }
                case TIMER -> {
                    if (result.isEmpty()) {
                        throw malformed("Timer '" + token.text() + "' has no preceding item", context.subject());
                    }
                    int last = result.size() - 1;
                    result.set(last, result.get(last).withTimerSeconds(timerSeconds(token, context.subject())));
                    cursor = cursor.advance();
                }
                case BUT -> {
                    LockItem left = LockItem.groupByAnd(result);
                    ParseResult right = parseSequence(cursor.advance(), context);
                    cursor = right.cursor();
                    LockItem negated = LockItem.not(
                            LockItem.groupByAnd(right.items()), context.stationId(), context.reverse());
                    result = new ArrayList<>();
                    result.add(LockItem.or(List.of(left, negated), context.stationId(), context.reverse()));
                }
                case OR -> {
                    LockItem left = LockItem.groupByAnd(result);
                    ParseResult right = parseSequence(cursor.advance(), context);
                    cursor = right.cursor();
                    List<LockItem> operands = new ArrayList<>();
                    operands.add(left);
                    if (right.items().size() == 1 && right.items().get(0).kind() == LockItem.Kind.OR) {
                        operands.addAll(right.items().get(0).children());
                    } else {
                        operands.add(LockItem.groupByAnd(right.items()));
                    }
                    result = new ArrayList<>();
                    result.add(LockItem.or(operands, context.stationId(), context.reverse()));
                }
                case NAME -> {
                    result.add(LockItem.leaf(
                            token.text(), context.stationId(), context.reverse(), context.totalControl()));
                    cursor = cursor.advance();
                }
                default -> throw malformed("Unexpected token '" + token.text() + "'", context.subject());
            }
        }

        return new ParseResult(result, cursor);
    }

    private ParseResult parseParenthesis(TokenCursor open, Context context) {
        if (context.mode() == ParseMode.ROUTE_LOCK) {
            ParseResult inner = parseSequence(open.advance(), context.withReverse(NR.NORMAL));
            TokenCursor cursor = expectClose(inner.cursor(), TokenType.CLOSE_PAREN, ")", context);
            LockItem group = LockItem.and(inner.items(), context.stationId(), NR.REVERSED);
            return new ParseResult(List.of(group), cursor);
        }

        ParseResult inner = parseSequence(open.advance(), context.withReverse(NR.REVERSED));
        if (inner.items().size() != 1) {
            throw malformed("Reverse group must hold exactly one item but has " + inner.items().size(),
                    context.subject());
        }
        TokenCursor cursor = expectClose(inner.cursor(), TokenType.CLOSE_PAREN, ")", context);
        return new ParseResult(inner.items(), cursor);
    }

    private TokenCursor expectClose(TokenCursor cursor, TokenType expected, String text, Context context) {
        Token token = cursor.peek();
        if (token == null) {
            throw malformed("Unterminated group, expected '" + text + "'", context.subject());
        }
        if (token.type() != expected) {
            throw malformed("Expected '" + text + "' but found '" + token.text() + "' at offset "
                    + token.position(), context.subject());
        }
        return cursor.advance();
    }

    private TokenCursor expectStationClose(TokenCursor cursor, int run, Context context) {
        String expected = "]".repeat(run);
        Token token = cursor.peek();
        if (token == null) {
            throw malformed("Unterminated station bracket, expected '" + expected + "'", context.subject());
        }
        if (token.type() != TokenType.CLOSE_STATION_BRACKET || token.runLength() != run) {
            throw malformed("Expected '" + expected + "' but found '" + token.text() + "' at offset "
                    + token.position(), context.subject());
        }
        return cursor.advance();
    }

    private String adjacentStation(int run, Context context) {
        if (run > adjacentStations.size()) {
            throw new MissingUpstreamDataException(
                    "No adjacent station in slot " + run + " (adjacent: " + adjacentStations + ")",
                    stationId, context.subject());
        }
        return adjacentStations.get(run - 1);
    }

    private int timerSeconds(Token token, String subject) {
        Matcher matcher = DIGITS.matcher(token.text());
        if (!matcher.find()) {
            throw new IllegalStateException("Timer token without digits: " + token.text());
        }
        try {
            return Integer.parseInt(matcher.group());
        } catch (NumberFormatException e) {
            throw malformed("Timer '" + token.text() + "' is out of range", subject);
        }
    }

    private MalformedExpressionException malformed(String message, String subject) {
        return new MalformedExpressionException(message, stationId, subject);
    }

    private record Context(String stationId, NR reverse, boolean totalControl, ParseMode mode, String subject) {

        Context atStation(String targetStationId) {
            return new Context(targetStationId, reverse, totalControl, mode, subject);
        }

        Context withReverse(NR targetReverse) {
            return new Context(stationId, targetReverse, totalControl, mode, subject);
        }

        Context asTotalControl() {
            return new Context(stationId, reverse, true, mode, subject);
        }
    }
}
