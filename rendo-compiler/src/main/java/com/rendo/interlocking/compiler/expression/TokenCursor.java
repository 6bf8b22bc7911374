/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.expression;

import java.util.List;

/**
 * Immutable read position over a token list. Advancing returns a new cursor.
 */
public record TokenCursor(List<Token> tokens, int position) {

    public TokenCursor {
        tokens = List.copyOf(tokens);
    }

    public static TokenCursor of(List<Token> tokens) {
        return new TokenCursor(tokens, 0);
    }

    public boolean atEnd() {
        return position >= tokens.size();
    }

    /**
     * @return the current token, or null at the end
     */
    public Token peek() {
        return atEnd() ? null : tokens.get(position);
    }

    public TokenCursor advance() {
        return new TokenCursor(tokens, position + 1);
    }
}
