/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.expression;

/**
 * A lexical token of a lock expression.
 *
 * @param type     token kind
 * @param text     matched source text
 * @param position offset of the first character in the expression
 */
public record Token(TokenType type, String text, int position) {

    /**
     * Bracket run length of a station bracket ({@code [} is 1, {@code [[} is 2).
     */
    public int runLength() {
        return text.length();
    }
}
