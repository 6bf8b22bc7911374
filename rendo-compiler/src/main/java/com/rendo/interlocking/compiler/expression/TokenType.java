/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.expression;

public enum TokenType {
    OPEN_STATION_BRACKET,
    CLOSE_STATION_BRACKET,
    OPEN_TOTAL_CONTROL,
    CLOSE_TOTAL_CONTROL,
    OPEN_BRACE,
    CLOSE_BRACE,
    OPEN_PAREN,
    CLOSE_PAREN,
    TIMER,
    BUT,
    OR,
    NAME;

    /**
     * @return true for tokens that end a nested sequence
     */
    public boolean isClosing() {
        return this == CLOSE_STATION_BRACKET
                || this == CLOSE_TOTAL_CONTROL
                || this == CLOSE_BRACE
                || this == CLOSE_PAREN;
    }
}
