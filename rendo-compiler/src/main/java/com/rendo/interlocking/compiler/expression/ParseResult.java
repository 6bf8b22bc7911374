/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.expression;

import java.util.List;

/**
 * Items parsed from a token sequence and the cursor positioned after them.
 */
public record ParseResult(List<LockItem> items, TokenCursor cursor) {

    public ParseResult {
        items = List.copyOf(items);
    }
}
