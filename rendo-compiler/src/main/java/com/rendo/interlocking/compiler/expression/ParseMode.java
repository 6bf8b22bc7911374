/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.expression;

public enum ParseMode {
    /** The whole expression forms one lock; several top-level items are AND-ed. */
    DEFAULT,
    /** Every top-level item is an independent lock group; parentheses group instead of reversing. */
    ROUTE_LOCK
}
