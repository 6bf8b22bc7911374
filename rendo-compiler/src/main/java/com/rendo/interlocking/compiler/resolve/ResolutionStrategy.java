/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.resolve;

/**
 * How a leaf token is looked up, chosen by the column being compiled.
 */
public enum ResolutionStrategy {
    /** {@code <station>_W<token>} among switching machines. */
    SWITCHING_MACHINE,
    /** {@code <station>_<token>} among other objects, then lever to routes expansion. */
    GENERAL,
    /** General lookup, then closure block track circuits, then the literal track circuit name. */
    APPROACH
}
