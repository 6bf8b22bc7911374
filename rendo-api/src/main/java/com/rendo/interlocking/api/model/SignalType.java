/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * The indication shown by a signal type for each of the five aspects.
 */
public record SignalType(
        String name,
        SignalIndication r,
        SignalIndication yy,
        SignalIndication y,
        SignalIndication yg,
        SignalIndication g
) {
}
