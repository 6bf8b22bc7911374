/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * Visibility of {@code targetSignalName} from {@code signalName}.
 *
 * @param sourceSignalName signal immediately before the target on the chain
 * @param depth number of hops, 1 to {@link #MAX_DEPTH}
 */
public record NextSignal(String signalName, String sourceSignalName, String targetSignalName, int depth) {

    public static final int MAX_DEPTH = 4;
}
