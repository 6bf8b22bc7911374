/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.exceptions;

/**
 * A referenced route, station or adjacency entry is absent from the loaded data.
 */
public class MissingUpstreamDataException extends CompilationException {

    public MissingUpstreamDataException(String message, String stationId, String subject) {
        super(message, stationId, subject);
    }
}
