/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.exceptions;

/**
 * A lock expression token matched no object in the registry.
 */
public class UnresolvedReferenceException extends CompilationException {

    public UnresolvedReferenceException(String message, String stationId, String token) {
        super(message, stationId, token);
    }
}
