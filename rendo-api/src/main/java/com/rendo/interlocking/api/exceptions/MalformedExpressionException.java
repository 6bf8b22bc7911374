/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.exceptions;

/**
 * Structural error in a lock expression: unmatched brackets, a dangling timer suffix,
 * a reverse group without exactly one item, or an unrecognised character.
 */
public class MalformedExpressionException extends CompilationException {

    public MalformedExpressionException(String message, String stationId, String subject) {
        super(message, stationId, subject);
    }
}
