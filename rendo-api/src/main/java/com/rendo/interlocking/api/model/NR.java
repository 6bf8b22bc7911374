/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * Normal or reversed position required of an object.
 */
public enum NR {
    NORMAL,
    REVERSED
}
