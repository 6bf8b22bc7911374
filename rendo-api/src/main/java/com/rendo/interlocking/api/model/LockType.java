/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

public enum LockType {
    LOCK,
    SIGNAL_CONTROL,
    ROUTE,
    APPROACH,
    DETECTOR
}
