/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * Discriminant of the {@link InterlockingObject} variants.
 */
public enum ObjectType {
    ROUTE,
    SWITCHING_MACHINE,
    SIGNAL,
    TRACK_CIRCUIT,
    LEVER,
    DESTINATION_BUTTON
}
