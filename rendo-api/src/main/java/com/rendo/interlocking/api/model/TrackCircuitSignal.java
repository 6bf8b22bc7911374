/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * Next signal seen from a track circuit in one direction.
 */
public record TrackCircuitSignal(long trackCircuitId, String signalName, boolean isUp) {
}
