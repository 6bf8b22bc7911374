/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * Position a switching machine must take for a route.
 */
public record SwitchingMachineRoute(long routeId, long switchingMachineId, NR reverse) {
}
