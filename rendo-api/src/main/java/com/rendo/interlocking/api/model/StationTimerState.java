/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

import java.util.List;

/**
 * Station timer of the given length. Created for every station with {@code isStation}.
 */
public record StationTimerState(String stationId, int seconds) {

    public static final List<Integer> TIMER_SECONDS = List.of(30, 60);
}
