/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Counts of rows written by one compilation run. A rerun over an unchanged
 * registry reports zero for every entity count.
 */
public record CompilationReport(
    @JsonProperty("stations") int stations,
    @JsonProperty("objects_created") int objectsCreated,
    @JsonProperty("locks") int locks,
    @JsonProperty("lock_conditions") int lockConditions,
    @JsonProperty("lock_condition_objects") int lockConditionObjects,
    @JsonProperty("switching_machine_routes") int switchingMachineRoutes,
    @JsonProperty("next_signals") int nextSignals,
    @JsonProperty("skipped_references") int skippedReferences,
    @JsonProperty("compilation_time_nanos") long compilationTimeNanos
) implements Serializable {
}
