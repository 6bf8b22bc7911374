/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * A signal. Closure signals carry the track circuit of their block section.
 */
public record Signal(
        long id,
        String name,
        String stationId,
        String typeName,
        Long trackCircuitId
) implements InterlockingObject {

    @Override
    public ObjectType type() {
        return ObjectType.SIGNAL;
    }

    @Override
    public Signal withId(long id) {
        return new Signal(id, name, stationId, typeName, trackCircuitId);
    }

    @Override
    public Signal withStationId(String stationId) {
        return new Signal(id, name, stationId, typeName, trackCircuitId);
    }
}
