/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * A lever. Switching machine levers reference the machine they throw.
 */
public record Lever(
        long id,
        String name,
        String stationId,
        LeverType leverType,
        Long switchingMachineId
) implements InterlockingObject {

    @Override
    public ObjectType type() {
        return ObjectType.LEVER;
    }

    @Override
    public Lever withId(long id) {
        return new Lever(id, name, stationId, leverType, switchingMachineId);
    }

    @Override
    public Lever withStationId(String stationId) {
        return new Lever(id, name, stationId, leverType, switchingMachineId);
    }
}
