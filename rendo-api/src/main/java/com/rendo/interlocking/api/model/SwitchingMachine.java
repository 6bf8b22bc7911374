/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

public record SwitchingMachine(long id, String name, String stationId) implements InterlockingObject {

    @Override
    public ObjectType type() {
        return ObjectType.SWITCHING_MACHINE;
    }

    @Override
    public SwitchingMachine withId(long id) {
        return new SwitchingMachine(id, name, stationId);
    }

    @Override
    public SwitchingMachine withStationId(String stationId) {
        return new SwitchingMachine(id, name, stationId);
    }
}
