/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

public record DestinationButton(long id, String name, String stationId) implements InterlockingObject {

    @Override
    public ObjectType type() {
        return ObjectType.DESTINATION_BUTTON;
    }

    @Override
    public DestinationButton withId(long id) {
        return new DestinationButton(id, name, stationId);
    }

    @Override
    public DestinationButton withStationId(String stationId) {
        return new DestinationButton(id, name, stationId);
    }
}
