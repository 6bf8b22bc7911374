/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * A track circuit.
 *
 * @param protectionZone protection zone number, {@link #DEFAULT_PROTECTION_ZONE} when the topology omits it
 * @param operationNotificationDisplayName display linked to this circuit, or null
 */
public record TrackCircuit(
        long id,
        String name,
        String stationId,
        int protectionZone,
        String operationNotificationDisplayName
) implements InterlockingObject {

    public static final int DEFAULT_PROTECTION_ZONE = 99;

    @Override
    public ObjectType type() {
        return ObjectType.TRACK_CIRCUIT;
    }

    @Override
    public TrackCircuit withId(long id) {
        return new TrackCircuit(id, name, stationId, protectionZone, operationNotificationDisplayName);
    }

    @Override
    public TrackCircuit withStationId(String stationId) {
        return new TrackCircuit(id, name, stationId, protectionZone, operationNotificationDisplayName);
    }

    public TrackCircuit withOperationNotificationDisplayName(String displayName) {
        return new TrackCircuit(id, name, stationId, protectionZone, displayName);
    }
}
