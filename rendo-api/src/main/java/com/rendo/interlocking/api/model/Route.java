/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * A route from a start lever to a destination.
 *
 * @param approachLockTime approach lock release time in seconds, null when the table has none
 */
public record Route(
        long id,
        String name,
        String stationId,
        RouteType routeType,
        String indicator,
        Integer approachLockTime
) implements InterlockingObject {

    @Override
    public ObjectType type() {
        return ObjectType.ROUTE;
    }

    @Override
    public Route withId(long id) {
        return new Route(id, name, stationId, routeType, indicator, approachLockTime);
    }

    @Override
    public Route withStationId(String stationId) {
        return new Route(id, name, stationId, routeType, indicator, approachLockTime);
    }
}
