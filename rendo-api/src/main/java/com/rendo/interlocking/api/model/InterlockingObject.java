/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.model;

/**
 * A named piece of interlocking equipment held by the registry.
 *
 * <p>Names are globally unique. The id is assigned by the registry on insertion; a value
 * of {@code 0} marks an object that has not been persisted yet. Resolver and materializer
 * code dispatches on {@link #type()} rather than on the concrete record.
 */
public interface InterlockingObject {

    long id();

    String name();

    /**
     * @return owning station id, or null when not yet assigned
     */
    String stationId();

    ObjectType type();

    InterlockingObject withId(long id);

    InterlockingObject withStationId(String stationId);
}
