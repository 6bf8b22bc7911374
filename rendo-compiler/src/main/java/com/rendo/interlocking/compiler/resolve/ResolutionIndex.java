/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.resolve;

import com.rendo.interlocking.api.model.InterlockingObject;
import com.rendo.interlocking.api.model.ObjectType;
import com.rendo.interlocking.api.model.RouteLeverDestinationButton;
import com.rendo.interlocking.api.registry.InterlockingRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name lookups over a snapshot of the registry, taken once every station's objects are
 * visible. Switching machines are kept apart from the other objects so that a switching
 * machine and a lever or route cannot shadow each other.
 */
public class ResolutionIndex {

    private final Map<String, InterlockingObject> switchingMachines = new HashMap<>();
    private final Map<String, InterlockingObject> otherObjects = new HashMap<>();
    private final Map<String, List<InterlockingObject>> routesByLever = new HashMap<>();

    private ResolutionIndex() {
    }

    /**
     * Builds the index from the current registry contents.
     */
    public static ResolutionIndex build(InterlockingRegistry registry) {
        ResolutionIndex index = new ResolutionIndex();
        Map<Long, InterlockingObject> byId = new HashMap<>();
        for (InterlockingObject object : registry.findAllObjects()) {
            byId.put(object.id(), object);
            if (object.type() == ObjectType.SWITCHING_MACHINE) {
                index.switchingMachines.put(object.name(), object);
            } else {
                index.otherObjects.put(object.name(), object);
            }
        }

        for (RouteLeverDestinationButton association : registry.findRouteLeverDestinationButtons()) {
            InterlockingObject lever = byId.get(association.leverId());
            InterlockingObject route = byId.get(association.routeId());
            if (lever == null || route == null) {
                continue;
            }
            index.routesByLever.computeIfAbsent(lever.name(), k -> new ArrayList<>()).add(route);
        }
        return index;
    }

    public Optional<InterlockingObject> switchingMachine(String name) {
        return Optional.ofNullable(switchingMachines.get(name));
    }

    public Optional<InterlockingObject> object(String name) {
        return Optional.ofNullable(otherObjects.get(name));
    }

    public Optional<InterlockingObject> route(String name) {
        return object(name).filter(o -> o.type() == ObjectType.ROUTE);
    }

    public Optional<InterlockingObject> trackCircuit(String name) {
        return object(name).filter(o -> o.type() == ObjectType.TRACK_CIRCUIT);
    }

    /**
     * @return routes started by the lever, in association order, empty when unknown
     */
    public List<InterlockingObject> routesOfLever(String leverName) {
        return Collections.unmodifiableList(routesByLever.getOrDefault(leverName, List.of()));
    }

    public int size() {
        return switchingMachines.size() + otherObjects.size();
    }
}
