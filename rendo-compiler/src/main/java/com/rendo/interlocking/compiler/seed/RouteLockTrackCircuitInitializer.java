/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.seed;

import com.rendo.interlocking.api.model.InterlockingObject;
import com.rendo.interlocking.api.model.ObjectType;
import com.rendo.interlocking.api.model.RouteLockTrackCircuit;
import com.rendo.interlocking.api.registry.InterlockingRegistry;
import com.rendo.interlocking.compiler.io.AuxiliaryCsvReader.RouteTrackCircuitRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Associates routes with the track circuits their route lock covers ({@code 進路.csv}).
 * Unknown route or track circuit names are skipped.
 */
public class RouteLockTrackCircuitInitializer {

    private static final Logger logger = LoggerFactory.getLogger(RouteLockTrackCircuitInitializer.class);

    private final InterlockingRegistry registry;

    public RouteLockTrackCircuitInitializer(InterlockingRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return number of associations created
     */
    public int initialize(List<RouteTrackCircuitRow> rows) {
        Map<String, Long> routeIds = idsByName(ObjectType.ROUTE);
        Map<String, Long> trackCircuitIds = idsByName(ObjectType.TRACK_CIRCUIT);
        Set<RouteLockTrackCircuit> existing = new HashSet<>(registry.findRouteLockTrackCircuits());

        int created = 0;
        for (RouteTrackCircuitRow row : rows) {
            Long routeId = routeIds.get(row.routeName());
            if (routeId == null) {
                logger.debug("Unknown route {}, skipping", row.routeName());
                continue;
            }
            for (String trackCircuitName : row.trackCircuitNames()) {
                Long trackCircuitId = trackCircuitIds.get(trackCircuitName);
                if (trackCircuitId == null) {
                    continue;
                }
                RouteLockTrackCircuit association = new RouteLockTrackCircuit(routeId, trackCircuitId);
                if (existing.add(association)) {
                    registry.insertRouteLockTrackCircuit(association);
                    created++;
                }
            }
        }

        logger.info("Route lock track circuits: {} created", created);
        return created;
    }

    private Map<String, Long> idsByName(ObjectType type) {
        Map<String, Long> ids = new HashMap<>();
        for (InterlockingObject object : registry.findObjects(type)) {
            ids.put(object.name(), object.id());
        }
        return ids;
    }
}
