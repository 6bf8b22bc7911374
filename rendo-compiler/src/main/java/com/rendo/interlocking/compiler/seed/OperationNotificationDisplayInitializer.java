/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.seed;

import com.rendo.interlocking.api.model.InterlockingObject;
import com.rendo.interlocking.api.model.ObjectType;
import com.rendo.interlocking.api.model.OperationNotificationDisplay;
import com.rendo.interlocking.api.model.TrackCircuit;
import com.rendo.interlocking.api.registry.InterlockingRegistry;
import com.rendo.interlocking.compiler.io.AuxiliaryCsvReader.OperationNotificationDisplayRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Creates operation notification displays (運転告知器) and links each listed track circuit
 * to its display. Displays that already exist are skipped together with their links.
 */
public class OperationNotificationDisplayInitializer {

    private static final Logger logger = LoggerFactory.getLogger(OperationNotificationDisplayInitializer.class);

    private final InterlockingRegistry registry;

    public OperationNotificationDisplayInitializer(InterlockingRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return number of displays created
     */
    public int initialize(List<OperationNotificationDisplayRow> rows) {
        Set<String> displayNames = registry.findOperationNotificationDisplays().stream()
                .map(OperationNotificationDisplay::name)
                .collect(Collectors.toCollection(HashSet::new));
        Map<String, TrackCircuit> trackCircuits = new HashMap<>();
        for (InterlockingObject object : registry.findObjects(ObjectType.TRACK_CIRCUIT)) {
            if (object instanceof TrackCircuit trackCircuit) {
                trackCircuits.put(trackCircuit.name(), trackCircuit);
            }
        }

        int created = 0;
        int linked = 0;
        for (OperationNotificationDisplayRow row : rows) {
            if (!displayNames.add(row.name())) {
                continue;
            }
            registry.insertOperationNotificationDisplay(
                    new OperationNotificationDisplay(row.name(), row.stationId(), row.isUp(), row.isDown()));
            created++;

            for (String trackCircuitName : row.trackCircuitNames()) {
                TrackCircuit trackCircuit = trackCircuits.get(trackCircuitName);
                if (trackCircuit == null) {
                    logger.debug("Display {}: unknown track circuit {}", row.name(), trackCircuitName);
                    continue;
                }
                TrackCircuit updated = trackCircuit.withOperationNotificationDisplayName(row.name());
                registry.updateObject(updated);
                trackCircuits.put(trackCircuitName, updated);
                linked++;
            }
        }

        logger.info("Operation notification displays: {} created, {} track circuits linked", created, linked);
        return created;
    }
}
