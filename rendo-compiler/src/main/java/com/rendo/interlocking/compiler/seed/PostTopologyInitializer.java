/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.seed;

import com.rendo.interlocking.api.exceptions.MissingUpstreamDataException;
import com.rendo.interlocking.api.model.InterlockingObject;
import com.rendo.interlocking.api.model.ObjectType;
import com.rendo.interlocking.api.model.SignalRoute;
import com.rendo.interlocking.api.model.ThrowOutControl;
import com.rendo.interlocking.api.registry.InterlockingRegistry;
import com.rendo.interlocking.compiler.io.TopologyDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Topology steps that need the routes created from the station tables: signal to route
 * associations, throw-out controls and the station id of every prefixed object.
 */
public class PostTopologyInitializer {

    private static final Logger logger = LoggerFactory.getLogger(PostTopologyInitializer.class);

    private static final Pattern STATION_ID = Pattern.compile("^(TH\\d{1,2}S?)_");

    private final InterlockingRegistry registry;

    public PostTopologyInitializer(InterlockingRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return number of signal routes created
     */
    public int initializeSignalRoutes(TopologyDocument document) {
        Map<String, Long> routeIds = routeIdsByName();
        Set<SignalRoute> existing = new HashSet<>(registry.findSignalRoutes());

        int created = 0;
        for (TopologyDocument.SignalData signal : document.signalDataList()) {
            for (String routeName : signal.routeNames()) {
                Long routeId = routeIds.get(routeName);
                if (routeId == null) {
                    logger.warn("Signal {} references unknown route {}, skipping", signal.name(), routeName);
                    continue;
                }
                SignalRoute signalRoute = new SignalRoute(signal.name(), routeId);
                if (existing.add(signalRoute)) {
                    registry.insertSignalRoute(signalRoute);
                    created++;
                }
            }
        }
        return created;
    }

    /**
     * @return number of throw-out controls created
     * @throws MissingUpstreamDataException when an unconditional entry names an unknown route
     */
    public int initializeThrowOutControls(TopologyDocument document) {
        Map<String, Long> routeIds = routeIdsByName();
        Set<ThrowOutControl> existing = new HashSet<>(registry.findThrowOutControls());

        int created = 0;
        for (TopologyDocument.ThrowOutControlData item : document.throwOutControlList()) {
            if (item.leverConditionName() != null && !item.leverConditionName().isEmpty()) {
                logger.info("Throw-out control {} -> {} depends on lever {}, skipping",
                        item.sourceRouteName(), item.targetRouteName(), item.leverConditionName());
                continue;
            }

            long sourceId = requireRoute(routeIds, item.sourceRouteName());
            long targetId = requireRoute(routeIds, item.targetRouteName());
            ThrowOutControl control = new ThrowOutControl(sourceId, targetId);
            if (existing.add(control)) {
                registry.insertThrowOutControl(control);
                created++;
            }
        }
        return created;
    }

    /**
     * Sets the station id of every object whose name carries a station prefix.
     *
     * @return number of objects updated
     */
    public int assignStationIds() {
        int updated = 0;
        for (InterlockingObject object : registry.findAllObjects()) {
            Matcher matcher = STATION_ID.matcher(object.name());
            if (!matcher.find()) {
                continue;
            }
            String stationId = matcher.group(1);
            if (Objects.equals(stationId, object.stationId())) {
                continue;
            }
            registry.updateObject(object.withStationId(stationId));
            updated++;
        }
        return updated;
    }

    private static long requireRoute(Map<String, Long> routeIds, String routeName) {
        Long id = routeIds.get(routeName);
        if (id == null) {
            throw new MissingUpstreamDataException("Throw-out control references unknown route", null, routeName);
        }
        return id;
    }

    private Map<String, Long> routeIdsByName() {
        Map<String, Long> ids = new HashMap<>();
        for (InterlockingObject route : registry.findObjects(ObjectType.ROUTE)) {
            ids.put(route.name(), route.id());
        }
        return ids;
    }
}
