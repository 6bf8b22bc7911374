/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.seed;

import com.rendo.interlocking.api.exceptions.CompilationException;
import com.rendo.interlocking.api.model.DestinationButton;
import com.rendo.interlocking.api.model.InterlockingObject;
import com.rendo.interlocking.api.model.Lever;
import com.rendo.interlocking.api.model.LeverType;
import com.rendo.interlocking.api.model.LockType;
import com.rendo.interlocking.api.model.ObjectType;
import com.rendo.interlocking.api.model.Route;
import com.rendo.interlocking.api.model.RouteLeverDestinationButton;
import com.rendo.interlocking.api.model.RouteType;
import com.rendo.interlocking.api.model.SwitchingMachine;
import com.rendo.interlocking.api.registry.InterlockingRegistry;
import com.rendo.interlocking.compiler.expression.LockExpressionParser;
import com.rendo.interlocking.compiler.expression.LockItem;
import com.rendo.interlocking.compiler.expression.ParseMode;
import com.rendo.interlocking.compiler.materialize.LockGraphMaterializer;
import com.rendo.interlocking.compiler.materialize.MaterializationStats;
import com.rendo.interlocking.compiler.resolve.NameResolver;
import com.rendo.interlocking.compiler.resolve.ResolutionIndex;
import com.rendo.interlocking.compiler.resolve.ResolutionStrategy;
import com.rendo.interlocking.compiler.table.RendoTableRow;
import com.rendo.interlocking.compiler.table.RowPreprocessor;
import com.rendo.interlocking.compiler.table.TableNames;
import it.unimi.dsi.fastutil.longs.LongSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles one station's interlocking table.
 *
 * <p>Runs in two phases. {@link #initializeObjects()} creates levers, switching machines,
 * destination buttons and routes. {@link #initializeLocks(ResolutionIndex, LongSet)} runs
 * only after every station's objects are visible and turns the lock columns of each row
 * into lock trees.
 */
public class StationTableInitializer {

    private static final Logger logger = LoggerFactory.getLogger(StationTableInitializer.class);

    private static final Pattern FIRST_INTEGER = Pattern.compile("\\d+");
    // trailing ((...)) groups carry total-control data sourced from another table
    private static final Pattern TOTAL_CONTROL_SUFFIX =
            Pattern.compile("^(.*?)(?:\\(\\(([^)\\s]+)\\)\\)\\s*)*$", Pattern.DOTALL);

    private static final String ROUTE_LEVER_SUFFIX = "信号機";
    private static final String SWITCHING_MACHINE_LEVER_PREFIX = "転てつ器";

    // 大道寺 13L drives mountain line routes whose approach locks are not modelled
    private static final String APPROACH_EXEMPT_STATION = "TH65";
    private static final String APPROACH_EXEMPT_START = "13L";
    // 江ノ原 switching machines from 61 on do not exist in the simulator
    private static final String DETECTOR_CUTOFF_STATION = "TH66S";
    private static final String DETECTOR_CUTOFF_START = "61";

    private final String stationId;
    private final List<RendoTableRow> rows;
    private final InterlockingRegistry registry;
    private final List<String> adjacentStations;
    private final RowPreprocessor preprocessor = new RowPreprocessor();

    public StationTableInitializer(String stationId,
                                   List<RendoTableRow> rows,
                                   InterlockingRegistry registry,
                                   List<String> adjacentStations) {
        this.stationId = stationId;
        this.rows = rows;
        this.registry = registry;
        this.adjacentStations = adjacentStations;
    }

    public String getStationId() {
        return stationId;
    }

    /**
     * Preprocesses the rows and creates the station's objects.
     *
     * @return number of objects created
     */
    public int initializeObjects() {
        preprocessor.preprocess(rows);
        int created = initLevers();
        created += initDestinationButtons();
        created += initRoutes();
        logger.info("Station {}: {} objects created from {} rows", stationId, created, rows.size());
        return created;
    }

    private int initLevers() {
        int created = 0;
        for (RendoTableRow row : rows) {
            LeverType leverType;
            if (row.getName().endsWith(ROUTE_LEVER_SUFFIX)) {
                leverType = LeverType.ROUTE;
            } else if (row.getName().startsWith(SWITCHING_MACHINE_LEVER_PREFIX)) {
                leverType = LeverType.SWITCHING_MACHINE;
            } else {
                continue;
            }

            String leverName = TableNames.lever(stationId, row.getStart());
            if (row.getStart().isEmpty() || registry.findObjectByName(leverName).isPresent()) {
                continue;
            }

            Long switchingMachineId = null;
            if (leverType == LeverType.SWITCHING_MACHINE) {
                String machineName = TableNames.switchingMachine(stationId, row.getStart());
                Optional<InterlockingObject> existing = registry.findObjectByName(machineName);
                if (existing.isPresent()) {
                    switchingMachineId = existing.get().id();
                } else {
                    switchingMachineId = registry.insertObject(
                            new SwitchingMachine(0, machineName, stationId)).id();
                    created++;
                }
            }

            registry.insertObject(new Lever(0, leverName, stationId, leverType, switchingMachineId));
            created++;
        }
        return created;
    }

    private int initDestinationButtons() {
        int created = 0;
        for (RendoTableRow row : rows) {
            String end = row.getEnd();
            if (end.isBlank() || end.equals("L") || end.equals("R")) {
                continue;
            }

            String buttonName = TableNames.destinationButton(stationId, end);
            if (registry.findObjectByName(buttonName).isPresent()) {
                continue;
            }
            registry.insertObject(new DestinationButton(0, buttonName, stationId));
            created++;
        }
        return created;
    }

    private int initRoutes() {
        int created = 0;
        for (RendoTableRow row : rows) {
            Optional<RouteType> routeType = routeTypeOf(row.getName());
            if (routeType.isEmpty()) {
                continue;
            }

            String routeName = TableNames.route(stationId, row.getStart(), row.getEnd());
            if (registry.findObjectByName(routeName).isPresent()) {
                continue;
            }

            String leverName = TableNames.lever(stationId, row.getStart());
            Optional<InterlockingObject> lever = registry.findObjectByName(leverName)
                    .filter(o -> o.type() == ObjectType.LEVER);
            if (lever.isEmpty()) {
                logger.debug("Station {}: no lever {} for route {}, skipping", stationId, leverName, routeName);
                continue;
            }

            Route route = registry.insertObject(new Route(
                    0, routeName, stationId, routeType.get(), row.getIndicator(),
                    approachTime(row, leverName)));
            registry.insertRouteLeverDestinationButton(new RouteLeverDestinationButton(
                    route.id(), lever.get().id(), TableNames.destinationButton(stationId, row.getEnd())));
            created++;
        }
        return created;
    }

    /**
     * Compiles the lock columns of every row whose route or switching machine has no
     * locks yet.
     *
     * @param index           lookups over all stations' objects
     * @param lockedObjectIds ids of objects that already own locks, updated as locks are added
     * @return counts of rows written
     */
    public MaterializationStats initializeLocks(ResolutionIndex index, LongSet lockedObjectIds) {
        LockExpressionParser parser = new LockExpressionParser(stationId, adjacentStations);
        LockGraphMaterializer materializer = new LockGraphMaterializer(registry, new NameResolver(index));
        MaterializationStats stats = new MaterializationStats();

        for (RendoTableRow row : rows) {
            if (routeTypeOf(row.getName()).isEmpty()) {
                continue;
            }
            String routeName = TableNames.route(stationId, row.getStart(), row.getEnd());
            Optional<InterlockingObject> route = index.route(routeName);
            if (route.isEmpty()) {
                logger.warn("Station {}: route {} is not registered, skipping its locks", stationId, routeName);
                continue;
            }
            long routeId = route.get().id();
            if (lockedObjectIds.contains(routeId)) {
                continue;
            }

            String lever = row.getStart() + row.getEnd();
            stats.add(materializer.materialize(
                    parser.parse(row.getLockToSwitchingMachine(), ParseMode.DEFAULT, lever + " 鎖錠(転てつ器)"),
                    routeId, LockType.LOCK, ResolutionStrategy.SWITCHING_MACHINE, true));
            stats.add(materializer.materialize(
                    parser.parse(row.getLockToRoute(), ParseMode.DEFAULT, lever + " 鎖錠"),
                    routeId, LockType.LOCK, ResolutionStrategy.GENERAL, false));
            stats.add(materializer.materialize(
                    parser.parse(withoutTotalControl(row.getSignalControl()), ParseMode.DEFAULT, lever + " 信号制御"),
                    routeId, LockType.SIGNAL_CONTROL, ResolutionStrategy.GENERAL, false));
            stats.add(materializer.materialize(
                    parser.parse(row.getRouteLock(), ParseMode.ROUTE_LOCK, lever + " 進路鎖錠"),
                    routeId, LockType.ROUTE, ResolutionStrategy.GENERAL, false));

            if (!(APPROACH_EXEMPT_STATION.equals(stationId) && APPROACH_EXEMPT_START.equals(row.getStart()))) {
                stats.add(materializer.materialize(
                        parser.parse(row.getApproachLock(), ParseMode.DEFAULT, lever + " 接近鎖錠"),
                        routeId, LockType.APPROACH, ResolutionStrategy.APPROACH, false));
            }
            lockedObjectIds.add(routeId);
        }

        for (RendoTableRow row : rows) {
            if (DETECTOR_CUTOFF_STATION.equals(stationId) && DETECTOR_CUTOFF_START.equals(row.getStart())) {
                break;
            }
            Optional<InterlockingObject> machine =
                    index.switchingMachine(TableNames.switchingMachine(stationId, row.getStart()));
            if (machine.isEmpty() || lockedObjectIds.contains(machine.get().id())) {
                continue;
            }

            List<LockItem> detector = parser.parse(
                    row.getSignalControl(), ParseMode.DEFAULT, row.getStart() + " てっ査鎖錠");
            stats.add(materializer.materialize(
                    detector, machine.get().id(), LockType.DETECTOR, ResolutionStrategy.GENERAL, false));
            lockedObjectIds.add(machine.get().id());
        }

        logger.info("Station {}: {}", stationId, stats);
        return stats;
    }

    /**
     * Route type named by a table row, empty for rows that are not routes.
     */
    static Optional<RouteType> routeTypeOf(String name) {
        if (name.contains("場内")) {
            return Optional.of(RouteType.ARRIVING);
        }
        if (name.contains("出発")) {
            return Optional.of(RouteType.DEPARTURE);
        }
        if (name.contains("誘導")) {
            return Optional.of(RouteType.GUIDE);
        }
        if (name.contains("入換信号")) {
            return Optional.of(RouteType.SWITCH_SIGNAL);
        }
        if (name.contains("入換標識")) {
            return Optional.of(RouteType.SWITCH_ROUTE);
        }
        return Optional.empty();
    }

    /**
     * Signal control cell with its trailing total-control groups removed.
     */
    static String withoutTotalControl(String signalControl) {
        Matcher matcher = TOTAL_CONTROL_SUFFIX.matcher(signalControl);
        return matcher.matches() ? matcher.group(1) : signalControl;
    }

    private Integer approachTime(RendoTableRow row, String leverName) {
        Matcher matcher = FIRST_INTEGER.matcher(row.getApproachTime());
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.valueOf(matcher.group());
        } catch (NumberFormatException e) {
            throw new CompilationException(
                    "Approach time '" + row.getApproachTime() + "' is out of range", stationId, leverName, e);
        }
    }
}
