/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.seed;

import com.rendo.interlocking.api.model.InterlockingObject;
import com.rendo.interlocking.api.model.NextSignal;
import com.rendo.interlocking.api.model.ObjectType;
import com.rendo.interlocking.api.model.Signal;
import com.rendo.interlocking.api.model.SignalIndication;
import com.rendo.interlocking.api.model.SignalType;
import com.rendo.interlocking.api.model.Station;
import com.rendo.interlocking.api.model.StationTimerState;
import com.rendo.interlocking.api.model.TrackCircuit;
import com.rendo.interlocking.api.model.TrackCircuitSignal;
import com.rendo.interlocking.api.registry.InterlockingRegistry;
import com.rendo.interlocking.compiler.io.TopologyDocument;
import com.rendo.interlocking.compiler.signal.SignalVisibilityExpander;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Seeds stations, track circuits, signal types, signals and the signal visibility chains
 * from the topology document. Rows that already exist are left alone.
 */
public class TopologyInitializer {

    private static final Logger logger = LoggerFactory.getLogger(TopologyInitializer.class);

    private static final String CLOSURE_SIGNAL_UP = "上り閉塞";
    private static final String CLOSURE_SIGNAL_DOWN = "下り閉塞";
    private static final String CLOSURE_MARK = "閉塞";

    private final InterlockingRegistry registry;
    private final SignalVisibilityExpander expander;

    public TopologyInitializer(InterlockingRegistry registry, SignalVisibilityExpander expander) {
        this.registry = registry;
        this.expander = expander;
    }

    /**
     * Counts of rows created by {@link #initialize(TopologyDocument)}.
     */
    public record Result(int objectsCreated, int nextSignals) {
    }

    public Result initialize(TopologyDocument document) {
        initStations(document);
        initStationTimerStates();
        int trackCircuits = initTrackCircuits(document);
        initSignalTypes(document);
        int signals = initSignals(document);
        int nextSignals = initNextSignals(document);
        initTrackCircuitSignals(document);

        logger.info("Topology: {} track circuits, {} signals, {} next signal rows created",
                trackCircuits, signals, nextSignals);
        return new Result(trackCircuits + signals, nextSignals);
    }

    private void initStations(TopologyDocument document) {
        Set<String> stationNames = registry.findStations().stream()
                .map(Station::name)
                .collect(Collectors.toCollection(HashSet::new));
        for (TopologyDocument.StationData station : document.stationList()) {
            if (!stationNames.add(station.name())) {
                continue;
            }
            registry.insertStation(new Station(
                    station.id(), station.name(), station.isStation(), station.isPassengerStation()));
        }
    }

    private void initStationTimerStates() {
        Set<StationTimerState> existing = new HashSet<>(registry.findStationTimerStates());
        for (Station station : registry.findStations()) {
            if (!station.isStation()) {
                continue;
            }
            for (int seconds : StationTimerState.TIMER_SECONDS) {
                StationTimerState timerState = new StationTimerState(station.id(), seconds);
                if (existing.add(timerState)) {
                    registry.insertStationTimerState(timerState);
                }
            }
        }
    }

    private int initTrackCircuits(TopologyDocument document) {
        Set<String> names = objectNames();
        int created = 0;
        for (TopologyDocument.TrackCircuitData item : document.trackCircuitList()) {
            if (!names.add(item.name())) {
                continue;
            }
            int protectionZone = item.protectionZone() != null
                    ? item.protectionZone()
                    : TrackCircuit.DEFAULT_PROTECTION_ZONE;
            registry.insertObject(new TrackCircuit(0, item.name(), null, protectionZone, null));
            created++;
        }
        return created;
    }

    private void initSignalTypes(TopologyDocument document) {
        Set<String> names = registry.findSignalTypes().stream()
                .map(SignalType::name)
                .collect(Collectors.toCollection(HashSet::new));
        for (TopologyDocument.SignalTypeData item : document.signalTypeList()) {
            if (!names.add(item.name())) {
                continue;
            }
            registry.insertSignalType(new SignalType(
                    item.name(),
                    SignalIndication.fromString(item.rIndication()),
                    SignalIndication.fromString(item.yyIndication()),
                    SignalIndication.fromString(item.yIndication()),
                    SignalIndication.fromString(item.ygIndication()),
                    SignalIndication.fromString(item.gIndication())));
        }
    }

    private int initSignals(TopologyDocument document) {
        Map<String, Long> trackCircuitIds = new HashMap<>();
        for (InterlockingObject trackCircuit : registry.findObjects(ObjectType.TRACK_CIRCUIT)) {
            trackCircuitIds.put(trackCircuit.name(), trackCircuit.id());
        }
        List<Station> stations = registry.findStations();
        Set<String> names = objectNames();

        int created = 0;
        for (TopologyDocument.SignalData item : document.signalDataList()) {
            if (!names.add(item.name())) {
                continue;
            }

            Long trackCircuitId = null;
            if (item.name().startsWith(CLOSURE_SIGNAL_UP) || item.name().startsWith(CLOSURE_SIGNAL_DOWN)) {
                trackCircuitId = trackCircuitIds.get(item.name().replace(CLOSURE_MARK, "") + "T");
            }

            String stationId = stations.stream()
                    .filter(s -> item.name().startsWith(s.name()))
                    .map(Station::id)
                    .findFirst()
                    .orElse(null);

            registry.insertObject(new Signal(0, item.name(), stationId, item.typeName(), trackCircuitId));
            created++;
        }
        return created;
    }

    private int initNextSignals(TopologyDocument document) {
        Map<String, List<String>> directEdges = new LinkedHashMap<>();
        for (TopologyDocument.SignalData item : document.signalDataList()) {
            directEdges.computeIfAbsent(item.name(), k -> new ArrayList<>()).addAll(item.nextSignalNames());
        }
        List<String> signalNames = registry.findObjects(ObjectType.SIGNAL).stream()
                .map(InterlockingObject::name)
                .collect(Collectors.toList());

        List<NextSignal> created = expander.expand(signalNames, directEdges, registry.findNextSignals());
        created.forEach(registry::insertNextSignal);
        return created.size();
    }

    private void initTrackCircuitSignals(TopologyDocument document) {
        Set<TrackCircuitSignal> existing = new HashSet<>(registry.findTrackCircuitSignals());
        for (TopologyDocument.TrackCircuitData item : document.trackCircuitList()) {
            InterlockingObject trackCircuit = registry.findObjectByName(item.name())
                    .filter(o -> o.type() == ObjectType.TRACK_CIRCUIT)
                    .orElse(null);
            if (trackCircuit == null) {
                continue;
            }
            for (String signalName : item.nextSignalNamesUp()) {
                insertIfAbsent(existing, new TrackCircuitSignal(trackCircuit.id(), signalName, true));
            }
            for (String signalName : item.nextSignalNamesDown()) {
                insertIfAbsent(existing, new TrackCircuitSignal(trackCircuit.id(), signalName, false));
            }
        }
    }

    private void insertIfAbsent(Set<TrackCircuitSignal> existing, TrackCircuitSignal row) {
        if (existing.add(row)) {
            registry.insertTrackCircuitSignal(row);
        }
    }

    private Set<String> objectNames() {
        return registry.findAllObjects().stream()
                .map(InterlockingObject::name)
                .collect(Collectors.toCollection(HashSet::new));
    }
}
