/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.registry;

import com.rendo.interlocking.api.exceptions.RegistryException;
import com.rendo.interlocking.api.model.InterlockingObject;
import com.rendo.interlocking.api.model.Lock;
import com.rendo.interlocking.api.model.LockCondition;
import com.rendo.interlocking.api.model.LockConditionObject;
import com.rendo.interlocking.api.model.NextSignal;
import com.rendo.interlocking.api.model.ObjectType;
import com.rendo.interlocking.api.model.OperationNotificationDisplay;
import com.rendo.interlocking.api.model.RouteLeverDestinationButton;
import com.rendo.interlocking.api.model.RouteLockTrackCircuit;
import com.rendo.interlocking.api.model.SignalRoute;
import com.rendo.interlocking.api.model.SignalType;
import com.rendo.interlocking.api.model.Station;
import com.rendo.interlocking.api.model.StationTimerState;
import com.rendo.interlocking.api.model.SwitchingMachineRoute;
import com.rendo.interlocking.api.model.ThrowOutControl;
import com.rendo.interlocking.api.model.TrackCircuitSignal;
import com.rendo.interlocking.api.registry.InterlockingRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link InterlockingRegistry}.
 *
 * <p>Used for dry runs and tests. Writes are visible immediately, so {@link #flush()} has
 * nothing to do. Transactions snapshot the whole state and restore it on failure.
 */
public class InMemoryInterlockingRegistry implements InterlockingRegistry {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryInterlockingRegistry.class);

    private State state = new State();
    private int transactionDepth;

    // ---------------------------------------------------------------- objects

    @Override
    @SuppressWarnings("unchecked")
    public <T extends InterlockingObject> T insertObject(T object) {
        if (state.objectIdsByName.containsKey(object.name())) {
            throw new RegistryException("Object name already registered: " + object.name());
        }
        long id = ++state.lastObjectId;
        T stored = (T) object.withId(id);
        state.objects.put(id, stored);
        state.objectIdsByName.put(stored.name(), id);
        return stored;
    }

    @Override
    public void updateObject(InterlockingObject object) {
        InterlockingObject existing = state.objects.get(object.id());
        if (existing == null) {
            throw new RegistryException("Unknown object id: " + object.id());
        }
        if (!existing.name().equals(object.name()) || existing.type() != object.type()) {
            throw new RegistryException("Object " + object.id() + " cannot change name or type");
        }
        state.objects.put(object.id(), object);
    }

    @Override
    public Optional<InterlockingObject> findObjectByName(String name) {
        Long id = state.objectIdsByName.get(name);
        return id == null ? Optional.empty() : Optional.of(state.objects.get(id));
    }

    @Override
    public List<InterlockingObject> findObjects(ObjectType type) {
        return state.objects.values().stream()
                .filter(o -> o.type() == type)
                .collect(Collectors.toList());
    }

    @Override
    public List<InterlockingObject> findAllObjects() {
        return new ArrayList<>(state.objects.values());
    }

    // ---------------------------------------------------------------- topology

    @Override
    public List<Station> findStations() {
        return new ArrayList<>(state.stations);
    }

    @Override
    public void insertStation(Station station) {
        state.stations.add(station);
    }

    @Override
    public List<StationTimerState> findStationTimerStates() {
        return new ArrayList<>(state.stationTimerStates);
    }

    @Override
    public void insertStationTimerState(StationTimerState timerState) {
        state.stationTimerStates.add(timerState);
    }

    @Override
    public List<SignalType> findSignalTypes() {
        return new ArrayList<>(state.signalTypes);
    }

    @Override
    public void insertSignalType(SignalType signalType) {
        state.signalTypes.add(signalType);
    }

    @Override
    public List<NextSignal> findNextSignals() {
        return new ArrayList<>(state.nextSignals);
    }

    @Override
    public void insertNextSignal(NextSignal nextSignal) {
        state.nextSignals.add(nextSignal);
    }

    @Override
    public List<TrackCircuitSignal> findTrackCircuitSignals() {
        return new ArrayList<>(state.trackCircuitSignals);
    }

    @Override
    public void insertTrackCircuitSignal(TrackCircuitSignal trackCircuitSignal) {
        state.trackCircuitSignals.add(trackCircuitSignal);
    }

    // ---------------------------------------------------------------- lock graph

    @Override
    public Lock insertLock(Lock lock) {
        Lock stored = lock.withId(++state.lastLockId);
        state.locks.add(stored);
        return stored;
    }

    @Override
    public LockCondition insertLockCondition(LockCondition condition) {
        LockCondition stored = condition.withId(++state.lastLockConditionId);
        state.lockConditions.add(stored);
        return stored;
    }

    @Override
    public LockConditionObject insertLockConditionObject(LockConditionObject conditionObject) {
        LockConditionObject stored = conditionObject.withId(++state.lastLockConditionObjectId);
        state.lockConditionObjects.add(stored);
        return stored;
    }

    @Override
    public void insertSwitchingMachineRoute(SwitchingMachineRoute switchingMachineRoute) {
        state.switchingMachineRoutes.add(switchingMachineRoute);
    }

    @Override
    public List<Lock> findLocks() {
        return new ArrayList<>(state.locks);
    }

    @Override
    public List<Lock> findLocksByObject(long objectId) {
        return state.locks.stream()
                .filter(l -> l.objectId() == objectId)
                .sorted(Comparator.comparing(Lock::type).thenComparingInt(Lock::routeLockGroup))
                .collect(Collectors.toList());
    }

    @Override
    public List<LockCondition> findLockConditions(long lockId) {
        return state.lockConditions.stream()
                .filter(c -> c.lockId() == lockId)
                .collect(Collectors.toList());
    }

    @Override
    public List<LockConditionObject> findLockConditionObjects(long lockId) {
        return state.lockConditionObjects.stream()
                .filter(o -> o.lockId() == lockId)
                .collect(Collectors.toList());
    }

    @Override
    public List<SwitchingMachineRoute> findSwitchingMachineRoutes() {
        return new ArrayList<>(state.switchingMachineRoutes);
    }

    // ---------------------------------------------------------------- associations

    @Override
    public List<RouteLeverDestinationButton> findRouteLeverDestinationButtons() {
        return new ArrayList<>(state.routeLeverDestinationButtons);
    }

    @Override
    public void insertRouteLeverDestinationButton(RouteLeverDestinationButton association) {
        state.routeLeverDestinationButtons.add(association);
    }

    @Override
    public List<SignalRoute> findSignalRoutes() {
        return new ArrayList<>(state.signalRoutes);
    }

    @Override
    public void insertSignalRoute(SignalRoute signalRoute) {
        state.signalRoutes.add(signalRoute);
    }

    @Override
    public List<ThrowOutControl> findThrowOutControls() {
        return new ArrayList<>(state.throwOutControls);
    }

    @Override
    public void insertThrowOutControl(ThrowOutControl throwOutControl) {
        state.throwOutControls.add(throwOutControl);
    }

    @Override
    public List<RouteLockTrackCircuit> findRouteLockTrackCircuits() {
        return new ArrayList<>(state.routeLockTrackCircuits);
    }

    @Override
    public void insertRouteLockTrackCircuit(RouteLockTrackCircuit routeLockTrackCircuit) {
        state.routeLockTrackCircuits.add(routeLockTrackCircuit);
    }

    @Override
    public List<OperationNotificationDisplay> findOperationNotificationDisplays() {
        return new ArrayList<>(state.operationNotificationDisplays);
    }

    @Override
    public void insertOperationNotificationDisplay(OperationNotificationDisplay display) {
        state.operationNotificationDisplays.add(display);
    }

    // ---------------------------------------------------------------- unit of work

    @Override
    public void flush() {
        logger.debug("Flush: {} objects, {} locks", state.objects.size(), state.locks.size());
    }

    @Override
    public void inTransaction(Runnable work) {
        if (transactionDepth > 0) {
            work.run();
            return;
        }

        State snapshot = state.copy();
        transactionDepth++;
        try {
            work.run();
        } catch (RuntimeException e) {
            logger.debug("Rolling back in-memory transaction", e);
            state = snapshot;
            throw e;
        } finally {
            transactionDepth--;
        }
    }

    /**
     * All registry contents. Rows are immutable records, so a shallow copy of each
     * collection is a full snapshot.
     */
    private static final class State {
        private final Map<Long, InterlockingObject> objects = new LinkedHashMap<>();
        private final Map<String, Long> objectIdsByName = new HashMap<>();
        private final List<Station> stations = new ArrayList<>();
        private final List<StationTimerState> stationTimerStates = new ArrayList<>();
        private final List<SignalType> signalTypes = new ArrayList<>();
        private final List<NextSignal> nextSignals = new ArrayList<>();
        private final List<TrackCircuitSignal> trackCircuitSignals = new ArrayList<>();
        private final List<Lock> locks = new ArrayList<>();
        private final List<LockCondition> lockConditions = new ArrayList<>();
        private final List<LockConditionObject> lockConditionObjects = new ArrayList<>();
        private final List<SwitchingMachineRoute> switchingMachineRoutes = new ArrayList<>();
        private final List<RouteLeverDestinationButton> routeLeverDestinationButtons = new ArrayList<>();
        private final List<SignalRoute> signalRoutes = new ArrayList<>();
        private final List<ThrowOutControl> throwOutControls = new ArrayList<>();
        private final List<RouteLockTrackCircuit> routeLockTrackCircuits = new ArrayList<>();
        private final List<OperationNotificationDisplay> operationNotificationDisplays = new ArrayList<>();
        private long lastObjectId;
        private long lastLockId;
        private long lastLockConditionId;
        private long lastLockConditionObjectId;

        State copy() {
            State copy = new State();
            copy.objects.putAll(objects);
            copy.objectIdsByName.putAll(objectIdsByName);
            copy.stations.addAll(stations);
            copy.stationTimerStates.addAll(stationTimerStates);
            copy.signalTypes.addAll(signalTypes);
            copy.nextSignals.addAll(nextSignals);
            copy.trackCircuitSignals.addAll(trackCircuitSignals);
            copy.locks.addAll(locks);
            copy.lockConditions.addAll(lockConditions);
            copy.lockConditionObjects.addAll(lockConditionObjects);
            copy.switchingMachineRoutes.addAll(switchingMachineRoutes);
            copy.routeLeverDestinationButtons.addAll(routeLeverDestinationButtons);
            copy.signalRoutes.addAll(signalRoutes);
            copy.throwOutControls.addAll(throwOutControls);
            copy.routeLockTrackCircuits.addAll(routeLockTrackCircuits);
            copy.operationNotificationDisplays.addAll(operationNotificationDisplays);
            copy.lastObjectId = lastObjectId;
            copy.lastLockId = lastLockId;
            copy.lastLockConditionId = lastLockConditionId;
            copy.lastLockConditionObjectId = lastLockConditionObjectId;
            return copy;
        }
    }
}
