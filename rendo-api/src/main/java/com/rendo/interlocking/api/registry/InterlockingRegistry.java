/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api.registry;

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

import java.util.List;
import java.util.Optional;

/**
 * Shared object registry written by the compiler and read by the runtime interlocking engine.
 *
 * <p>Implementations may keep everything in memory or persist to a database. Rows are only
 * ever inserted or updated, never deleted. Callers check for existing rows before inserting;
 * inserting an object whose name is already taken is a
 * {@link com.rendo.interlocking.api.exceptions.RegistryException}.
 *
 * <p><b>Thread Safety:</b> Implementations are used from a single thread during seeding and
 * need not be thread-safe.
 */
public interface InterlockingRegistry {

    // ---------------------------------------------------------------- objects

    /**
     * Insert an interlocking object.
     *
     * @param object the object to insert, its id is ignored
     * @return the same object carrying the registry-assigned id
     */
    <T extends InterlockingObject> T insertObject(T object);

    /**
     * Overwrite the mutable attributes (station id, display link) of a persisted object.
     *
     * @param object the object, identified by its id
     */
    void updateObject(InterlockingObject object);

    Optional<InterlockingObject> findObjectByName(String name);

    List<InterlockingObject> findObjects(ObjectType type);

    List<InterlockingObject> findAllObjects();

    // ---------------------------------------------------------------- topology

    List<Station> findStations();

    void insertStation(Station station);

    List<StationTimerState> findStationTimerStates();

    void insertStationTimerState(StationTimerState state);

    List<SignalType> findSignalTypes();

    void insertSignalType(SignalType signalType);

    List<NextSignal> findNextSignals();

    void insertNextSignal(NextSignal nextSignal);

    List<TrackCircuitSignal> findTrackCircuitSignals();

    void insertTrackCircuitSignal(TrackCircuitSignal trackCircuitSignal);

    // ---------------------------------------------------------------- lock graph

    Lock insertLock(Lock lock);

    LockCondition insertLockCondition(LockCondition condition);

    LockConditionObject insertLockConditionObject(LockConditionObject conditionObject);

    void insertSwitchingMachineRoute(SwitchingMachineRoute switchingMachineRoute);

    List<Lock> findLocks();

    /**
     * Find the locks gating one object, ordered by type and route lock group.
     */
    List<Lock> findLocksByObject(long objectId);

    List<LockCondition> findLockConditions(long lockId);

    List<LockConditionObject> findLockConditionObjects(long lockId);

    List<SwitchingMachineRoute> findSwitchingMachineRoutes();

    // ---------------------------------------------------------------- associations

    List<RouteLeverDestinationButton> findRouteLeverDestinationButtons();

    void insertRouteLeverDestinationButton(RouteLeverDestinationButton association);

    List<SignalRoute> findSignalRoutes();

    void insertSignalRoute(SignalRoute signalRoute);

    List<ThrowOutControl> findThrowOutControls();

    void insertThrowOutControl(ThrowOutControl throwOutControl);

    List<RouteLockTrackCircuit> findRouteLockTrackCircuits();

    void insertRouteLockTrackCircuit(RouteLockTrackCircuit routeLockTrackCircuit);

    List<OperationNotificationDisplay> findOperationNotificationDisplays();

    void insertOperationNotificationDisplay(OperationNotificationDisplay display);

    // ---------------------------------------------------------------- unit of work

    /**
     * Make every write issued so far visible to subsequent reads, including reads from
     * other connections.
     */
    void flush();

    /**
     * Run {@code work} atomically. Writes are kept only if it completes normally; a runtime
     * exception rolls them back and is rethrown. Nested calls join the outer transaction.
     *
     * @param work the unit of work
     */
    void inTransaction(Runnable work);
}
