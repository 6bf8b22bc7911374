/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.materialize;

/**
 * Running counts of rows written by a {@link LockGraphMaterializer}.
 */
public class MaterializationStats {

    private int locks;
    private int lockConditions;
    private int lockConditionObjects;
    private int switchingMachineRoutes;
    private int skippedReferences;

    void lockAdded() {
        locks++;
    }

    void lockConditionAdded() {
        lockConditions++;
    }

    void lockConditionObjectAdded() {
        lockConditionObjects++;
    }

    void switchingMachineRouteAdded() {
        switchingMachineRoutes++;
    }

    void referenceSkipped() {
        skippedReferences++;
    }

    public void add(MaterializationStats other) {
        locks += other.locks;
        lockConditions += other.lockConditions;
        lockConditionObjects += other.lockConditionObjects;
        switchingMachineRoutes += other.switchingMachineRoutes;
        skippedReferences += other.skippedReferences;
    }

    public int getLocks() {
        return locks;
    }

    public int getLockConditions() {
        return lockConditions;
    }

    public int getLockConditionObjects() {
        return lockConditionObjects;
    }

    public int getSwitchingMachineRoutes() {
        return switchingMachineRoutes;
    }

    public int getSkippedReferences() {
        return skippedReferences;
    }

    @Override
    public String toString() {
        return "MaterializationStats{locks=" + locks
                + ", lockConditions=" + lockConditions
                + ", lockConditionObjects=" + lockConditionObjects
                + ", switchingMachineRoutes=" + switchingMachineRoutes
                + ", skippedReferences=" + skippedReferences + '}';
    }
}
