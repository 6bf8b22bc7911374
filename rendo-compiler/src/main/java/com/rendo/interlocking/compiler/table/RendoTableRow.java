/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.table;

/**
 * One row of a station interlocking table (連動図表).
 *
 * <p>Mutable so that {@link RowPreprocessor} can normalise rows in place. Absent cells
 * are held as empty strings, never null.
 */
public class RendoTableRow {

    private String name = "";
    private String start = "";
    private String end = "";
    private String indicator = "";
    private String approachTime = "";
    private String approachLock = "";
    private String lockToSwitchingMachine = "";
    private String lockToRoute = "";
    private String signalControl = "";
    private String routeLock = "";

    public RendoTableRow() {
    }

    public RendoTableRow(String name, String start, String end) {
        setName(name);
        setStart(start);
        setEnd(end);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = orEmpty(name);
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = orEmpty(start);
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = orEmpty(end);
    }

    public String getIndicator() {
        return indicator;
    }

    public void setIndicator(String indicator) {
        this.indicator = orEmpty(indicator);
    }

    public String getApproachTime() {
        return approachTime;
    }

    public void setApproachTime(String approachTime) {
        this.approachTime = orEmpty(approachTime);
    }

    public String getApproachLock() {
        return approachLock;
    }

    public void setApproachLock(String approachLock) {
        this.approachLock = orEmpty(approachLock);
    }

    public String getLockToSwitchingMachine() {
        return lockToSwitchingMachine;
    }

    public void setLockToSwitchingMachine(String lockToSwitchingMachine) {
        this.lockToSwitchingMachine = orEmpty(lockToSwitchingMachine);
    }

    public String getLockToRoute() {
        return lockToRoute;
    }

    public void setLockToRoute(String lockToRoute) {
        this.lockToRoute = orEmpty(lockToRoute);
    }

    public String getSignalControl() {
        return signalControl;
    }

    public void setSignalControl(String signalControl) {
        this.signalControl = orEmpty(signalControl);
    }

    public String getRouteLock() {
        return routeLock;
    }

    public void setRouteLock(String routeLock) {
        this.routeLock = orEmpty(routeLock);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    @Override
    public String toString() {
        return "RendoTableRow{name='" + name + "', start='" + start + "', end='" + end + "'}";
    }
}
