/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler.io;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The global topology document ({@code DBBase.json}).
 */
public record TopologyDocument(
        @JsonProperty("stationList") List<StationData> stationList,
        @JsonProperty("trackCircuitList") List<TrackCircuitData> trackCircuitList,
        @JsonProperty("signalDataList") List<SignalData> signalDataList,
        @JsonProperty("signalTypeList") List<SignalTypeData> signalTypeList,
        @JsonProperty("throwOutControlList") List<ThrowOutControlData> throwOutControlList
) {

    public TopologyDocument {
        stationList = stationList == null ? List.of() : stationList;
        trackCircuitList = trackCircuitList == null ? List.of() : trackCircuitList;
        signalDataList = signalDataList == null ? List.of() : signalDataList;
        signalTypeList = signalTypeList == null ? List.of() : signalTypeList;
        throwOutControlList = throwOutControlList == null ? List.of() : throwOutControlList;
    }

    public static TopologyDocument empty() {
        return new TopologyDocument(null, null, null, null, null);
    }

    public record StationData(
            @JsonProperty("Id") String id,
            @JsonProperty("Name") String name,
            @JsonProperty("IsStation") boolean isStation,
            @JsonProperty("IsPassengerStation") boolean isPassengerStation
    ) {
    }

    /**
     * @param protectionZone null when the document does not define one yet
     */
    public record TrackCircuitData(
            @JsonProperty("Name") String name,
            @JsonProperty("ProtectionZone") Integer protectionZone,
            @JsonProperty("NextSignalNamesUp") List<String> nextSignalNamesUp,
            @JsonProperty("NextSignalNamesDown") List<String> nextSignalNamesDown
    ) {
        public TrackCircuitData {
            nextSignalNamesUp = nextSignalNamesUp == null ? List.of() : nextSignalNamesUp;
            nextSignalNamesDown = nextSignalNamesDown == null ? List.of() : nextSignalNamesDown;
        }
    }

    public record SignalData(
            @JsonProperty("Name") String name,
            @JsonProperty("TypeName") String typeName,
            @JsonProperty("NextSignalNames") List<String> nextSignalNames,
            @JsonProperty("RouteNames") List<String> routeNames
    ) {
        public SignalData {
            nextSignalNames = nextSignalNames == null ? List.of() : nextSignalNames;
            routeNames = routeNames == null ? List.of() : routeNames;
        }
    }

    public record SignalTypeData(
            @JsonProperty("Name") String name,
            @JsonProperty("RIndication") String rIndication,
            @JsonProperty("YYIndication") String yyIndication,
            @JsonProperty("YIndication") String yIndication,
            @JsonProperty("YGIndication") String ygIndication,
            @JsonProperty("GIndication") String gIndication
    ) {
    }

    /**
     * @param leverConditionName lever that must be set for the throw-out, empty when unconditional
     */
    public record ThrowOutControlData(
            @JsonProperty("SourceRouteName") String sourceRouteName,
            @JsonProperty("TargetRouteName") String targetRouteName,
            @JsonProperty("LeverConditionName") String leverConditionName
    ) {
    }
}
