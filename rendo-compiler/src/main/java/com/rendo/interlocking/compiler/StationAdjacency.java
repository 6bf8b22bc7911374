/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered adjacent stations per station, addressed by {@code [ … ]} (first) and
 * {@code [[ … ]]} (second) in lock expressions.
 */
public final class StationAdjacency {

    private static final Map<String, List<String>> DEFAULTS;

    static {
        Map<String, List<String>> defaults = new LinkedHashMap<>();
        // 大道寺: 江ノ原検車区, 藤江
        defaults.put("TH65", List.of("TH66S", "TH64"));
        // 江ノ原検車区: 大道寺
        defaults.put("TH66S", List.of("TH65"));
        // 新野崎
        defaults.put("TH67", List.of());
        // 浜園: 津崎
        defaults.put("TH70", List.of("TH71"));
        // 津崎: 浜園
        defaults.put("TH71", List.of("TH70"));
        // 駒野: 館浜
        defaults.put("TH75", List.of("TH76"));
        // 館浜: 駒野
        defaults.put("TH76", List.of("TH75"));
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, List<String>> adjacency;

    private StationAdjacency(Map<String, List<String>> adjacency) {
        this.adjacency = adjacency;
    }

    /**
     * @return the hand-maintained table of the line
     */
    public static StationAdjacency defaults() {
        return new StationAdjacency(DEFAULTS);
    }

    /**
     * Returns a copy where the given stations' entries replace the current ones.
     */
    public StationAdjacency withOverrides(Map<String, List<String>> overrides) {
        Map<String, List<String>> merged = new LinkedHashMap<>(adjacency);
        overrides.forEach((station, adjacent) -> merged.put(station, List.copyOf(adjacent)));
        return new StationAdjacency(Collections.unmodifiableMap(merged));
    }

    /**
     * @return adjacent stations in slot order, empty for unknown stations
     */
    public List<String> adjacentTo(String stationId) {
        return adjacency.getOrDefault(stationId, List.of());
    }

    public Map<String, List<String>> asMap() {
        return adjacency;
    }
}
