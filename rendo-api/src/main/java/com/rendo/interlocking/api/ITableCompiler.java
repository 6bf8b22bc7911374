/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api;

import com.rendo.interlocking.api.model.CompilationReport;
import com.rendo.interlocking.api.registry.InterlockingRegistry;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Contract for compiling interlocking tables and topology data into the object registry.
 *
 * <p>The data directory is expected to contain {@code DBBase.json}, a {@code RendoTable}
 * directory with one CSV per station, and optionally {@code 運転告知器.csv} and
 * {@code 進路.csv}. Missing optional inputs skip their stage.
 */
public interface ITableCompiler {

    /**
     * Compiles the data directory into the registry.
     *
     * @param dataDirectory directory holding the topology document and station tables
     * @param registry      registry receiving objects, locks and associations
     * @return counts of what was written during this run
     * @throws IOException if an input file cannot be read
     * @throws com.rendo.interlocking.api.exceptions.CompilationException if a table is malformed
     *         or references something the registry does not hold
     */
    CompilationReport compile(Path dataDirectory, InterlockingRegistry registry) throws IOException;

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }

    /**
     * Replaces the station adjacency table consulted by cross-station brackets.
     *
     * @param adjacency station id to ordered list of adjacent station ids
     */
    default void setStationAdjacency(Map<String, List<String>> adjacency) {
    }
}
