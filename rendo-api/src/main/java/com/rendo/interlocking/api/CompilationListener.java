/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 *
 * <p>The seeding pipeline consists of 7 stages:
 * <ol>
 *   <li>TOPOLOGY - Stations, track circuits, signals and next-signal chains</li>
 *   <li>OBJECTS - Levers, destination buttons and routes per station table</li>
 *   <li>FLUSH - Make every station's objects visible</li>
 *   <li>LOCKS - Parse, resolve and materialize lock expressions</li>
 *   <li>OPERATION_NOTIFICATION_DISPLAYS - Link track circuits to their displays</li>
 *   <li>ROUTE_LOCK_TRACK_CIRCUITS - Route to track circuit associations</li>
 *   <li>POST_TOPOLOGY - Signal routes, throw-out controls and station ids</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * ITableCompiler compiler = ServiceLoader.load(ITableCompiler.class).findFirst().orElseThrow();
 * compiler.setCompilationListener(new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         log.info("Starting {} ({}/{})", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         log.info("Completed {} in {} ms", stageName, result.durationMillis());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         log.error("Error in {}", stageName, error);
 *     }
 * });
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName Name of the stage (e.g., "TOPOLOGY", "LOCKS")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes successfully.
     *
     * @param stageName Name of the stage
     * @param result Result containing duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a compilation stage encounters an error.
     *
     * @param stageName Name of the stage that failed
     * @param error The exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics Stage-specific metrics (e.g., "locks", "stations")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        /**
         * Returns the duration in milliseconds.
         */
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
