/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.service;

import com.rendo.interlocking.api.CompilationListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports compilation progress through SLF4J.
 */
public class LoggingCompilationListener implements CompilationListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingCompilationListener.class);

    @Override
    public void onStageStart(String stageName, int stageNumber, int totalStages) {
        logger.info("[{}/{}] {} started", stageNumber, totalStages, stageName);
    }

    @Override
    public void onStageComplete(String stageName, StageResult result) {
        logger.info("{} completed in {} ms {}", stageName, result.durationMillis(), result.metrics());
    }

    @Override
    public void onError(String stageName, Exception error) {
        logger.error("{} failed: {}", stageName, error.getMessage());
    }
}
