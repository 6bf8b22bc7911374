/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.service;

import com.rendo.interlocking.api.ITableCompiler;
import com.rendo.interlocking.api.exceptions.CompilationException;
import com.rendo.interlocking.api.exceptions.RegistryException;
import com.rendo.interlocking.api.model.CompilationReport;
import com.rendo.interlocking.api.registry.InterlockingRegistry;
import com.rendo.interlocking.compiler.registry.InMemoryInterlockingRegistry;
import com.rendo.interlocking.service.config.SeedConfig;
import com.rendo.interlocking.service.repository.JdbcInterlockingRegistry;
import com.rendo.interlocking.service.telemetry.TracingService;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ServiceLoader;

/**
 * Command-line entry point: compiles a data directory into the configured registry.
 *
 * <pre>
 * java -jar rendo-service.jar [dataDirectory]
 * </pre>
 *
 * The optional argument replaces {@code seed.data.dir}. Exits with status 1 when the
 * compilation is aborted.
 */
public class SeedApplication {
    private static final Logger logger = LoggerFactory.getLogger(SeedApplication.class);

    private final SeedConfig config;
    private final Tracer tracer;

    public SeedApplication(SeedConfig config, Tracer tracer) {
        this.config = config;
        this.tracer = tracer;
    }

    public static void main(String[] args) {
        TracingService tracingService = TracingService.getInstance();
        int status;
        try {
            SeedConfig config = SeedConfig.loadDefault();
            Path dataDirectory = args.length > 0 ? Paths.get(args[0]) : config.getDataDirectory();
            status = new SeedApplication(config, tracingService.getTracer()).run(dataDirectory);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            status = 1;
        } finally {
            tracingService.shutdown();
        }
        System.exit(status);
    }

    /**
     * Seed the configured registry from {@code dataDirectory}.
     *
     * @return process exit status
     */
    public int run(Path dataDirectory) {
        logger.info("Seeding interlocking data from {} ({})", dataDirectory, config);

        if (config.getRegistryType() == SeedConfig.RegistryType.JDBC) {
            try (HikariDataSource dataSource = createDataSource(config)) {
                JdbcInterlockingRegistry registry = new JdbcInterlockingRegistry(dataSource);
                registry.initializeSchema();
                return seed(dataDirectory, registry);
            }
        }
        return seed(dataDirectory, new InMemoryInterlockingRegistry());
    }

    /**
     * Compile {@code dataDirectory} into {@code registry}.
     *
     * @return 0 on success, 1 when the run was aborted
     */
    public int seed(Path dataDirectory, InterlockingRegistry registry) {
        ITableCompiler compiler = ServiceLoader.load(ITableCompiler.class)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No ITableCompiler implementation found"));
        compiler.setTracer(tracer);
        compiler.setCompilationListener(new LoggingCompilationListener());
        if (!config.getAdjacencyOverrides().isEmpty()) {
            compiler.setStationAdjacency(config.getAdjacencyOverrides());
        }

        try {
            CompilationReport report = compiler.compile(dataDirectory, registry);
            logger.info("Seeding complete: {} stations, {} objects, {} locks, {} conditions, {} condition objects, "
                            + "{} switching machine routes, {} next signals, {} skipped references in {} ms",
                    report.stations(), report.objectsCreated(), report.locks(), report.lockConditions(),
                    report.lockConditionObjects(), report.switchingMachineRoutes(), report.nextSignals(),
                    report.skippedReferences(), report.compilationTimeNanos() / 1_000_000);
            return 0;
        } catch (CompilationException e) {
            logger.error("Compilation aborted: {}", e.getMessage());
            return 1;
        } catch (RegistryException e) {
            logger.error("Registry failure: {}", e.getMessage(), e);
            return 1;
        } catch (IOException e) {
            logger.error("Failed to read {}: {}", dataDirectory, e.getMessage(), e);
            return 1;
        }
    }

    private static HikariDataSource createDataSource(SeedConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.getJdbcUrl());
        hikari.setUsername(config.getJdbcUser());
        hikari.setPassword(config.getJdbcPassword());
        hikari.setMaximumPoolSize(config.getJdbcPoolSize());
        hikari.setPoolName("rendo-seed");
        return new HikariDataSource(hikari);
    }
}
