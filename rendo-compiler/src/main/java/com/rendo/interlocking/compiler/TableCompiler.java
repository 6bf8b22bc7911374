/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.compiler;

import com.rendo.interlocking.api.CompilationListener;
import com.rendo.interlocking.api.ITableCompiler;
import com.rendo.interlocking.api.model.CompilationReport;
import com.rendo.interlocking.api.model.Lock;
import com.rendo.interlocking.api.registry.InterlockingRegistry;
import com.rendo.interlocking.compiler.io.AuxiliaryCsvReader;
import com.rendo.interlocking.compiler.io.RendoTableReader;
import com.rendo.interlocking.compiler.io.TopologyDocument;
import com.rendo.interlocking.compiler.io.TopologyReader;
import com.rendo.interlocking.compiler.materialize.MaterializationStats;
import com.rendo.interlocking.compiler.resolve.ResolutionIndex;
import com.rendo.interlocking.compiler.seed.OperationNotificationDisplayInitializer;
import com.rendo.interlocking.compiler.seed.PostTopologyInitializer;
import com.rendo.interlocking.compiler.seed.RouteLockTrackCircuitInitializer;
import com.rendo.interlocking.compiler.seed.StationTableInitializer;
import com.rendo.interlocking.compiler.seed.TopologyInitializer;
import com.rendo.interlocking.compiler.signal.SignalVisibilityExpander;
import com.rendo.interlocking.compiler.table.RendoTableRow;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Compiles a data directory of interlocking tables into an {@link InterlockingRegistry}.
 *
 * <p>The pipeline runs in 7 stages:
 * <ol>
 *   <li>TOPOLOGY: stations, track circuits, signal types, signals and next signal chains
 *       from {@code DBBase.json}</li>
 *   <li>OBJECTS: levers, switching machines, destination buttons and routes of every
 *       {@code RendoTable/<station>.csv}</li>
 *   <li>FLUSH: every station's objects become visible</li>
 *   <li>LOCKS: lock columns of every station are parsed, resolved and materialized</li>
 *   <li>OPERATION_NOTIFICATION_DISPLAYS: {@code 運転告知器.csv}</li>
 *   <li>ROUTE_LOCK_TRACK_CIRCUITS: {@code 進路.csv}</li>
 *   <li>POST_TOPOLOGY: signal routes, throw-out controls and station ids</li>
 * </ol>
 *
 * <p>Each station's object phase and lock phase runs in its own registry transaction.
 * The first {@link com.rendo.interlocking.api.exceptions.CompilationException} aborts the run; stations already committed stay.
 */
public class TableCompiler implements ITableCompiler {

    private static final Logger logger = LoggerFactory.getLogger(TableCompiler.class);

    public static final String TOPOLOGY_FILE = "DBBase.json";
    public static final String RENDO_TABLE_DIRECTORY = "RendoTable";
    public static final String OPERATION_NOTIFICATION_DISPLAY_FILE = "運転告知器.csv";
    public static final String ROUTE_FILE = "進路.csv";

    private static final String CSV_EXTENSION = ".csv";
    private static final int TOTAL_STAGES = 7;

    private final TopologyReader topologyReader = new TopologyReader();
    private final RendoTableReader rendoTableReader = new RendoTableReader();
    private final AuxiliaryCsvReader auxiliaryCsvReader = new AuxiliaryCsvReader();
    private final SignalVisibilityExpander expander = new SignalVisibilityExpander();

    private Tracer tracer;
    private CompilationListener listener;
    private StationAdjacency adjacency = StationAdjacency.defaults();

    /**
     * Creates a compiler with a no-op tracer. Used by {@link java.util.ServiceLoader}.
     */
    public TableCompiler() {
        this(OpenTelemetry.noop().getTracer("rendo-compiler"));
    }

    public TableCompiler(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }

    @Override
    public void setStationAdjacency(Map<String, List<String>> overrides) {
        this.adjacency = StationAdjacency.defaults().withOverrides(overrides);
    }

    @Override
    public CompilationReport compile(Path dataDirectory, InterlockingRegistry registry) throws IOException {
        Span span = tracer.spanBuilder("compile-interlocking").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("dataDirectory", dataDirectory.toString());
            long startTime = System.nanoTime();
            logger.info("Compiling interlocking data from {}", dataDirectory);

            Path topologyFile = dataDirectory.resolve(TOPOLOGY_FILE);
            TopologyDocument document = Files.isRegularFile(topologyFile)
                    ? topologyReader.read(topologyFile)
                    : null;

            TopologyInitializer.Result topology = runStage("TOPOLOGY", 1, () -> initTopology(document, registry),
                    result -> Map.of("objectsCreated", result.objectsCreated(), "nextSignals", result.nextSignals()));

            List<StationTableInitializer> stations = loadStationTables(dataDirectory, registry);
            int stationObjects = runStage("OBJECTS", 2, () -> initObjects(stations, registry),
                    created -> Map.of("stations", stations.size(), "objectsCreated", created));

            runStage("FLUSH", 3, () -> {
                registry.flush();
                return stations.size();
            }, flushed -> Map.of("stations", flushed));

            MaterializationStats lockStats = runStage("LOCKS", 4, () -> initLocks(stations, registry),
                    stats -> Map.of(
                            "locks", stats.getLocks(),
                            "lockConditions", stats.getLockConditions(),
                            "lockConditionObjects", stats.getLockConditionObjects(),
                            "skippedReferences", stats.getSkippedReferences()));

            Path displayFile = dataDirectory.resolve(OPERATION_NOTIFICATION_DISPLAY_FILE);
            runStage("OPERATION_NOTIFICATION_DISPLAYS", 5, () -> initDisplays(displayFile, registry),
                    created -> Map.of("displaysCreated", created));

            Path routeFile = dataDirectory.resolve(ROUTE_FILE);
            runStage("ROUTE_LOCK_TRACK_CIRCUITS", 6, () -> initRouteLockTrackCircuits(routeFile, registry),
                    created -> Map.of("associationsCreated", created));

            runStage("POST_TOPOLOGY", 7, () -> initPostTopology(document, registry),
                    updated -> Map.of("stationIdsAssigned", updated));

            long compilationTime = System.nanoTime() - startTime;
            CompilationReport report = new CompilationReport(
                    stations.size(),
                    topology.objectsCreated() + stationObjects,
                    lockStats.getLocks(),
                    lockStats.getLockConditions(),
                    lockStats.getLockConditionObjects(),
                    lockStats.getSwitchingMachineRoutes(),
                    topology.nextSignals(),
                    lockStats.getSkippedReferences(),
                    compilationTime);

            span.setAttribute("stationCount", report.stations());
            span.setAttribute("lockCount", report.locks());
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));
            logger.info("Compilation finished in {} ms: {}", TimeUnit.NANOSECONDS.toMillis(compilationTime), report);
            return report;

        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private TopologyInitializer.Result initTopology(TopologyDocument document, InterlockingRegistry registry) {
        if (document == null) {
            logger.warn("{} not found, skipping topology", TOPOLOGY_FILE);
            return new TopologyInitializer.Result(0, 0);
        }
        Span span = tracer.spanBuilder("init-topology").startSpan();
        try (Scope scope = span.makeCurrent()) {
            TopologyInitializer.Result[] result = new TopologyInitializer.Result[1];
            registry.inTransaction(() ->
                    result[0] = new TopologyInitializer(registry, expander).initialize(document));
            span.setAttribute("objectsCreated", result[0].objectsCreated());
            span.setAttribute("nextSignals", result[0].nextSignals());
            return result[0];
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private List<StationTableInitializer> loadStationTables(Path dataDirectory, InterlockingRegistry registry)
            throws IOException {
        Path tableDirectory = dataDirectory.resolve(RENDO_TABLE_DIRECTORY);
        if (!Files.isDirectory(tableDirectory)) {
            logger.warn("{} not found, skipping station tables", tableDirectory);
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(tableDirectory)) {
            files = listing
                    .filter(p -> p.getFileName().toString().endsWith(CSV_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<StationTableInitializer> initializers = new ArrayList<>();
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            String stationId = fileName.substring(0, fileName.length() - CSV_EXTENSION.length());
            List<RendoTableRow> rows = rendoTableReader.read(file);
            initializers.add(new StationTableInitializer(
                    stationId, rows, registry, adjacency.adjacentTo(stationId)));
        }
        return initializers;
    }

    private int initObjects(List<StationTableInitializer> stations, InterlockingRegistry registry) {
        int created = 0;
        for (StationTableInitializer station : stations) {
            Span span = tracer.spanBuilder("init-objects").startSpan();
            try (Scope scope = span.makeCurrent()) {
                span.setAttribute("stationId", station.getStationId());
                int[] count = new int[1];
                registry.inTransaction(() -> count[0] = station.initializeObjects());
                span.setAttribute("objectsCreated", count[0]);
                created += count[0];
            } catch (RuntimeException e) {
                span.recordException(e);
                throw e;
            } finally {
                span.end();
            }
        }
        return created;
    }

    private MaterializationStats initLocks(List<StationTableInitializer> stations, InterlockingRegistry registry) {
        ResolutionIndex index = ResolutionIndex.build(registry);
        LongSet lockedObjectIds = new LongOpenHashSet();
        for (Lock lock : registry.findLocks()) {
            lockedObjectIds.add(lock.objectId());
        }
        logger.info("Resolving locks against {} objects ({} already locked)", index.size(), lockedObjectIds.size());

        MaterializationStats total = new MaterializationStats();
        for (StationTableInitializer station : stations) {
            Span span = tracer.spanBuilder("init-locks").startSpan();
            try (Scope scope = span.makeCurrent()) {
                span.setAttribute("stationId", station.getStationId());
                MaterializationStats[] stats = new MaterializationStats[1];
                registry.inTransaction(() -> stats[0] = station.initializeLocks(index, lockedObjectIds));
                span.setAttribute("lockCount", stats[0].getLocks());
                total.add(stats[0]);
            } catch (RuntimeException e) {
                span.recordException(e);
                throw e;
            } finally {
                span.end();
            }
        }
        return total;
    }

    private int initDisplays(Path file, InterlockingRegistry registry) throws IOException {
        if (!Files.isRegularFile(file)) {
            logger.info("{} not found, skipping operation notification displays", file.getFileName());
            return 0;
        }
        List<AuxiliaryCsvReader.OperationNotificationDisplayRow> rows =
                auxiliaryCsvReader.readOperationNotificationDisplays(file);
        int[] created = new int[1];
        registry.inTransaction(() ->
                created[0] = new OperationNotificationDisplayInitializer(registry).initialize(rows));
        return created[0];
    }

    private int initRouteLockTrackCircuits(Path file, InterlockingRegistry registry) throws IOException {
        if (!Files.isRegularFile(file)) {
            logger.info("{} not found, skipping route lock track circuits", file.getFileName());
            return 0;
        }
        List<AuxiliaryCsvReader.RouteTrackCircuitRow> rows = auxiliaryCsvReader.readRouteTrackCircuits(file);
        int[] created = new int[1];
        registry.inTransaction(() ->
                created[0] = new RouteLockTrackCircuitInitializer(registry).initialize(rows));
        return created[0];
    }

    private int initPostTopology(TopologyDocument document, InterlockingRegistry registry) {
        Span span = tracer.spanBuilder("init-post-topology").startSpan();
        try (Scope scope = span.makeCurrent()) {
            PostTopologyInitializer post = new PostTopologyInitializer(registry);
            int[] updated = new int[1];
            registry.inTransaction(() -> {
                if (document != null) {
                    int signalRoutes = post.initializeSignalRoutes(document);
                    int throwOutControls = post.initializeThrowOutControls(document);
                    logger.info("Post topology: {} signal routes, {} throw-out controls created",
                            signalRoutes, throwOutControls);
                }
                updated[0] = post.assignStationIds();
            });
            span.setAttribute("stationIdsAssigned", updated[0]);
            return updated[0];
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Runs one stage and reports it to the listener.
     */
    private <T> T runStage(String stageName, int stageNumber, StageWork<T> work,
                           Function<T, Map<String, Object>> metrics) throws IOException {
        if (listener != null) {
            listener.onStageStart(stageName, stageNumber, TOTAL_STAGES);
        }
        long start = System.nanoTime();
        try {
            T result = work.run();
            if (listener != null) {
                listener.onStageComplete(stageName, new CompilationListener.StageResult(
                        stageName, System.nanoTime() - start, new HashMap<>(metrics.apply(result))));
            }
            return result;
        } catch (IOException | RuntimeException e) {
            if (listener != null) {
                listener.onError(stageName, e);
            }
            throw e;
        }
    }

    @FunctionalInterface
    private interface StageWork<T> {
        T run() throws IOException;
    }
}
