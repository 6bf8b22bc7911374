package com.rendo.interlocking.compiler;

import com.rendo.interlocking.api.CompilationListener;
import com.rendo.interlocking.api.ITableCompiler;
import com.rendo.interlocking.api.exceptions.MissingUpstreamDataException;
import com.rendo.interlocking.api.exceptions.UnresolvedReferenceException;
import com.rendo.interlocking.api.model.CompilationReport;
import com.rendo.interlocking.api.model.InterlockingObject;
import com.rendo.interlocking.api.model.Lock;
import com.rendo.interlocking.api.model.LockCondition;
import com.rendo.interlocking.api.model.LockConditionObject;
import com.rendo.interlocking.api.model.ObjectType;
import com.rendo.interlocking.api.model.Route;
import com.rendo.interlocking.api.model.Signal;
import com.rendo.interlocking.api.model.SignalRoute;
import com.rendo.interlocking.api.model.TrackCircuit;
import com.rendo.interlocking.compiler.registry.InMemoryInterlockingRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TableCompilerTest {

    private static final String HEADER = "名称,てこ,着点,表示,接近時素,接近鎖錠,鎖錠転てつ器,鎖錠,信号制御,進路鎖錠\n";

    private static final String TOPOLOGY = """
            {
              "stationList": [
                {"Id": "TH99", "Name": "試験", "IsStation": true, "IsPassengerStation": true}
              ],
              "trackCircuitList": [
                {"Name": "上り12T", "ProtectionZone": 1, "NextSignalNamesUp": ["試験上り出発1"]},
                {"Name": "TH99_1RT"},
                {"Name": "TH99_21T", "ProtectionZone": 2}
              ],
              "signalTypeList": [
                {"Name": "3灯式", "RIndication": "R", "YIndication": "Y", "GIndication": "G"}
              ],
              "signalDataList": [
                {"Name": "試験上り出発1", "TypeName": "3灯式", "NextSignalNames": ["試験上り出発2"], "RouteNames": ["TH99_1R1"]},
                {"Name": "試験上り出発2", "TypeName": "3灯式", "NextSignalNames": ["上り閉塞12"]},
                {"Name": "上り閉塞12", "TypeName": "3灯式"}
              ],
              "throwOutControlList": []
            }
            """;

    private static final String STATION_TABLE = HEADER
            + "上り出発信号機,1R,1,,60秒,12,21,,1RT,(1RT)\n"
            + "転てつ器,21,,,,,,,21T,\n";

    @TempDir
    Path dataDirectory;

    private TableCompiler compiler;
    private InMemoryInterlockingRegistry registry;

    @BeforeEach
    void setUp() {
        compiler = new TableCompiler(OpenTelemetry.noop().getTracer("test"));
        registry = new InMemoryInterlockingRegistry();
    }

    private void writeDataDirectory(Map<String, String> stationTables) throws IOException {
        Files.writeString(dataDirectory.resolve(TableCompiler.TOPOLOGY_FILE), TOPOLOGY);
        Path tables = Files.createDirectories(dataDirectory.resolve(TableCompiler.RENDO_TABLE_DIRECTORY));
        for (Map.Entry<String, String> entry : stationTables.entrySet()) {
            Files.writeString(tables.resolve(entry.getKey() + ".csv"), entry.getValue());
        }
    }

    private void writeAuxiliaryFiles() throws IOException {
        Files.writeString(dataDirectory.resolve(TableCompiler.OPERATION_NOTIFICATION_DISPLAY_FILE),
                "名前,駅,上り,下り,軌道回路\n試験告知器,TH99,true,false,TH99_1RT,TH99_21T\n");
        Files.writeString(dataDirectory.resolve(TableCompiler.ROUTE_FILE),
                "進路,軌道回路\nTH99_1R1,TH99_1RT,TH99_21T\n");
    }

    @Test
    @DisplayName("Should compile topology, station tables and auxiliary files")
    void shouldCompileDataDirectory() throws IOException {
        writeDataDirectory(Map.of("TH99", STATION_TABLE));
        writeAuxiliaryFiles();

        CompilationReport report = compiler.compile(dataDirectory, registry);

        assertThat(report.stations()).isEqualTo(1);
        assertThat(report.objectsCreated()).isEqualTo(11);
        assertThat(report.locks()).isEqualTo(6);
        assertThat(report.lockConditions()).isEqualTo(1);
        assertThat(report.lockConditionObjects()).isEqualTo(5);
        assertThat(report.switchingMachineRoutes()).isEqualTo(1);
        assertThat(report.nextSignals()).isEqualTo(3);
        assertThat(report.skippedReferences()).isZero();

        Route route = (Route) registry.findObjectByName("TH99_1R1").orElseThrow();
        assertThat(route.approachLockTime()).isEqualTo(60);
        assertThat(registry.findLocksByObject(route.id())).hasSize(5);

        InterlockingObject machine = registry.findObjectByName("TH99_W21").orElseThrow();
        assertThat(machine.type()).isEqualTo(ObjectType.SWITCHING_MACHINE);
        assertThat(registry.findLocksByObject(machine.id())).hasSize(1);

        Signal closure = (Signal) registry.findObjectByName("上り閉塞12").orElseThrow();
        assertThat(closure.trackCircuitId()).isEqualTo(registry.findObjectByName("上り12T").orElseThrow().id());
        assertThat(registry.findObjectByName("試験上り出発1").orElseThrow().stationId()).isEqualTo("TH99");
        assertThat(registry.findObjectByName("TH99_1RT").orElseThrow().stationId()).isEqualTo("TH99");

        assertThat(registry.findStationTimerStates()).hasSize(2);
        assertThat(registry.findSignalRoutes()).containsExactly(new SignalRoute("試験上り出発1", route.id()));
        assertThat(registry.findRouteLockTrackCircuits()).hasSize(2);
        assertThat(registry.findOperationNotificationDisplays()).hasSize(1);
        TrackCircuit linked = (TrackCircuit) registry.findObjectByName("TH99_1RT").orElseThrow();
        assertThat(linked.operationNotificationDisplayName()).isEqualTo("試験告知器");
    }

    @Test
    @DisplayName("Should write every condition under a parent of the same lock")
    void shouldProduceWellFormedTrees() throws IOException {
        writeDataDirectory(Map.of("TH99", STATION_TABLE));

        compiler.compile(dataDirectory, registry);

        for (Lock lock : registry.findLocks()) {
            Set<Long> conditionIds = new HashSet<>();
            for (LockCondition condition : registry.findLockConditions(lock.id())) {
                conditionIds.add(condition.id());
            }
            for (LockCondition condition : registry.findLockConditions(lock.id())) {
                if (condition.parentId() != null) {
                    assertThat(conditionIds).contains(condition.parentId());
                }
            }
            for (LockConditionObject object : registry.findLockConditionObjects(lock.id())) {
                if (object.parentId() != null) {
                    assertThat(conditionIds).contains(object.parentId());
                }
            }
        }
    }

    @Test
    @DisplayName("Should add nothing when compiling the same data twice")
    void shouldBeIdempotent() throws IOException {
        writeDataDirectory(Map.of("TH99", STATION_TABLE));
        writeAuxiliaryFiles();
        compiler.compile(dataDirectory, registry);
        int objects = registry.findAllObjects().size();
        int locks = registry.findLocks().size();

        CompilationReport second = compiler.compile(dataDirectory, registry);

        assertThat(second.objectsCreated()).isZero();
        assertThat(second.locks()).isZero();
        assertThat(second.nextSignals()).isZero();
        assertThat(registry.findAllObjects()).hasSize(objects);
        assertThat(registry.findLocks()).hasSize(locks);
        assertThat(registry.findRouteLockTrackCircuits()).hasSize(2);
        assertThat(registry.findSignalRoutes()).hasSize(1);
    }

    @Test
    @DisplayName("Should skip missing inputs and report an empty run")
    void shouldCompileEmptyDirectory() throws IOException {
        CompilationReport report = compiler.compile(dataDirectory, registry);

        assertThat(report.stations()).isZero();
        assertThat(report.objectsCreated()).isZero();
        assertThat(registry.findAllObjects()).isEmpty();
    }

    @Test
    @DisplayName("Should abort on an unresolved token and roll back the station's locks")
    void shouldAbortOnUnresolvedToken() throws IOException {
        writeDataDirectory(Map.of("TH99", HEADER + "上り出発信号機,1R,1,,,,,99R,,\n"));
        CompilationListener listener = mock(CompilationListener.class);
        compiler.setCompilationListener(listener);

        assertThatThrownBy(() -> compiler.compile(dataDirectory, registry))
                .isInstanceOf(UnresolvedReferenceException.class)
                .hasMessageContaining("station=TH99")
                .hasMessageContaining("at=99R");

        verify(listener).onError(eq("LOCKS"), any(UnresolvedReferenceException.class));
        verify(listener, never()).onStageStart(eq("POST_TOPOLOGY"), anyInt(), anyInt());
        assertThat(registry.findObjectByName("TH99_1R1")).isPresent();
        assertThat(registry.findLocks()).isEmpty();
    }

    @Test
    @DisplayName("Should resolve bracketed tokens through configured adjacency")
    void shouldUseAdjacencyOverrides() throws IOException {
        writeDataDirectory(Map.of(
                "TH98", HEADER + "転てつ器,31,,,,,,,,\n",
                "TH99", HEADER + "上り出発信号機,1R,1,,,,[31],,,\n"));

        assertThatThrownBy(() -> compiler.compile(dataDirectory, new InMemoryInterlockingRegistry()))
                .isInstanceOf(MissingUpstreamDataException.class);

        compiler.setStationAdjacency(Map.of("TH99", List.of("TH98")));
        CompilationReport report = compiler.compile(dataDirectory, registry);

        assertThat(report.switchingMachineRoutes()).isEqualTo(1);
        long machineId = registry.findObjectByName("TH98_W31").orElseThrow().id();
        assertThat(registry.findSwitchingMachineRoutes())
                .singleElement()
                .extracting(r -> r.switchingMachineId())
                .isEqualTo(machineId);
    }

    @Test
    @DisplayName("Should report all seven stages to the listener")
    void shouldNotifyListener() throws IOException {
        writeDataDirectory(Map.of("TH99", STATION_TABLE));
        CompilationListener listener = mock(CompilationListener.class);
        compiler.setCompilationListener(listener);

        compiler.compile(dataDirectory, registry);

        verify(listener, times(7)).onStageStart(anyString(), anyInt(), eq(7));
        verify(listener).onStageStart("TOPOLOGY", 1, 7);
        verify(listener).onStageStart("POST_TOPOLOGY", 7, 7);
        verify(listener, times(7)).onStageComplete(anyString(), any(CompilationListener.StageResult.class));
        verify(listener, never()).onError(anyString(), any());
    }

    @Test
    @DisplayName("Should trace the run and every station phase")
    void shouldCreateSpans() throws IOException {
        writeDataDirectory(Map.of("TH99", STATION_TABLE));
        Tracer tracer = mock(Tracer.class);
        SpanBuilder spanBuilder = mock(SpanBuilder.class);
        Span span = mock(Span.class);
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(mock(Scope.class));
        compiler.setTracer(tracer);

        compiler.compile(dataDirectory, registry);

        verify(tracer).spanBuilder("compile-interlocking");
        verify(tracer).spanBuilder("init-topology");
        verify(tracer).spanBuilder("init-objects");
        verify(tracer).spanBuilder("init-locks");
        verify(tracer).spanBuilder("init-post-topology");
        verify(span, times(5)).end();
        verify(span, times(2)).setAttribute("stationId", "TH99");
    }

    @Test
    @DisplayName("Should be discoverable through ServiceLoader")
    void shouldLoadThroughServiceLoader() {
        ITableCompiler loaded = ServiceLoader.load(ITableCompiler.class).findFirst().orElseThrow();

        assertThat(loaded).isInstanceOf(TableCompiler.class);
    }
}
