package com.rendo.interlocking.service.repository;

import com.rendo.interlocking.api.exceptions.RegistryException;
import com.rendo.interlocking.api.model.InterlockingObject;
import com.rendo.interlocking.api.model.Lever;
import com.rendo.interlocking.api.model.LeverType;
import com.rendo.interlocking.api.model.Lock;
import com.rendo.interlocking.api.model.LockCondition;
import com.rendo.interlocking.api.model.LockConditionObject;
import com.rendo.interlocking.api.model.LockConditionType;
import com.rendo.interlocking.api.model.LockType;
import com.rendo.interlocking.api.model.NR;
import com.rendo.interlocking.api.model.NextSignal;
import com.rendo.interlocking.api.model.ObjectType;
import com.rendo.interlocking.api.model.Route;
import com.rendo.interlocking.api.model.RouteType;
import com.rendo.interlocking.api.model.Signal;
import com.rendo.interlocking.api.model.SignalIndication;
import com.rendo.interlocking.api.model.SignalType;
import com.rendo.interlocking.api.model.Station;
import com.rendo.interlocking.api.model.SwitchingMachine;
import com.rendo.interlocking.api.model.SwitchingMachineRoute;
import com.rendo.interlocking.api.model.TrackCircuit;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class JdbcInterlockingRegistryTest {

    private HikariDataSource dataSource;
    private JdbcInterlockingRegistry registry;

    @BeforeEach
    void setUp() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        config.setUsername("sa");
        config.setPassword("");
        config.setMaximumPoolSize(2);
        dataSource = new HikariDataSource(config);

        registry = new JdbcInterlockingRegistry(dataSource);
        registry.initializeSchema();
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    @Test
    @DisplayName("Should assign ids and read every object kind back")
    void shouldRoundTripObjects() {
        TrackCircuit circuit = registry.insertObject(new TrackCircuit(0, "TH65_1RT", "TH65", 3, null));
        Route route = registry.insertObject(
                new Route(0, "TH65_1R", "TH65", RouteType.DEPARTURE, "1", null));
        SwitchingMachine machine = registry.insertObject(new SwitchingMachine(0, "TH65_W21", "TH65"));
        Lever lever = registry.insertObject(
                new Lever(0, "TH65_21", "TH65", LeverType.SWITCHING_MACHINE, machine.id()));
        Signal signal = registry.insertObject(new Signal(0, "上り閉塞3", null, "3灯式", circuit.id()));

        assertThat(route.id()).isPositive();
        assertThat(registry.findObjectByName("TH65_1R")).contains(route);
        assertThat(registry.findObjectByName("TH65_W21")).contains(machine);
        assertThat(registry.findObjectByName("TH65_21")).contains(lever);
        assertThat(registry.findObjectByName("上り閉塞3")).contains(signal);
        assertThat(registry.findObjectByName("TH65_1RT")).contains(circuit);
        assertThat(registry.findObjectByName("TH65_2R")).isEmpty();
    }

    @Test
    @DisplayName("Should filter objects by type in insertion order")
    void shouldFindObjectsByType() {
        registry.insertObject(new Route(0, "TH65_2R", "TH65", RouteType.ARRIVING, "", 60));
        registry.insertObject(new SwitchingMachine(0, "TH65_W21", "TH65"));
        registry.insertObject(new Route(0, "TH65_1R", "TH65", RouteType.DEPARTURE, "", null));

        assertThat(registry.findObjects(ObjectType.ROUTE))
                .extracting(InterlockingObject::name)
                .containsExactly("TH65_2R", "TH65_1R");
        assertThat(registry.findAllObjects()).hasSize(3);
    }

    @Test
    @DisplayName("Should reject a duplicate name")
    void shouldRejectDuplicateName() {
        registry.insertObject(new SwitchingMachine(0, "TH65_W21", "TH65"));

        assertThatThrownBy(() -> registry.insertObject(new SwitchingMachine(0, "TH65_W21", "TH65")))
                .isInstanceOf(RegistryException.class);
    }

    @Test
    @DisplayName("Should update mutable attributes only")
    void shouldUpdateObject() {
        TrackCircuit circuit = registry.insertObject(new TrackCircuit(0, "上り12T", null, 99, null));

        registry.updateObject(new TrackCircuit(circuit.id(), "上り12T", "TH65", 99, "告知器1"));

        TrackCircuit updated = (TrackCircuit) registry.findObjectByName("上り12T").orElseThrow();
        assertThat(updated.stationId()).isEqualTo("TH65");
        assertThat(updated.operationNotificationDisplayName()).isEqualTo("告知器1");

        assertThatThrownBy(() -> registry.updateObject(new TrackCircuit(circuit.id(), "上り13T", "TH65", 99, null)))
                .isInstanceOf(RegistryException.class);
        assertThatThrownBy(() -> registry.updateObject(new TrackCircuit(9999, "上り12T", "TH65", 99, null)))
                .isInstanceOf(RegistryException.class)
                .hasMessageContaining("9999");
    }

    @Test
    @DisplayName("Should order an object's locks by type then route lock group")
    void shouldOrderLocksByTypeAndGroup() {
        Route route = registry.insertObject(new Route(0, "TH65_1R", "TH65", RouteType.DEPARTURE, "", null));
        registry.insertLock(new Lock(0, route.id(), LockType.ROUTE, 1));
        registry.insertLock(new Lock(0, route.id(), LockType.LOCK, 0));
        registry.insertLock(new Lock(0, route.id(), LockType.ROUTE, 0));
        registry.insertLock(new Lock(0, route.id() + 1, LockType.LOCK, 0));

        assertThat(registry.findLocksByObject(route.id()))
                .extracting(Lock::type, Lock::routeLockGroup)
                .containsExactly(
                        tuple(LockType.LOCK, 0),
                        tuple(LockType.ROUTE, 0),
                        tuple(LockType.ROUTE, 1));
        assertThat(registry.findLocks()).hasSize(4);
    }

    @Test
    @DisplayName("Should keep parents, timers and polarity of condition leaves")
    void shouldStoreConditionTree() {
        Route route = registry.insertObject(new Route(0, "TH65_1R", "TH65", RouteType.DEPARTURE, "", null));
        SwitchingMachine machine = registry.insertObject(new SwitchingMachine(0, "TH65_W21", "TH65"));
        Lock lock = registry.insertLock(new Lock(0, route.id(), LockType.LOCK, 0));

        LockCondition root = registry.insertLockCondition(
                new LockCondition(0, lock.id(), LockConditionType.OR, null));
        LockCondition branch = registry.insertLockCondition(
                new LockCondition(0, lock.id(), LockConditionType.AND, root.id()));
        registry.insertLockConditionObject(
                new LockConditionObject(0, lock.id(), machine.id(), branch.id(), null, NR.REVERSED));
        registry.insertLockConditionObject(
                new LockConditionObject(0, lock.id(), route.id(), root.id(), 30, NR.NORMAL));

        assertThat(registry.findLockConditions(lock.id())).containsExactly(root, branch);
        assertThat(registry.findLockConditionObjects(lock.id()))
                .extracting(LockConditionObject::parentId, LockConditionObject::timerSeconds,
                        LockConditionObject::reverse)
                .containsExactly(
                        tuple(branch.id(), null, NR.REVERSED),
                        tuple(root.id(), 30, NR.NORMAL));
        assertThat(registry.findLockConditions(lock.id() + 1)).isEmpty();
    }

    @Test
    @DisplayName("Should store switching machine routes")
    void shouldStoreSwitchingMachineRoutes() {
        registry.insertSwitchingMachineRoute(new SwitchingMachineRoute(1, 2, NR.REVERSED));

        assertThat(registry.findSwitchingMachineRoutes())
                .containsExactly(new SwitchingMachineRoute(1, 2, NR.REVERSED));
    }

    @Test
    @DisplayName("Should store stations, signal types and next signals")
    void shouldStoreTopologyRecords() {
        registry.insertStation(new Station("TH65", "館浜", true, true));
        registry.insertSignalType(new SignalType("3灯式",
                SignalIndication.R, SignalIndication.R, SignalIndication.Y, SignalIndication.Y, SignalIndication.G));
        registry.insertNextSignal(new NextSignal("A", "A", "B", 1));
        registry.insertNextSignal(new NextSignal("A", "B", "C", 2));

        assertThat(registry.findStations()).containsExactly(new Station("TH65", "館浜", true, true));
        assertThat(registry.findSignalTypes()).hasSize(1);
        assertThat(registry.findSignalTypes().get(0).g()).isEqualTo(SignalIndication.G);
        assertThat(registry.findNextSignals())
                .extracting(NextSignal::targetSignalName, NextSignal::depth)
                .containsExactly(tuple("B", 1), tuple("C", 2));
    }

    @Test
    @DisplayName("Should commit the work of a transaction")
    void shouldCommit() {
        registry.inTransaction(() -> {
            registry.insertObject(new SwitchingMachine(0, "TH65_W21", "TH65"));
            registry.flush();
            assertThat(registry.findObjectByName("TH65_W21")).isPresent();
        });

        assertThat(registry.findAllObjects()).hasSize(1);
    }

    @Test
    @DisplayName("Should roll back every write when the work fails")
    void shouldRollBackOnFailure() {
        registry.insertObject(new SwitchingMachine(0, "TH65_W21", "TH65"));

        assertThatThrownBy(() -> registry.inTransaction(() -> {
            Route route = registry.insertObject(
                    new Route(0, "TH65_1R", "TH65", RouteType.DEPARTURE, "", null));
            registry.insertLock(new Lock(0, route.id(), LockType.LOCK, 0));
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(registry.findAllObjects())
                .extracting(InterlockingObject::name)
                .containsExactly("TH65_W21");
        assertThat(registry.findLocks()).isEmpty();
    }

    @Test
    @DisplayName("Should join an enclosing transaction")
    void shouldJoinOuterTransaction() {
        assertThatThrownBy(() -> registry.inTransaction(() -> {
            registry.inTransaction(() -> registry.insertObject(new SwitchingMachine(0, "TH65_W21", "TH65")));
            throw new IllegalStateException("outer failure");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(registry.findAllObjects()).isEmpty();
    }

    @Test
    @DisplayName("Should keep objects readable across registries on the same database")
    void shouldShareCommittedState() {
        registry.inTransaction(() -> registry.insertObject(new SwitchingMachine(0, "TH65_W21", "TH65")));

        JdbcInterlockingRegistry other = new JdbcInterlockingRegistry(dataSource);

        assertThat(other.findObjects(ObjectType.SWITCHING_MACHINE)).hasSize(1);
        assertThat(other.findLocks()).isEmpty();
    }
}
