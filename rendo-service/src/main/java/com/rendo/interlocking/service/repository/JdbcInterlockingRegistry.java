/*
 * Copyright (c) 2025 Rendo Interlocking Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.rendo.interlocking.service.repository;

import com.rendo.interlocking.api.exceptions.RegistryException;
import com.rendo.interlocking.api.model.DestinationButton;
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
import com.rendo.interlocking.api.model.OperationNotificationDisplay;
import com.rendo.interlocking.api.model.Route;
import com.rendo.interlocking.api.model.RouteLeverDestinationButton;
import com.rendo.interlocking.api.model.RouteLockTrackCircuit;
import com.rendo.interlocking.api.model.RouteType;
import com.rendo.interlocking.api.model.Signal;
import com.rendo.interlocking.api.model.SignalIndication;
import com.rendo.interlocking.api.model.SignalRoute;
import com.rendo.interlocking.api.model.SignalType;
import com.rendo.interlocking.api.model.Station;
import com.rendo.interlocking.api.model.StationTimerState;
import com.rendo.interlocking.api.model.SwitchingMachine;
import com.rendo.interlocking.api.model.SwitchingMachineRoute;
import com.rendo.interlocking.api.model.ThrowOutControl;
import com.rendo.interlocking.api.model.TrackCircuit;
import com.rendo.interlocking.api.model.TrackCircuitSignal;
import com.rendo.interlocking.api.registry.InterlockingRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC-based implementation of {@link InterlockingRegistry} using H2 or PostgreSQL.
 *
 * <p>All interlocking objects share the {@code interlocking_object} table with an
 * {@code object_type} discriminator. Inside {@link #inTransaction(Runnable)} every call on the
 * same thread uses one connection with auto-commit off; outside a transaction each call
 * commits on its own.
 *
 * <p><b>Thread Safety:</b> one transaction per thread. The registry is meant for the
 * single-threaded seeding run.
 */
public class JdbcInterlockingRegistry implements InterlockingRegistry {

    private static final Logger logger = LoggerFactory.getLogger(JdbcInterlockingRegistry.class);

    private static final Map<String, String> SQL = SqlLoader.loadQueries("sql/queries.sql");
    private static final List<String> SCHEMA_SQL = SqlLoader.loadSchema("sql/schema.sql");

    private final DataSource dataSource;
    private final ThreadLocal<Connection> transaction = new ThreadLocal<>();

    public JdbcInterlockingRegistry(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Create database schema if it doesn't exist.
     */
    public void initializeSchema() {
        logger.info("Initializing interlocking registry schema...");
        execute(conn -> {
            try (Statement stmt = conn.createStatement()) {
                for (String sql : SCHEMA_SQL) {
                    stmt.execute(sql);
                }
            }
            return null;
        }, "initialize schema");
        logger.info("Interlocking registry schema initialized");
    }

    // ---------------------------------------------------------------- objects

    @Override
    @SuppressWarnings("unchecked")
    public <T extends InterlockingObject> T insertObject(T object) {
        long id = execute(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(SQL.get("insert_object"),
                    Statement.RETURN_GENERATED_KEYS)) {
                int idx = 1;
                stmt.setString(idx++, object.name());
                stmt.setString(idx++, object.stationId());
                stmt.setString(idx++, object.type().name());
                bindTypeColumns(stmt, idx, object);
                stmt.executeUpdate();
                return generatedKey(stmt);
            }
        }, "insert object " + object.name());
        return (T) object.withId(id);
    }

    @Override
    public void updateObject(InterlockingObject object) {
        execute(conn -> {
            InterlockingObject existing = queryOne(conn, SQL.get("select_object_by_id"),
                    stmt -> stmt.setLong(1, object.id()), JdbcInterlockingRegistry::mapObject)
                    .orElseThrow(() -> new RegistryException("Unknown object id: " + object.id()));
            if (!existing.name().equals(object.name()) || existing.type() != object.type()) {
                throw new RegistryException("Object " + object.id() + " cannot change name or type");
            }

            try (PreparedStatement stmt = conn.prepareStatement(SQL.get("update_object"))) {
                int idx = 1;
                stmt.setString(idx++, object.stationId());
                idx = bindTypeColumns(stmt, idx, object);
                stmt.setLong(idx, object.id());
                stmt.executeUpdate();
            }
            return null;
        }, "update object " + object.id());
    }

    @Override
    public Optional<InterlockingObject> findObjectByName(String name) {
        return execute(conn -> queryOne(conn, SQL.get("select_object_by_name"),
                stmt -> stmt.setString(1, name), JdbcInterlockingRegistry::mapObject), "find object " + name);
    }

    @Override
    public List<InterlockingObject> findObjects(ObjectType type) {
        return query(SQL.get("select_objects_by_type"), stmt -> stmt.setString(1, type.name()),
                JdbcInterlockingRegistry::mapObject);
    }

    @Override
    public List<InterlockingObject> findAllObjects() {
        return query(SQL.get("select_all_objects"), stmt -> { }, JdbcInterlockingRegistry::mapObject);
    }

    // ---------------------------------------------------------------- topology

    @Override
    public List<Station> findStations() {
        return query(SQL.get("select_stations"), stmt -> { }, rs -> new Station(
                rs.getString("id"), rs.getString("name"),
                rs.getBoolean("is_station"), rs.getBoolean("is_passenger_station")));
    }

    @Override
    public void insertStation(Station station) {
        update(SQL.get("insert_station"), stmt -> {
            stmt.setString(1, station.id());
            stmt.setString(2, station.name());
            stmt.setBoolean(3, station.isStation());
            stmt.setBoolean(4, station.isPassengerStation());
        });
    }

    @Override
    public List<StationTimerState> findStationTimerStates() {
        return query(SQL.get("select_station_timer_states"), stmt -> { }, rs -> new StationTimerState(
                rs.getString("station_id"), rs.getInt("timer_seconds")));
    }

    @Override
    public void insertStationTimerState(StationTimerState state) {
        update(SQL.get("insert_station_timer_state"), stmt -> {
            stmt.setString(1, state.stationId());
            stmt.setInt(2, state.seconds());
        });
    }

    @Override
    public List<SignalType> findSignalTypes() {
        return query(SQL.get("select_signal_types"), stmt -> { }, rs -> new SignalType(
                rs.getString("name"),
                SignalIndication.fromString(rs.getString("r_indication")),
                SignalIndication.fromString(rs.getString("yy_indication")),
                SignalIndication.fromString(rs.getString("y_indication")),
                SignalIndication.fromString(rs.getString("yg_indication")),
                SignalIndication.fromString(rs.getString("g_indication"))));
    }

    @Override
    public void insertSignalType(SignalType signalType) {
        update(SQL.get("insert_signal_type"), stmt -> {
            stmt.setString(1, signalType.name());
            stmt.setString(2, signalType.r().name());
            stmt.setString(3, signalType.yy().name());
            stmt.setString(4, signalType.y().name());
            stmt.setString(5, signalType.yg().name());
            stmt.setString(6, signalType.g().name());
        });
    }

    @Override
    public List<NextSignal> findNextSignals() {
        return query(SQL.get("select_next_signals"), stmt -> { }, rs -> new NextSignal(
                rs.getString("signal_name"), rs.getString("source_signal_name"),
                rs.getString("target_signal_name"), rs.getInt("depth")));
    }

    @Override
    public void insertNextSignal(NextSignal nextSignal) {
        update(SQL.get("insert_next_signal"), stmt -> {
            stmt.setString(1, nextSignal.signalName());
            stmt.setString(2, nextSignal.sourceSignalName());
            stmt.setString(3, nextSignal.targetSignalName());
            stmt.setInt(4, nextSignal.depth());
        });
    }

    @Override
    public List<TrackCircuitSignal> findTrackCircuitSignals() {
        return query(SQL.get("select_track_circuit_signals"), stmt -> { }, rs -> new TrackCircuitSignal(
                rs.getLong("track_circuit_id"), rs.getString("signal_name"), rs.getBoolean("is_up")));
    }

    @Override
    public void insertTrackCircuitSignal(TrackCircuitSignal trackCircuitSignal) {
        update(SQL.get("insert_track_circuit_signal"), stmt -> {
            stmt.setLong(1, trackCircuitSignal.trackCircuitId());
            stmt.setString(2, trackCircuitSignal.signalName());
            stmt.setBoolean(3, trackCircuitSignal.isUp());
        });
    }

    // ---------------------------------------------------------------- lock graph

    @Override
    public Lock insertLock(Lock lock) {
        long id = insertReturningId(SQL.get("insert_lock"), stmt -> {
            stmt.setLong(1, lock.objectId());
            stmt.setString(2, lock.type().name());
            stmt.setInt(3, lock.routeLockGroup());
        });
        return lock.withId(id);
    }

    @Override
    public LockCondition insertLockCondition(LockCondition condition) {
        long id = insertReturningId(SQL.get("insert_lock_condition"), stmt -> {
            stmt.setLong(1, condition.lockId());
            stmt.setString(2, condition.type().name());
            setLongOrNull(stmt, 3, condition.parentId());
        });
        return condition.withId(id);
    }

    @Override
    public LockConditionObject insertLockConditionObject(LockConditionObject conditionObject) {
        long id = insertReturningId(SQL.get("insert_lock_condition_object"), stmt -> {
            stmt.setLong(1, conditionObject.lockId());
            stmt.setLong(2, conditionObject.objectId());
            setLongOrNull(stmt, 3, conditionObject.parentId());
            setIntegerOrNull(stmt, 4, conditionObject.timerSeconds());
            stmt.setString(5, conditionObject.reverse().name());
        });
        return conditionObject.withId(id);
    }

    @Override
    public void insertSwitchingMachineRoute(SwitchingMachineRoute switchingMachineRoute) {
        update(SQL.get("insert_switching_machine_route"), stmt -> {
            stmt.setLong(1, switchingMachineRoute.routeId());
            stmt.setLong(2, switchingMachineRoute.switchingMachineId());
            stmt.setString(3, switchingMachineRoute.reverse().name());
        });
    }

    @Override
    public List<Lock> findLocks() {
        return query(SQL.get("select_locks"), stmt -> { }, JdbcInterlockingRegistry::mapLock);
    }

    @Override
    public List<Lock> findLocksByObject(long objectId) {
        List<Lock> locks = query(SQL.get("select_locks_by_object"), stmt -> stmt.setLong(1, objectId),
                JdbcInterlockingRegistry::mapLock);
        locks.sort(Comparator.comparing(Lock::type).thenComparingInt(Lock::routeLockGroup));
        return locks;
    }

    @Override
    public List<LockCondition> findLockConditions(long lockId) {
        return query(SQL.get("select_lock_conditions"), stmt -> stmt.setLong(1, lockId), rs -> new LockCondition(
                rs.getLong("id"), rs.getLong("lock_id"),
                LockConditionType.valueOf(rs.getString("condition_type")), getLongOrNull(rs, "parent_id")));
    }

    @Override
    public List<LockConditionObject> findLockConditionObjects(long lockId) {
        return query(SQL.get("select_lock_condition_objects"), stmt -> stmt.setLong(1, lockId),
                rs -> new LockConditionObject(
                        rs.getLong("id"), rs.getLong("lock_id"), rs.getLong("object_id"),
                        getLongOrNull(rs, "parent_id"), getIntegerOrNull(rs, "timer_seconds"),
                        NR.valueOf(rs.getString("is_reverse"))));
    }

    @Override
    public List<SwitchingMachineRoute> findSwitchingMachineRoutes() {
        return query(SQL.get("select_switching_machine_routes"), stmt -> { }, rs -> new SwitchingMachineRoute(
                rs.getLong("route_id"), rs.getLong("switching_machine_id"), NR.valueOf(rs.getString("is_reverse"))));
    }

    // ---------------------------------------------------------------- associations

    @Override
    public List<RouteLeverDestinationButton> findRouteLeverDestinationButtons() {
        return query(SQL.get("select_route_lever_destination_buttons"), stmt -> { },
                rs -> new RouteLeverDestinationButton(
                        rs.getLong("route_id"), rs.getLong("lever_id"), rs.getString("destination_button_name")));
    }

    @Override
    public void insertRouteLeverDestinationButton(RouteLeverDestinationButton association) {
        update(SQL.get("insert_route_lever_destination_button"), stmt -> {
            stmt.setLong(1, association.routeId());
            stmt.setLong(2, association.leverId());
            stmt.setString(3, association.destinationButtonName());
        });
    }

    @Override
    public List<SignalRoute> findSignalRoutes() {
        return query(SQL.get("select_signal_routes"), stmt -> { }, rs -> new SignalRoute(
                rs.getString("signal_name"), rs.getLong("route_id")));
    }

    @Override
    public void insertSignalRoute(SignalRoute signalRoute) {
        update(SQL.get("insert_signal_route"), stmt -> {
            stmt.setString(1, signalRoute.signalName());
            stmt.setLong(2, signalRoute.routeId());
        });
    }

    @Override
    public List<ThrowOutControl> findThrowOutControls() {
        return query(SQL.get("select_throw_out_controls"), stmt -> { }, rs -> new ThrowOutControl(
                rs.getLong("source_route_id"), rs.getLong("target_route_id")));
    }

    @Override
    public void insertThrowOutControl(ThrowOutControl throwOutControl) {
        update(SQL.get("insert_throw_out_control"), stmt -> {
            stmt.setLong(1, throwOutControl.sourceRouteId());
            stmt.setLong(2, throwOutControl.targetRouteId());
        });
    }

    @Override
    public List<RouteLockTrackCircuit> findRouteLockTrackCircuits() {
        return query(SQL.get("select_route_lock_track_circuits"), stmt -> { }, rs -> new RouteLockTrackCircuit(
                rs.getLong("route_id"), rs.getLong("track_circuit_id")));
    }

    @Override
    public void insertRouteLockTrackCircuit(RouteLockTrackCircuit routeLockTrackCircuit) {
        update(SQL.get("insert_route_lock_track_circuit"), stmt -> {
            stmt.setLong(1, routeLockTrackCircuit.routeId());
            stmt.setLong(2, routeLockTrackCircuit.trackCircuitId());
        });
    }

    @Override
    public List<OperationNotificationDisplay> findOperationNotificationDisplays() {
        return query(SQL.get("select_operation_notification_displays"), stmt -> { },
                rs -> new OperationNotificationDisplay(
                        rs.getString("name"), rs.getString("station_id"),
                        rs.getBoolean("is_up"), rs.getBoolean("is_down")));
    }

    @Override
    public void insertOperationNotificationDisplay(OperationNotificationDisplay display) {
        update(SQL.get("insert_operation_notification_display"), stmt -> {
            stmt.setString(1, display.name());
            stmt.setString(2, display.stationId());
            stmt.setBoolean(3, display.isUp());
            stmt.setBoolean(4, display.isDown());
        });
    }

    // ---------------------------------------------------------------- unit of work

    /**
     * Writes go straight to the connection, so every write is already visible to later
     * reads on this thread.
     */
    @Override
    public void flush() {
        logger.debug("Flush requested (transaction active: {})", transaction.get() != null);
    }

    @Override
    public void inTransaction(Runnable work) {
        if (transaction.get() != null) {
            work.run();
            return;
        }

        Connection conn;
        try {
            conn = dataSource.getConnection();
        } catch (SQLException e) {
            throw new RegistryException("Failed to begin transaction", e);
        }
        try {
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            close(conn);
            throw new RegistryException("Failed to begin transaction", e);
        }

        transaction.set(conn);
        try {
            work.run();
            conn.commit();
        } catch (SQLException e) {
            rollback(conn);
            throw new RegistryException("Failed to commit transaction", e);
        } catch (RuntimeException e) {
            rollback(conn);
            throw e;
        } finally {
            transaction.remove();
            close(conn);
        }
    }

    private static void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            logger.error("Failed to roll back transaction", e);
        }
    }

    private static void close(Connection conn) {
        try (conn) {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            logger.warn("Failed to release connection", e);
        }
    }

    // ---------------------------------------------------------------- JDBC helpers

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private <T> T execute(SqlWork<T> work, String description) {
        Connection current = transaction.get();
        try {
            if (current != null) {
                return work.run(current);
            }
            try (Connection conn = dataSource.getConnection()) {
                return work.run(conn);
            }
        } catch (SQLException e) {
            throw new RegistryException("Failed to " + description, e);
        }
    }

    private <T> List<T> query(String sql, Binder binder, RowMapper<T> mapper) {
        return execute(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                binder.bind(stmt);
                List<T> rows = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        rows.add(mapper.map(rs));
                    }
                }
                return rows;
            }
        }, "query: " + sql);
    }

    private static <T> Optional<T> queryOne(Connection conn, String sql, Binder binder, RowMapper<T> mapper)
            throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
            }
        }
    }

    private void update(String sql, Binder binder) {
        execute(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                binder.bind(stmt);
                return stmt.executeUpdate();
            }
        }, "update: " + sql);
    }

    private long insertReturningId(String sql, Binder binder) {
        return execute(conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                binder.bind(stmt);
                stmt.executeUpdate();
                return generatedKey(stmt);
            }
        }, "insert: " + sql);
    }

    private static long generatedKey(PreparedStatement stmt) throws SQLException {
        try (ResultSet keys = stmt.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No generated key returned");
            }
            return keys.getLong(1);
        }
    }

    // ---------------------------------------------------------------- mapping

    /**
     * Binds route_type through switching_machine_id.
     *
     * @return index of the next parameter
     */
    private static int bindTypeColumns(PreparedStatement stmt, int idx, InterlockingObject object)
            throws SQLException {
        Route route = object instanceof Route r ? r : null;
        Signal signal = object instanceof Signal s ? s : null;
        TrackCircuit trackCircuit = object instanceof TrackCircuit t ? t : null;
        Lever lever = object instanceof Lever l ? l : null;

        stmt.setString(idx++, route != null ? route.routeType().name() : null);
        stmt.setString(idx++, route != null ? route.indicator() : null);
        setIntegerOrNull(stmt, idx++, route != null ? route.approachLockTime() : null);
        stmt.setString(idx++, signal != null ? signal.typeName() : null);
        setLongOrNull(stmt, idx++, signal != null ? signal.trackCircuitId() : null);
        setIntegerOrNull(stmt, idx++, trackCircuit != null ? trackCircuit.protectionZone() : null);
        stmt.setString(idx++, trackCircuit != null ? trackCircuit.operationNotificationDisplayName() : null);
        stmt.setString(idx++, lever != null ? lever.leverType().name() : null);
        setLongOrNull(stmt, idx++, lever != null ? lever.switchingMachineId() : null);
        return idx;
    }

    private static InterlockingObject mapObject(ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        String name = rs.getString("name");
        String stationId = rs.getString("station_id");
        ObjectType type = ObjectType.valueOf(rs.getString("object_type"));

        return switch (type) {
            case ROUTE -> new Route(id, name, stationId,
                    RouteType.valueOf(rs.getString("route_type")),
                    rs.getString("indicator"),
                    getIntegerOrNull(rs, "approach_lock_time"));
            case SWITCHING_MACHINE -> new SwitchingMachine(id, name, stationId);
            case SIGNAL -> new Signal(id, name, stationId,
                    rs.getString("signal_type_name"),
                    getLongOrNull(rs, "track_circuit_id"));
            case TRACK_CIRCUIT -> new TrackCircuit(id, name, stationId,
                    rs.getInt("protection_zone"),
                    rs.getString("operation_notification_display_name"));
            case LEVER -> new Lever(id, name, stationId,
                    LeverType.valueOf(rs.getString("lever_type")),
                    getLongOrNull(rs, "switching_machine_id"));
            case DESTINATION_BUTTON -> new DestinationButton(id, name, stationId);
        };
    }

    private static Lock mapLock(ResultSet rs) throws SQLException {
        return new Lock(rs.getLong("id"), rs.getLong("object_id"),
                LockType.valueOf(rs.getString("lock_type")), rs.getInt("route_lock_group"));
    }

    private static void setIntegerOrNull(PreparedStatement stmt, int idx, Integer value) throws SQLException {
        if (value != null) {
            stmt.setInt(idx, value);
        } else {
            stmt.setNull(idx, Types.INTEGER);
        }
    }

    private static void setLongOrNull(PreparedStatement stmt, int idx, Long value) throws SQLException {
        if (value != null) {
            stmt.setLong(idx, value);
        } else {
            stmt.setNull(idx, Types.BIGINT);
        }
    }

    private static Integer getIntegerOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Long getLongOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
