package com.rendo.interlocking.service.repository;

import com.rendo.interlocking.api.exceptions.RegistryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcInterlockingRegistryConnectionTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    private JdbcInterlockingRegistry registry;

    @BeforeEach
    void setUp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        registry = new JdbcInterlockingRegistry(dataSource);
    }

    @Test
    @DisplayName("Should close the connection when a transaction cannot be started")
    void shouldCloseConnectionWhenBeginFails() throws SQLException {
        doThrow(new SQLException("read-only")).when(connection).setAutoCommit(false);
        AtomicBoolean ran = new AtomicBoolean();

        assertThatThrownBy(() -> registry.inTransaction(() -> ran.set(true)))
                .isInstanceOf(RegistryException.class)
                .hasMessageContaining("Failed to begin transaction");

        assertThat(ran).isFalse();
        verify(connection).close();
        verify(connection, never()).commit();
    }

    @Test
    @DisplayName("Should roll back and close the connection when commit fails")
    void shouldRollBackAndCloseWhenCommitFails() throws SQLException {
        doThrow(new SQLException("lost")).when(connection).commit();

        assertThatThrownBy(() -> registry.inTransaction(() -> { }))
                .isInstanceOf(RegistryException.class)
                .hasMessageContaining("Failed to commit transaction");

        verify(connection).rollback();
        verify(connection).close();
    }

    @Test
    @DisplayName("Should close the connection when the transaction work throws")
    void shouldCloseConnectionWhenWorkThrows() throws SQLException {
        assertThatThrownBy(() -> registry.inTransaction(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        verify(connection).rollback();
        verify(connection, never()).commit();
        verify(connection).close();
    }
}
