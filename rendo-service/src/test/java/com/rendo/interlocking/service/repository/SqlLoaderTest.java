package com.rendo.interlocking.service.repository;

import com.rendo.interlocking.api.exceptions.RegistryException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlLoaderTest {

    @Test
    @DisplayName("Should load every named query without trailing semicolons")
    void shouldLoadNamedQueries() {
        Map<String, String> queries = SqlLoader.loadQueries("sql/queries.sql");

        assertThat(queries).hasSize(35);
        assertThat(queries).containsKeys("insert_object", "update_object", "select_locks_by_object",
                "insert_lock_condition_object", "select_operation_notification_displays");
        assertThat(queries.get("select_object_by_name"))
                .isEqualTo("SELECT * FROM interlocking_object WHERE name = ?");
        assertThat(queries.values()).noneMatch(sql -> sql.endsWith(";"));
    }

    @Test
    @DisplayName("Should join multi-line queries into one statement")
    void shouldJoinMultiLineQueries() {
        String insert = SqlLoader.loadQueries("sql/queries.sql").get("insert_object");

        assertThat(insert).startsWith("INSERT INTO interlocking_object (name, station_id, object_type,");
        assertThat(insert).doesNotContain("\n");
        assertThat(insert.chars().filter(c -> c == '?').count()).isEqualTo(12);
    }

    @Test
    @DisplayName("Should split the schema into statements without comments")
    void shouldLoadSchemaStatements() {
        List<String> statements = SqlLoader.loadSchema("sql/schema.sql");

        assertThat(statements).hasSize(19);
        assertThat(statements).allMatch(sql -> sql.startsWith("CREATE"));
        assertThat(statements.get(0)).startsWith("CREATE TABLE IF NOT EXISTS interlocking_object");
    }

    @Test
    @DisplayName("Should fail on a missing resource")
    void shouldFailOnMissingResource() {
        assertThatThrownBy(() -> SqlLoader.loadQueries("sql/missing.sql"))
                .isInstanceOf(RegistryException.class)
                .hasMessageContaining("sql/missing.sql");
    }
}
