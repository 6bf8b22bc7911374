package com.rendo.interlocking.compiler.table;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RowPreprocessorTest {

    private RowPreprocessor preprocessor;

    @BeforeEach
    void setUp() {
        preprocessor = new RowPreprocessor();
    }

    private static RendoTableRow row(String name, String start, String end, String approachTime, String approachLock) {
        RendoTableRow row = new RendoTableRow(name, start, end);
        row.setApproachTime(approachTime);
        row.setApproachLock(approachLock);
        return row;
    }

    @Test
    @DisplayName("Should fill blank and ditto names from the previous row")
    void shouldFillNames() {
        List<RendoTableRow> rows = List.of(
                row("上り場内信号機", "1R", "1", "", ""),
                row("", "1R", "2", "", ""),
                row("同上", "2R", "3", "", ""));

        preprocessor.preprocess(rows);

        assertThat(rows).extracting(RendoTableRow::getName)
                .containsExactly("上り場内信号機", "上り場内信号機", "上り場内信号機");
    }

    @Test
    @DisplayName("Should inherit the start lever from the previous row when blank")
    void shouldInheritStart() {
        List<RendoTableRow> rows = List.of(
                row("上り出発信号機", "3L", "5", "", ""),
                row("上り出発信号機", "", "6", "", ""));

        preprocessor.preprocess(rows);

        assertThat(rows.get(1).getStart()).isEqualTo("3L");
    }

    @Test
    @DisplayName("Should carry approach columns across rows sharing a start lever")
    void shouldCarryApproachColumns() {
        List<RendoTableRow> rows = List.of(
                row("下り場内信号機", "4R", "1", "90秒", "12T"),
                row("下り場内信号機", "4R", "2", "", ""),
                row("下り場内信号機", "", "3", "30秒", "14T"),
                row("下り場内信号機", "5R", "4", "", ""));

        preprocessor.preprocess(rows);

        assertThat(rows).extracting(RendoTableRow::getApproachTime)
                .containsExactly("90秒", "90秒", "90秒", "");
        assertThat(rows).extracting(RendoTableRow::getApproachLock)
                .containsExactly("12T", "12T", "12T", "");
    }

    @Test
    @DisplayName("Should leave an empty table untouched")
    void shouldAcceptEmptyTable() {
        List<RendoTableRow> rows = List.of();
        preprocessor.preprocess(rows);
        assertThat(rows).isEmpty();
    }
}
