package com.rendo.interlocking.compiler.io;

import com.rendo.interlocking.compiler.table.RendoTableRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvReadersTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should read station table rows positionally and skip the header")
    void shouldReadStationTable() throws IOException {
        Path file = tempDir.resolve("TH70.csv");
        Files.writeString(file, "名称,てこ,着点,表示,接近時素,接近鎖錠,鎖錠転てつ器,鎖錠,信号制御,進路鎖錠,備考\n"
                + "上り出発信号機,1R,1,Y,60秒,12T,21 (22),,1RT 但 30秒,(1RT),memo\n"
                + "\n"
                + ",,2,,,,,,,\n");

        List<RendoTableRow> rows = new RendoTableReader().read(file);

        assertThat(rows).hasSize(2);
        RendoTableRow first = rows.get(0);
        assertThat(first.getName()).isEqualTo("上り出発信号機");
        assertThat(first.getIndicator()).isEqualTo("Y");
        assertThat(first.getLockToSwitchingMachine()).isEqualTo("21 (22)");
        assertThat(first.getSignalControl()).isEqualTo("1RT 但 30秒");
        assertThat(first.getRouteLock()).isEqualTo("(1RT)");
        assertThat(rows.get(1).getName()).isEmpty();
        assertThat(rows.get(1).getEnd()).isEqualTo("2");
    }

    @Test
    @DisplayName("Should read auxiliary rows with a variable number of track circuits")
    void shouldReadAuxiliaryFiles() throws IOException {
        Path displays = tempDir.resolve("運転告知器.csv");
        Files.writeString(displays, "名前,駅,上り,下り,軌道回路\n"
                + "浜園告知器,TH70,1,0,TH70_1RT,TH70_2RT\n"
                + "津崎告知器,TH71,false,true\n");
        Path routes = tempDir.resolve("進路.csv");
        Files.writeString(routes, "進路,軌道回路\nTH70_1R1,TH70_1RT, TH70_21T \n");

        AuxiliaryCsvReader reader = new AuxiliaryCsvReader();
        List<AuxiliaryCsvReader.OperationNotificationDisplayRow> displayRows =
                reader.readOperationNotificationDisplays(displays);
        List<AuxiliaryCsvReader.RouteTrackCircuitRow> routeRows = reader.readRouteTrackCircuits(routes);

        assertThat(displayRows).containsExactly(
                new AuxiliaryCsvReader.OperationNotificationDisplayRow(
                        "浜園告知器", "TH70", true, false, List.of("TH70_1RT", "TH70_2RT")),
                new AuxiliaryCsvReader.OperationNotificationDisplayRow(
                        "津崎告知器", "TH71", false, true, List.of()));
        assertThat(routeRows).containsExactly(
                new AuxiliaryCsvReader.RouteTrackCircuitRow("TH70_1R1", List.of("TH70_1RT", "TH70_21T")));
    }
}
