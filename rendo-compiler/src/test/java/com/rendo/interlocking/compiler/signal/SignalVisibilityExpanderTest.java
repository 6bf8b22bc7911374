package com.rendo.interlocking.compiler.signal;

import com.rendo.interlocking.api.model.NextSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SignalVisibilityExpanderTest {

    private SignalVisibilityExpander expander;

    @BeforeEach
    void setUp() {
        expander = new SignalVisibilityExpander();
    }

    private static Map<String, List<String>> edges(Object... pairs) {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<String> targets = (List<String>) pairs[i + 1];
            edges.put((String) pairs[i], targets);
        }
        return edges;
    }

    @Test
    @DisplayName("Should add a depth 2 row through the intermediate signal")
    void shouldExpandChain() {
        List<NextSignal> rows = expander.expand(
                List.of("X", "Y", "Z"),
                edges("X", List.of("Y"), "Y", List.of("Z")),
                List.of());

        assertThat(rows).containsExactly(
                new NextSignal("X", "X", "Y", 1),
                new NextSignal("Y", "Y", "Z", 1),
                new NextSignal("X", "Y", "Z", 2));
    }

    @Test
    @DisplayName("Should not add a deeper row for a pair already visible at depth 1")
    void shouldKeepShallowestDepth() {
        List<NextSignal> rows = expander.expand(
                List.of("X", "Y", "Z"),
                edges("X", List.of("Y", "Z"), "Y", List.of("Z")),
                List.of());

        assertThat(rows).filteredOn(r -> r.signalName().equals("X") && r.targetSignalName().equals("Z"))
                .singleElement()
                .extracting(NextSignal::depth)
                .isEqualTo(1);
    }

    @Test
    @DisplayName("Should stop at the maximum depth")
    void shouldStopAtMaxDepth() {
        List<NextSignal> rows = expander.expand(
                List.of("A", "B", "C", "D", "E", "F"),
                edges("A", List.of("B"), "B", List.of("C"), "C", List.of("D"),
                        "D", List.of("E"), "E", List.of("F")),
                List.of());

        List<NextSignal> fromA = rows.stream().filter(r -> r.signalName().equals("A")).toList();
        assertThat(fromA).extracting(NextSignal::targetSignalName).containsExactly("B", "C", "D", "E");
        assertThat(fromA).extracting(NextSignal::depth).containsExactly(1, 2, 3, 4);
        assertThat(fromA.get(3).sourceSignalName()).isEqualTo("D");
    }

    @Test
    @DisplayName("Should return nothing when every row already exists")
    void shouldBeIdempotent() {
        Map<String, List<String>> direct = edges("X", List.of("Y"), "Y", List.of("Z"));
        List<NextSignal> first = expander.expand(List.of("X", "Y", "Z"), direct, List.of());

        List<NextSignal> second = expander.expand(List.of("X", "Y", "Z"), direct, first);

        assertThat(second).isEmpty();
    }

    @Test
    @DisplayName("Should not create duplicate rows for repeated targets")
    void shouldDeduplicate() {
        List<NextSignal> rows = expander.expand(
                List.of("X", "Y"),
                edges("X", List.of("Y", "Y")),
                List.of());

        assertThat(rows).containsExactly(new NextSignal("X", "X", "Y", 1));
    }
}
