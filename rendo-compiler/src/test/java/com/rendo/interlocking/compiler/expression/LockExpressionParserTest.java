package com.rendo.interlocking.compiler.expression;

import com.rendo.interlocking.api.exceptions.MalformedExpressionException;
import com.rendo.interlocking.api.exceptions.MissingUpstreamDataException;
import com.rendo.interlocking.api.model.NR;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LockExpressionParserTest {

    private LockExpressionParser parser;

    @BeforeEach
    void setUp() {
        parser = new LockExpressionParser("TH65", List.of("TH66S", "TH64"));
    }

    private LockItem parseSingle(String expression) {
        List<LockItem> groups = parser.parse(expression, ParseMode.DEFAULT);
        assertThat(groups).hasSize(1);
        return groups.get(0);
    }

    @Test
    @DisplayName("Should parse a single name into a leaf")
    void shouldParseLeaf() {
        LockItem item = parseSingle("A");

        assertThat(item.isLeaf()).isTrue();
        assertThat(item.name()).isEqualTo("A");
        assertThat(item.stationId()).isEqualTo("TH65");
        assertThat(item.reverse()).isEqualTo(NR.NORMAL);
        assertThat(item.timerSeconds()).isNull();
    }

    @Test
    @DisplayName("Should group a sequence under an implicit AND")
    void shouldGroupSequence() {
        LockItem item = parseSingle("A B");

        assertThat(item.kind()).isEqualTo(LockItem.Kind.AND);
        assertThat(item.children()).extracting(LockItem::name).containsExactly("A", "B");
    }

    @Test
    @DisplayName("Should attach a timer to the preceding item")
    void shouldAttachTimer() {
        LockItem item = parseSingle("A 但 5秒");

        assertThat(item.isLeaf()).isTrue();
        assertThat(item.name()).isEqualTo("A");
        assertThat(item.timerSeconds()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should turn but into OR of left and NOT right")
    void shouldParseBut() {
        LockItem item = parseSingle("A 但 B");

        assertThat(item.kind()).isEqualTo(LockItem.Kind.OR);
        assertThat(item.children()).hasSize(2);
        assertThat(item.children().get(0).name()).isEqualTo("A");
        LockItem negated = item.children().get(1);
        assertThat(negated.kind()).isEqualTo(LockItem.Kind.NOT);
        assertThat(negated.children()).extracting(LockItem::name).containsExactly("B");
    }

    @Test
    @DisplayName("Should parse or into a flat OR")
    void shouldParseOr() {
        LockItem item = parseSingle("A 又は B");

        assertThat(item.kind()).isEqualTo(LockItem.Kind.OR);
        assertThat(item.children()).extracting(LockItem::name).containsExactly("A", "B");
    }

    @Test
    @DisplayName("Should flatten a nested OR on the right")
    void shouldFlattenNestedOr() {
        LockItem item = parseSingle("A 又は (B 又は C)");

        assertThat(item.kind()).isEqualTo(LockItem.Kind.OR);
        assertThat(item.children()).extracting(LockItem::name).containsExactly("A", "B", "C");
    }

    @Test
    @DisplayName("Should mark a parenthesised item reversed")
    void shouldReverseParenthesis() {
        LockItem item = parseSingle("21 (22)");

        assertThat(item.children()).extracting(LockItem::reverse)
                .containsExactly(NR.NORMAL, NR.REVERSED);
    }

    @Test
    @DisplayName("Should group braces without adding a node")
    void shouldFlattenBraces() {
        LockItem item = parseSingle("{A B} C");

        assertThat(item.kind()).isEqualTo(LockItem.Kind.AND);
        assertThat(item.children()).extracting(LockItem::name).containsExactly("A", "B", "C");
    }

    @Test
    @DisplayName("Should discard total control groups")
    void shouldDiscardTotalControl() {
        LockItem item = parseSingle("A ((B C))");

        assertThat(item.isLeaf()).isTrue();
        assertThat(item.name()).isEqualTo("A");
    }

    @Test
    @DisplayName("Should return one empty AND for a blank cell")
    void shouldParseEmpty() {
        LockItem item = parseSingle("");

        assertThat(item.kind()).isEqualTo(LockItem.Kind.AND);
        assertThat(item.children()).isEmpty();
    }

    @Test
    @DisplayName("Should resolve single brackets to the first adjacent station")
    void shouldUseFirstAdjacent() {
        LockItem item = parseSingle("[A]");

        assertThat(item.name()).isEqualTo("A");
        assertThat(item.stationId()).isEqualTo("TH66S");
    }

    @Test
    @DisplayName("Should resolve double brackets to the second adjacent station")
    void shouldUseSecondAdjacent() {
        LockItem item = parseSingle("[[A]]");

        assertThat(item.name()).isEqualTo("A");
        assertThat(item.stationId()).isEqualTo("TH64");
    }

    @Test
    @DisplayName("Should keep the reverse flag inside a station bracket")
    void shouldKeepReverseInsideBracket() {
        LockItem item = parseSingle("([31])");

        assertThat(item.stationId()).isEqualTo("TH66S");
        assertThat(item.reverse()).isEqualTo(NR.REVERSED);
    }

    @Test
    @DisplayName("Should fail when the adjacent slot does not exist")
    void shouldFailOnMissingSlot() {
        LockExpressionParser isolated = new LockExpressionParser("TH67", List.of());

        assertThatThrownBy(() -> isolated.parse("[A]", ParseMode.DEFAULT))
                .isInstanceOf(MissingUpstreamDataException.class)
                .hasMessageContaining("slot 1");
    }

    @Test
    @DisplayName("Should turn a parenthesised group into a reversed AND")
    void shouldParseGroup() {
        List<LockItem> groups = parser.parse("(A)", ParseMode.ROUTE_LOCK);

        assertThat(groups).hasSize(1);
        LockItem group = groups.get(0);
        assertThat(group.kind()).isEqualTo(LockItem.Kind.AND);
        assertThat(group.reverse()).isEqualTo(NR.REVERSED);
        assertThat(group.children()).hasSize(1);
        LockItem leaf = group.children().get(0);
        assertThat(leaf.name()).isEqualTo("A");
        assertThat(leaf.reverse()).isEqualTo(NR.NORMAL);
    }

    @Test
    @DisplayName("Should return one group per top-level item")
    void shouldReturnGroups() {
        List<LockItem> groups = parser.parse("(1T 2T) 3T", ParseMode.ROUTE_LOCK);

        assertThat(groups).hasSize(2);
        assertThat(groups.get(0).children()).extracting(LockItem::name).containsExactly("1T", "2T");
        assertThat(groups.get(1).name()).isEqualTo("3T");
    }

    @Test
    @DisplayName("Should return no groups for a blank cell")
    void shouldParseEmptyRouteLock() {
        assertThat(parser.parse("", ParseMode.ROUTE_LOCK)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a timer without a preceding item")
    void shouldRejectLeadingTimer() {
        assertThatThrownBy(() -> parser.parse("但 5秒", ParseMode.DEFAULT))
                .isInstanceOf(MalformedExpressionException.class)
                .hasMessageContaining("no preceding item");
    }

    @Test
    @DisplayName("Should reject a timer too large to represent")
    void shouldRejectOversizedTimer() {
        assertThatThrownBy(() -> parser.parse("A 但 99999999999秒", ParseMode.DEFAULT, "7R 接近鎖錠"))
                .isInstanceOfSatisfying(MalformedExpressionException.class, e -> {
                    assertThat(e.getStationId()).isEqualTo("TH65");
                    assertThat(e.getSubject()).isEqualTo("7R 接近鎖錠");
                })
                .hasMessageContaining("out of range");
    }

    @Test
    @DisplayName("Should reject an unterminated group")
    void shouldRejectUnterminated() {
        assertThatThrownBy(() -> parser.parse("{A B", ParseMode.DEFAULT))
                .isInstanceOf(MalformedExpressionException.class)
                .hasMessageContaining("Unterminated");
    }

    @Test
    @DisplayName("Should reject a stray closing bracket")
    void shouldRejectStrayClose() {
        assertThatThrownBy(() -> parser.parse("A }", ParseMode.DEFAULT))
                .isInstanceOf(MalformedExpressionException.class)
                .hasMessageContaining("Unmatched '}'");
    }

    @Test
    @DisplayName("Should reject mismatched closing brackets")
    void shouldRejectMismatch() {
        assertThatThrownBy(() -> parser.parse("[A]]", ParseMode.DEFAULT))
                .isInstanceOf(MalformedExpressionException.class)
                .hasMessageContaining("Expected ']'");
    }

    @Test
    @DisplayName("Should reject a reverse group holding several items")
    void shouldRejectWideReverseGroup() {
        assertThatThrownBy(() -> parser.parse("(A B)", ParseMode.DEFAULT))
                .isInstanceOf(MalformedExpressionException.class)
                .hasMessageContaining("exactly one item");
    }
}
