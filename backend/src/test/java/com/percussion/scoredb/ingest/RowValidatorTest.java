package com.percussion.scoredb.ingest;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RowValidatorTest {

    @Test
    void keepsRowsWithGroupCityAndPositiveSubtotal() {
        assertThat(RowValidator.isPerformance(row("Arcadia HS", "Arcadia, CA", 78.0))).isTrue();
    }

    @Test
    void dropsRepeatedHeaderRows() {
        assertThat(RowValidator.isPerformance(row(" GROUP ", "Home City", 1.0))).isFalse();
    }

    @Test
    void dropsRowsMissingGroupOrCity() {
        assertThat(RowValidator.isPerformance(row(null, "Arcadia, CA", 78.0))).isFalse();
        assertThat(RowValidator.isPerformance(row("Arcadia HS", "  ", 78.0))).isFalse();
    }

    @Test
    void dropsRowsWithoutPositiveSubtotal() {
        assertThat(RowValidator.isPerformance(row("A", "B", null))).isFalse();
        assertThat(RowValidator.isPerformance(row("A", "B", 0.0))).isFalse();
        assertThat(RowValidator.isPerformance(row("A", "B", -3.0))).isFalse();
        assertThat(RowValidator.isPerformance(row("A", "B", Double.NaN))).isFalse();
    }

    @Test
    void validRowsKeepsOrder() {
        ScoreTable table = new ScoreTable(
                List.of("Group", "HomeCity", RowValidator.SUBTOTAL_TOTAL),
                List.of(row("First", "X", 70.0), row("Group", "Home City", 1.0), row("Second", "Y", 60.0)));

        assertThat(RowValidator.validRows(table))
                .extracting(r -> r.text("Group"))
                .containsExactly("First", "Second");
    }

    private static ScoreRow row(String group, String city, Double subtotal) {
        Map<String, Object> values = new HashMap<>();
        values.put("Group", group);
        values.put("HomeCity", city);
        values.put(RowValidator.SUBTOTAL_TOTAL, subtotal);
        return new ScoreRow(values);
    }
}
