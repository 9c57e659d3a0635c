package com.percussion.scoredb.ingest;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaptionCellSplitterTest {

    @Test
    void parsesFourLineCell() {
        CaptionCell cell = CaptionCellSplitter.parseCell("12.5\n11.0\n23.5\n3");

        assertThat(cell).isEqualTo(new CaptionCell(12.5, 11.0, 23.5, 3));
        assertThat(cell.format()).isEqualTo("12.5\n11.0\n23.5\n3");
        assertThat(CaptionCellSplitter.parseCell(cell.format())).isEqualTo(cell);
    }

    @Test
    void toleratesCarriageReturnsAndPadding() {
        assertThat(CaptionCellSplitter.parseCell(" 8.2 \r\n 7.9\r\n16.1\r\n 1 "))
                .isEqualTo(new CaptionCell(8.2, 7.9, 16.1, 1));
    }

    @Test
    void blankCellYieldsNull() {
        assertThat(CaptionCellSplitter.parseCell(null)).isNull();
        assertThat(CaptionCellSplitter.parseCell("  \n ")).isNull();
    }

    @Test
    void rejectsShortOrNonNumericCells() {
        assertThatThrownBy(() -> CaptionCellSplitter.parseCell("12.5\n11.0\n23.5"))
                .isInstanceOf(CaptionCellParseException.class)
                .hasMessageContaining("Expected 4 lines");
        assertThatThrownBy(() -> CaptionCellSplitter.parseCell("12.5\nabc\n23.5\n3"))
                .isInstanceOf(CaptionCellParseException.class)
                .hasMessageContaining("Non-numeric");
        assertThatThrownBy(() -> CaptionCellSplitter.parseCell("12.5\n11.0\n23.5\n3.5"))
                .isInstanceOf(CaptionCellParseException.class);
    }

    @Test
    void slugsCaptionNames() {
        assertThat(CaptionCellSplitter.slug("Effect - Music")).isEqualTo("effectmusic");
        assertThat(CaptionCellSplitter.slug("Effect - Visual")).isEqualTo("effectvisual");
        assertThat(CaptionCellSplitter.slug("SubTotal")).isEqualTo("subtotal");
    }

    @Test
    void replacesCompositeColumnsWithTypedColumns() {
        ScoreTable table = new ScoreTable(
                List.of("Group", "HomeCity", "Music", "SubTotal", "Penalty"),
                List.of(row("Arcadia HS", "Arcadia, CA", "10\n9.5\n19.5\n1", "40\n38\n78\n1", "0")));

        ScoreTable split = CaptionCellSplitter.split(table);

        assertThat(split.columns()).containsExactly(
                "Group", "HomeCity", "Penalty",
                "music_comp", "music_perf", "music_total", "music_place",
                "subtotal_comp", "subtotal_perf", "subtotal_total", "subtotal_place");
        ScoreRow row = split.rows().get(0);
        assertThat(row.decimal("music_comp")).isEqualTo(10.0);
        assertThat(row.decimal("music_perf")).isEqualTo(9.5);
        assertThat(row.integer("music_place")).isEqualTo(1);
        assertThat(row.decimal("subtotal_total")).isEqualTo(78.0);
        assertThat(row.has("Music")).isFalse();
    }

    @Test
    void tableWithoutCompositeColumnsIsReturnedUnchanged() {
        ScoreTable table = new ScoreTable(List.of("Group", "HomeCity"), List.of());

        assertThat(CaptionCellSplitter.split(table)).isSameAs(table);
    }

    @Test
    void malformedCellNamesRowAndColumn() {
        ScoreTable table = new ScoreTable(
                List.of("Group", "HomeCity", "Music", "SubTotal", "Penalty"),
                List.of(row("A", "B", "10\n9\n19\n1", "40\n38\n78\n1", "0"),
                        row("C", "D", "oops", "40\n38\n78\n2", "0")));

        assertThatThrownBy(() -> CaptionCellSplitter.split(table))
                .isInstanceOf(CaptionCellParseException.class)
                .hasMessageContaining("Row 2")
                .hasMessageContaining("'Music'");
    }

    private static ScoreRow row(String group, String city, String music, String subtotal, String penalty) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("Group", group);
        values.put("HomeCity", city);
        values.put("Music", music);
        values.put("SubTotal", subtotal);
        values.put("Penalty", penalty);
        return new ScoreRow(values);
    }
}
