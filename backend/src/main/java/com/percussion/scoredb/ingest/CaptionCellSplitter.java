package com.percussion.scoredb.ingest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Replaces each composite caption column with four typed columns:
 * {@code <slug>_comp}, {@code <slug>_perf}, {@code <slug>_total} and {@code <slug>_place}.
 */
public final class CaptionCellSplitter {

    public static final List<String> CAPTIONS = List.of("Effect - Music", "Effect - Visual", "Music", "Visual");
    public static final String SUBTOTAL = "SubTotal";

    static final List<String> COMPOSITE_COLUMNS = List.of("Effect - Music", "Effect - Visual", "Music", "Visual", SUBTOTAL);

    public static final String COMP = "_comp";
    public static final String PERF = "_perf";
    public static final String TOTAL = "_total";
    public static final String PLACE = "_place";

    private CaptionCellSplitter() {}

    /** "Effect - Music" becomes "effectmusic". */
    public static String slug(String caption) {
        return caption.toLowerCase(Locale.ROOT).replace(" ", "").replace("-", "");
    }

    public static ScoreTable split(ScoreTable table) {
        List<String> present = COMPOSITE_COLUMNS.stream().filter(table::hasColumn).toList();
        if (present.isEmpty()) return table;

        List<String> columns = new ArrayList<>();
        for (String c : table.columns()) {
            if (!present.contains(c)) columns.add(c);
        }
        for (String c : present) {
            String slug = slug(c);
            columns.add(slug + COMP);
            columns.add(slug + PERF);
            columns.add(slug + TOTAL);
            columns.add(slug + PLACE);
        }

        List<ScoreRow> rows = new ArrayList<>(table.size());
        int rowNum = 0;
        for (ScoreRow row : table.rows()) {
            rowNum++;
            Map<String, Object> values = new LinkedHashMap<>(row.asMap());
            for (String c : present) {
                String slug = slug(c);
                CaptionCell cell;
                try {
                    cell = parseCell(row.text(c));
                } catch (CaptionCellParseException e) {
                    throw new CaptionCellParseException("Row " + rowNum + ", column '" + c + "': " + e.getMessage(), e);
                }
                values.remove(c);
                values.put(slug + COMP, cell == null ? null : cell.comp());
                values.put(slug + PERF, cell == null ? null : cell.perf());
                values.put(slug + TOTAL, cell == null ? null : cell.total());
                values.put(slug + PLACE, cell == null ? null : cell.place());
            }
            rows.add(new ScoreRow(values));
        }
        return new ScoreTable(columns, rows);
    }

    /**
     * Parses "comp\nperf\ntotal\nplace". A blank cell yields null; anything else
     * that does not carry four numeric lines is rejected.
     */
    public static CaptionCell parseCell(String text) {
        if (text == null || text.isBlank()) return null;
        String[] lines = text.strip().split("\\r?\\n");
        if (lines.length < 4) {
            throw new CaptionCellParseException("Expected 4 lines but found " + lines.length + " in '" + text + "'");
        }
        try {
            return new CaptionCell(
                    Double.parseDouble(lines[0].trim()),
                    Double.parseDouble(lines[1].trim()),
                    Double.parseDouble(lines[2].trim()),
                    Integer.parseInt(lines[3].trim()));
        } catch (NumberFormatException e) {
            throw new CaptionCellParseException("Non-numeric value in '" + text + "'", e);
        }
    }
}
