package com.percussion.scoredb.ingest;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens a raw table whose first two rows form a split header
 * (caption group on row 0, sub-metric on row 1) into a {@link ScoreTable}.
 */
public final class TableNormalizer {

    static final String BLANK = "BLANK";

    private TableNormalizer() {}

    public static ScoreTable normalize(List<List<String>> raw) {
        if (raw == null || raw.size() < 2) {
            throw new TableStructureException("Table needs two header rows, got " + (raw == null ? 0 : raw.size()));
        }
        List<String> header1 = raw.get(0);
        List<String> header2 = raw.get(1);
        if (header1.size() != header2.size()) {
            throw new TableStructureException("Header rows differ in width: " + header1.size() + " vs " + header2.size());
        }
        if (header1.size() < 2) {
            throw new TableStructureException("Table needs at least the group and home city columns");
        }

        List<String> columns = uniqueColumnNames(header1, header2);

        List<ScoreRow> rows = new ArrayList<>(raw.size() - 2);
        for (List<String> cells : raw.subList(2, raw.size())) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                values.put(columns.get(i), i < cells.size() ? cells.get(i) : null);
            }
            rows.add(new ScoreRow(values));
        }
        return new ScoreTable(columns, rows);
    }

    private static List<String> uniqueColumnNames(List<String> header1, List<String> header2) {
        Set<String> used = new HashSet<>();
        List<String> names = new ArrayList<>(header1.size());
        names.add(ScoreTable.GROUP);
        names.add(ScoreTable.HOME_CITY);
        used.addAll(names);
        for (int i = 2; i < header1.size(); i++) {
            String base = merge(header1.get(i), header2.get(i));
            String name = base;
            for (int n = 1; used.contains(name); n++) {
                name = base + "_" + n;
            }
            used.add(name);
            names.add(name);
        }
        return names;
    }

    private static String merge(String top, String bottom) {
        String a = top == null ? "" : top.trim();
        String b = bottom == null ? "" : bottom.trim();
        String merged = (a + " " + b).trim();
        return merged.isEmpty() ? BLANK : merged;
    }
}
