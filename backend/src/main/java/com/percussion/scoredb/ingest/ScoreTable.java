package com.percussion.scoredb.ingest;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Rectangular table with unique column names. The first two columns are always
 * {@link #GROUP} and {@link #HOME_CITY}.
 */
public record ScoreTable(List<String> columns, List<ScoreRow> rows) {

    public static final String GROUP = "Group";
    public static final String HOME_CITY = "HomeCity";

    public ScoreTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public boolean hasColumn(String name) {
        return columns.contains(name);
    }

    public Optional<String> findColumnContaining(String fragment) {
        String needle = fragment.toLowerCase(Locale.ROOT);
        return columns.stream()
                .filter(c -> c.toLowerCase(Locale.ROOT).contains(needle))
                .findFirst();
    }

    public int size() {
        return rows.size();
    }
}
