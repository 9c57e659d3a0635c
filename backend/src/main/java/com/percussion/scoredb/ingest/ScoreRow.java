package com.percussion.scoredb.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One data row of a normalized score table, keyed by column name.
 * Values are raw cell text until the caption splitter replaces composite cells with numbers.
 */
public final class ScoreRow {

    private final Map<String, Object> values;

    public ScoreRow(Map<String, Object> values) {
        this.values = new LinkedHashMap<>(values);
    }

    public boolean has(String column) {
        return values.get(column) != null;
    }

    public Object get(String column) {
        return values.get(column);
    }

    public String text(String column) {
        Object v = values.get(column);
        return v == null ? null : v.toString();
    }

    /** Numeric value of the column, parsing text when needed; null when absent or non-numeric. */
    public Double decimal(String column) {
        Object v = values.get(column);
        if (v instanceof Number n) return n.doubleValue();
        if (v == null) return null;
        String s = v.toString().trim();
        if (s.isEmpty()) return null;
        try {
            return Double.valueOf(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public Integer integer(String column) {
        Object v = values.get(column);
        if (v instanceof Integer i) return i;
        if (v instanceof Number n) return n.intValue();
        if (v == null) return null;
        try {
            return Integer.valueOf(v.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
