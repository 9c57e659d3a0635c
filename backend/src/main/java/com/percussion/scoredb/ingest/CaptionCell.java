package com.percussion.scoredb.ingest;

/**
 * The four values packed into one caption cell of a recap sheet.
 */
public record CaptionCell(double comp, double perf, double total, int place) {

    /** Inverse of {@link CaptionCellSplitter#parseCell(String)}. */
    public String format() {
        return comp + "\n" + perf + "\n" + total + "\n" + place;
    }
}
