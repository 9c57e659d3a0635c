package com.percussion.scoredb.pdf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds a table grid from positioned glyphs: glyphs are bucketed into lines, lines are cut
 * into text runs at wide gaps, and runs whose extents overlap across lines form columns.
 * Lines that carry nothing in the first column continue the previous data row, joined by
 * newlines, which is how stacked caption values end up in one cell.
 */
final class TextGridBuilder {

    static final int HEADER_ROWS = 2;
    private static final int MIN_TABLE_COLUMNS = 3;
    private static final float RUN_GAP_FACTOR = 2.5f;

    private final ExtractionProfile profile;

    TextGridBuilder(ExtractionProfile profile) {
        this.profile = profile;
    }

    Optional<RawTable> build(List<Glyph> glyphs) {
        List<List<Run>> lines = new ArrayList<>();
        for (List<Glyph> line : groupLines(glyphs)) {
            lines.add(cutRuns(line));
        }
        // page title lines above the table carry fewer runs than the table itself
        int start = 0;
        while (start < lines.size() && lines.get(start).size() < MIN_TABLE_COLUMNS) start++;
        List<List<Run>> tableLines = lines.subList(start, lines.size());
        if (tableLines.size() <= HEADER_ROWS) return Optional.empty();

        List<float[]> bands = columnBands(tableLines);
        if (bands.size() < 2) return Optional.empty();

        List<List<String>> grid = new ArrayList<>();
        for (int i = 0; i < tableLines.size(); i++) {
            String[] cells = place(tableLines.get(i), bands);
            boolean continuation = i >= HEADER_ROWS + 1 && cells[0] == null;
            if (continuation) {
                List<String> previous = grid.get(grid.size() - 1);
                for (int c = 0; c < cells.length; c++) {
                    if (cells[c] == null) continue;
                    String prior = previous.get(c);
                    previous.set(c, prior == null ? cells[c] : prior + "\n" + cells[c]);
                }
            } else {
                grid.add(new ArrayList<>(Arrays.asList(cells)));
            }
        }
        if (grid.size() <= HEADER_ROWS) return Optional.empty();
        return Optional.of(new RawTable(grid));
    }

    private List<List<Glyph>> groupLines(List<Glyph> glyphs) {
        List<Glyph> sorted = new ArrayList<>(glyphs);
        sorted.sort(Comparator.comparingDouble(Glyph::y).thenComparingDouble(Glyph::x));
        List<List<Glyph>> lines = new ArrayList<>();
        List<Glyph> current = null;
        float lineY = Float.NaN;
        for (Glyph g : sorted) {
            if (g.text() == null || g.text().isBlank()) continue;
            if (current == null || Math.abs(g.y() - lineY) > profile.rowTolerance()) {
                current = new ArrayList<>();
                lines.add(current);
                lineY = g.y();
            }
            current.add(g);
        }
        return lines;
    }

    private List<Run> cutRuns(List<Glyph> line) {
        List<Glyph> sorted = new ArrayList<>(line);
        sorted.sort(Comparator.comparingDouble(Glyph::x));
        float avgWidth = (float) sorted.stream().mapToDouble(Glyph::width).average().orElse(4.0);
        float runGap = Math.max(avgWidth * RUN_GAP_FACTOR, 1.0f);
        float spaceGap = avgWidth * 0.3f;

        List<Run> runs = new ArrayList<>();
        Run run = null;
        for (Glyph g : sorted) {
            if (run != null && g.x() - run.endX <= runGap) {
                if (g.x() - run.endX > spaceGap) run.text.append(' ');
                run.text.append(g.text());
                run.endX = Math.max(run.endX, g.endX());
            } else {
                run = new Run(g.x(), g.endX(), g.text());
                runs.add(run);
            }
        }
        return runs;
    }

    private List<float[]> columnBands(List<List<Run>> lines) {
        List<float[]> extents = new ArrayList<>();
        for (List<Run> line : lines) {
            for (Run r : line) extents.add(new float[]{r.startX, r.endX});
        }
        extents.sort(Comparator.comparingDouble(e -> e[0]));
        List<float[]> bands = new ArrayList<>();
        for (float[] e : extents) {
            float[] last = bands.isEmpty() ? null : bands.get(bands.size() - 1);
            if (last != null && e[0] <= last[1] + profile.edgeTolerance()) {
                last[1] = Math.max(last[1], e[1]);
            } else {
                bands.add(new float[]{e[0], e[1]});
            }
        }
        return bands;
    }

    private String[] place(List<Run> line, List<float[]> bands) {
        String[] cells = new String[bands.size()];
        for (Run r : line) {
            int idx = bandOf(r.startX, bands);
            String text = r.text.toString().trim();
            cells[idx] = cells[idx] == null ? text : cells[idx] + " " + text;
        }
        return cells;
    }

    private static int bandOf(float x, List<float[]> bands) {
        for (int i = bands.size() - 1; i >= 0; i--) {
            if (x >= bands.get(i)[0]) return i;
        }
        return 0;
    }

    private static final class Run {
        final float startX;
        float endX;
        final StringBuilder text;

        Run(float startX, float endX, String text) {
            this.startX = startX;
            this.endX = endX;
            this.text = new StringBuilder(text);
        }
    }
}
