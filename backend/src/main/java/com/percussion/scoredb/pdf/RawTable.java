package com.percussion.scoredb.pdf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered grid of optional text cells, exactly as the table detector saw it.
 */
public record RawTable(List<List<String>> cells) {

    public RawTable {
        List<List<String>> copy = new ArrayList<>(cells.size());
        for (List<String> row : cells) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        cells = Collections.unmodifiableList(copy);
    }

    public int rowCount() {
        return cells.size();
    }
}
