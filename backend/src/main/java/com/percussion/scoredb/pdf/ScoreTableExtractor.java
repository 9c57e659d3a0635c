package com.percussion.scoredb.pdf;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Detects the score tables of one page and returns them as raw text grids.
 * Implementations are synchronous and may legitimately return no tables for a blank page.
 */
public interface ScoreTableExtractor {

    List<RawTable> extract(Path document, int pageIndex) throws IOException;
}
