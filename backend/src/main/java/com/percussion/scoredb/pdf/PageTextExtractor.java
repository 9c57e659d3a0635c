package com.percussion.scoredb.pdf;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Plain text access to the pages of a score sheet document.
 */
public interface PageTextExtractor {

    int pageCount(Path document) throws IOException;

    /**
     * @param pageIndex zero-based page index
     * @return the page text, or an empty string when the page has none
     */
    String pageText(Path document, int pageIndex) throws IOException;
}
