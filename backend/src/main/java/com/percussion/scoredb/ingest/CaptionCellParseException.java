package com.percussion.scoredb.ingest;

/**
 * A composite caption cell does not hold the comp / perf / total / place layout.
 */
public class CaptionCellParseException extends ScoreSheetException {
    public CaptionCellParseException(String message) {
        super(message);
    }

    public CaptionCellParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
