package com.percussion.scoredb.ingest;

/**
 * Base type for failures that abort the ingestion of a single score sheet.
 */
public class ScoreSheetException extends RuntimeException {
    public ScoreSheetException(String message) {
        super(message);
    }

    public ScoreSheetException(String message, Throwable cause) {
        super(message, cause);
    }
}
