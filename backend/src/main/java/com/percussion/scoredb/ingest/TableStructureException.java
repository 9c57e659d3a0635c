package com.percussion.scoredb.ingest;

/**
 * Raw table geometry is inconsistent, e.g. the two header rows differ in width.
 */
public class TableStructureException extends ScoreSheetException {
    public TableStructureException(String message) {
        super(message);
    }
}
