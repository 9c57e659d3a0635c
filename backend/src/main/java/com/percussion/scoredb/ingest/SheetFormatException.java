package com.percussion.scoredb.ingest;

/**
 * Neither the sheet header nor the file name yields the show identity fields.
 */
public class SheetFormatException extends ScoreSheetException {
    public SheetFormatException(String message) {
        super(message);
    }

    public SheetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
