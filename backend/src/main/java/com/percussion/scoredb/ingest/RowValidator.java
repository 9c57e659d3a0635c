package com.percussion.scoredb.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Drops rows that are not performances: repeated header rows, rows missing the group or
 * home city, and rows without a positive subtotal.
 */
public final class RowValidator {

    private static final Logger log = LoggerFactory.getLogger(RowValidator.class);

    public static final String SUBTOTAL_TOTAL = CaptionCellSplitter.slug(CaptionCellSplitter.SUBTOTAL) + CaptionCellSplitter.TOTAL;

    private RowValidator() {}

    public static List<ScoreRow> validRows(ScoreTable table) {
        return table.rows().stream().filter(RowValidator::isPerformance).toList();
    }

    public static boolean isPerformance(ScoreRow row) {
        String group = row.text(ScoreTable.GROUP);
        String homeCity = row.text(ScoreTable.HOME_CITY);
        if (group == null || group.isBlank() || homeCity == null || homeCity.isBlank()) {
            log.debug("[ROWS] Dropping row without group/home city: {}", row);
            return false;
        }
        if ("group".equals(group.trim().toLowerCase(Locale.ROOT))) {
            log.debug("[ROWS] Dropping repeated header row: {}", row);
            return false;
        }
        Double total = row.decimal(SUBTOTAL_TOTAL);
        if (total == null || total.isNaN() || total <= 0) {
            log.debug("[ROWS] Dropping row without positive subtotal: {}", row);
            return false;
        }
        return true;
    }
}
