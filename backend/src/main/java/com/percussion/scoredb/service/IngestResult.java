package com.percussion.scoredb.service;

import java.time.LocalDate;

/**
 * Outcome of ingesting one score sheet.
 */
public record IngestResult(Long showId,
                           String showName,
                           LocalDate showDate,
                           int week,
                           int pages,
                           int performancesCreated,
                           long performancesReplaced) {
}
