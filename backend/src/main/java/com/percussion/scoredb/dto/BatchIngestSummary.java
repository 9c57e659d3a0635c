package com.percussion.scoredb.dto;

import java.util.List;

/**
 * Per-file outcomes of one folder ingestion, in processing order.
 */
public record BatchIngestSummary(String folder, int filesTotal, int filesSucceeded, int filesFailed,
                                 List<ImportRunSummaryDTO> runs) {
}
