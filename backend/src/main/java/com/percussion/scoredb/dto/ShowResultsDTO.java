package com.percussion.scoredb.dto;

import java.util.List;

public record ShowResultsDTO(ShowSummaryDTO show, List<PerformanceResultDTO> performances) {
}
