package com.percussion.scoredb.dto;

import java.time.LocalDate;

public record ShowSummaryDTO(Long id, String name, LocalDate date, Integer season, Integer week,
                             String host, String city, String state, String sourceFile) {
}
