package com.percussion.scoredb.dto;

import java.util.List;

public record PerformanceResultDTO(Long id,
                                   String group,
                                   String homeCity,
                                   String classification,
                                   Integer block,
                                   Double totalScore,
                                   Integer placement,
                                   Double penalty,
                                   Double weightedScore,
                                   List<CaptionScoreDTO> captions) {
}
