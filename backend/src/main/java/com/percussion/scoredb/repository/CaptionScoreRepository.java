package com.percussion.scoredb.repository;

import com.percussion.scoredb.model.CaptionScore;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CaptionScoreRepository extends JpaRepository<CaptionScore, Long> {
    long countByPerformance_Show_Id(Long showId);
}
