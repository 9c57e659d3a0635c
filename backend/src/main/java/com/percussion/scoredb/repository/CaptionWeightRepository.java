package com.percussion.scoredb.repository;

import com.percussion.scoredb.model.CaptionWeight;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CaptionWeightRepository extends JpaRepository<CaptionWeight, Long> {
    List<CaptionWeight> findBySeasonIdOrderByCaptionAsc(Long seasonId);

    Optional<CaptionWeight> findBySeasonIdAndCaption(Long seasonId, String caption);
}
