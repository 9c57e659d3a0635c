package com.percussion.scoredb.repository;

import com.percussion.scoredb.model.Performance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface PerformanceRepository extends JpaRepository<Performance, Long> {
    long countByShow_Id(Long showId);

    // Removes each performance through the entity manager so caption scores cascade
    long deleteByShow_Id(Long showId);

    @Query("select distinct p from Performance p join fetch p.group g left join fetch p.classification " +
            "left join fetch p.captionScores where p.show.id = :showId " +
            "order by p.blockNumber asc, p.placement asc, p.id asc")
    List<Performance> findResultsForShow(@Param("showId") Long showId);
}
