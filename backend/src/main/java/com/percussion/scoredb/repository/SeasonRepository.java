package com.percussion.scoredb.repository;

import com.percussion.scoredb.model.Season;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface SeasonRepository extends JpaRepository<Season, Long> {
    Optional<Season> findByYear(Integer year);

    List<Season> findAllByOrderByYearDesc();
}
