package com.percussion.scoredb.repository;

import com.percussion.scoredb.model.Show;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ShowRepository extends JpaRepository<Show, Long> {
    Optional<Show> findBySourceFile(String sourceFile);

    List<Show> findBySeason_YearOrderByDateAscIdAsc(Integer year);

    // Shows of the season dated strictly before the given date, other than the sheet being re-ingested
    @Query("select count(s) from Show s where s.season.id = :seasonId and s.date < :date and s.sourceFile <> :sourceFile")
    long countEarlierInSeason(@Param("seasonId") Long seasonId,
                              @Param("date") LocalDate date,
                              @Param("sourceFile") String sourceFile);
}
