package com.percussion.scoredb.repository;

import com.percussion.scoredb.model.HostLocation;
import com.percussion.scoredb.model.Season;
import com.percussion.scoredb.model.Show;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class ShowRepositoryTest {

    @Autowired private ShowRepository showRepository;
    @Autowired private SeasonRepository seasonRepository;
    @Autowired private HostLocationRepository hostLocationRepository;

    private Show show(Season season, String file, LocalDate date) {
        Show s = new Show(file);
        s.setName(file);
        s.setDate(date);
        s.setSeason(season);
        s.setWeek(1);
        return showRepository.save(s);
    }

    @Test
    void countEarlierInSeason_excludesSameSheetLaterDatesAndOtherSeasons() {
        Season s2024 = seasonRepository.save(new Season(2024));
        Season s2025 = seasonRepository.save(new Season(2025));
        show(s2024, "a.pdf", LocalDate.of(2024, 9, 7));
        show(s2024, "b.pdf", LocalDate.of(2024, 9, 14));
        show(s2024, "c.pdf", LocalDate.of(2024, 9, 14));
        show(s2024, "d.pdf", LocalDate.of(2024, 9, 21));
        show(s2025, "e.pdf", LocalDate.of(2024, 9, 1));

        assertThat(showRepository.countEarlierInSeason(s2024.getId(), LocalDate.of(2024, 9, 21), "d.pdf")).isEqualTo(3);
        assertThat(showRepository.countEarlierInSeason(s2024.getId(), LocalDate.of(2024, 9, 14), "b.pdf")).isEqualTo(1);
        assertThat(showRepository.countEarlierInSeason(s2024.getId(), LocalDate.of(2024, 9, 28), "a.pdf")).isEqualTo(3);
        assertThat(showRepository.countEarlierInSeason(s2024.getId(), LocalDate.of(2024, 9, 7), "new.pdf")).isZero();
    }

    @Test
    void findBySeasonYear_ordersByDate() {
        Season season = seasonRepository.save(new Season(2024));
        show(season, "late.pdf", LocalDate.of(2024, 10, 5));
        show(season, "early.pdf", LocalDate.of(2024, 9, 7));

        assertThat(showRepository.findBySeason_YearOrderByDateAscIdAsc(2024))
                .extracting(Show::getSourceFile)
                .containsExactly("early.pdf", "late.pdf");
        assertThat(showRepository.findBySourceFile("late.pdf")).isPresent();
    }

    @Test
    void hostNaturalKey_matchesNullCityOnlyAgainstNull() {
        hostLocationRepository.save(new HostLocation("Arcadia HS", "Arcadia", "CA"));
        hostLocationRepository.save(new HostLocation("Arcadia HS", null, null));

        assertThat(hostLocationRepository.findByNaturalKey("Arcadia HS", "Arcadia", "CA"))
                .singleElement()
                .extracting(HostLocation::getCity).isEqualTo("Arcadia");
        assertThat(hostLocationRepository.findByNaturalKey("Arcadia HS", null, null))
                .singleElement()
                .extracting(HostLocation::getCity).isNull();
        assertThat(hostLocationRepository.findByNaturalKey("arcadia hs", "Arcadia", "CA")).isEmpty();
    }
}
