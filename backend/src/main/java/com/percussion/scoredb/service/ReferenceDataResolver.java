package com.percussion.scoredb.service;

import com.percussion.scoredb.model.Classification;
import com.percussion.scoredb.model.Group;
import com.percussion.scoredb.model.HostLocation;
import com.percussion.scoredb.model.Season;
import com.percussion.scoredb.repository.ClassificationRepository;
import com.percussion.scoredb.repository.GroupRepository;
import com.percussion.scoredb.repository.HostLocationRepository;
import com.percussion.scoredb.repository.SeasonRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;

/**
 * Lookup-or-create of the reference entities by their natural keys. Runs inside the caller's
 * document transaction, so anything created here is rolled back with a failed sheet.
 */
@Service
@Transactional
public class ReferenceDataResolver {

    private final SeasonRepository seasonRepository;
    private final HostLocationRepository hostLocationRepository;
    private final ClassificationRepository classificationRepository;
    private final GroupRepository groupRepository;

    public ReferenceDataResolver(SeasonRepository seasonRepository,
                                 HostLocationRepository hostLocationRepository,
                                 ClassificationRepository classificationRepository,
                                 GroupRepository groupRepository) {
        this.seasonRepository = seasonRepository;
        this.hostLocationRepository = hostLocationRepository;
        this.classificationRepository = classificationRepository;
        this.groupRepository = groupRepository;
    }

    public Season season(int year) {
        return seasonRepository.findByYear(year)
                .orElseGet(() -> seasonRepository.save(new Season(year)));
    }

    public HostLocation host(String name, String city, String state) {
        Objects.requireNonNull(name, "host name is required");
        List<HostLocation> existing = hostLocationRepository.findByNaturalKey(name, city, state);
        if (!existing.isEmpty()) return existing.get(0);
        return hostLocationRepository.save(new HostLocation(name, city, state));
    }

    public Classification classification(String name) {
        return classificationRepository.findByName(name)
                .orElseGet(() -> classificationRepository.save(new Classification(name)));
    }

    /** Finds the group by (name, home city) and moves it to the given classification. */
    public Group group(String name, String homeCity, Classification classification) {
        Group group = groupRepository.findByNameAndHomeCity(name, homeCity)
                .orElseGet(() -> new Group(name, homeCity, classification));
        group.setClassification(classification);
        return groupRepository.save(group);
    }
}
