package com.percussion.scoredb.service;

import com.percussion.scoredb.dto.CaptionWeightDTO;
import com.percussion.scoredb.model.CaptionWeight;
import com.percussion.scoredb.model.Season;
import com.percussion.scoredb.repository.CaptionWeightRepository;
import com.percussion.scoredb.repository.SeasonRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maintains the per-season caption weight table. Existing caption scores keep the weight
 * captured when their sheet was ingested.
 */
@Service
@Transactional(readOnly = true)
public class CaptionWeightService {

    private final SeasonRepository seasonRepository;
    private final CaptionWeightRepository captionWeightRepository;
    private final ReferenceDataResolver referenceData;

    public CaptionWeightService(SeasonRepository seasonRepository,
                                CaptionWeightRepository captionWeightRepository,
                                ReferenceDataResolver referenceData) {
        this.seasonRepository = seasonRepository;
        this.captionWeightRepository = captionWeightRepository;
        this.referenceData = referenceData;
    }

    public List<CaptionWeightDTO> list(int year) {
        return seasonRepository.findByYear(year)
                .map(s -> captionWeightRepository.findBySeasonIdOrderByCaptionAsc(s.getId()).stream()
                        .map(cw -> new CaptionWeightDTO(cw.getCaption(), cw.getWeight()))
                        .toList())
                .orElseGet(List::of);
    }

    /** Caption to weight for the season; captions without a row are absent. */
    public Map<String, Double> lookup(Long seasonId) {
        Map<String, Double> weights = new HashMap<>();
        for (CaptionWeight cw : captionWeightRepository.findBySeasonIdOrderByCaptionAsc(seasonId)) {
            weights.put(cw.getCaption(), cw.getWeight());
        }
        return weights;
    }

    @Transactional
    public List<CaptionWeightDTO> upsert(int year, List<CaptionWeightDTO> weights) {
        for (CaptionWeightDTO w : weights) {
            if (w.caption() == null || w.caption().isBlank()) {
                throw new IllegalArgumentException("caption is required");
            }
            if (w.weight() == null || w.weight() < 0 || w.weight() > 100) {
                throw new IllegalArgumentException("weight for '" + w.caption() + "' must be between 0 and 100");
            }
        }
        Season season = referenceData.season(year);
        for (CaptionWeightDTO w : weights) {
            String caption = w.caption().trim();
            CaptionWeight cw = captionWeightRepository.findBySeasonIdAndCaption(season.getId(), caption)
                    .orElseGet(() -> new CaptionWeight(season, caption, w.weight()));
            cw.setWeight(w.weight());
            captionWeightRepository.save(cw);
        }
        return list(year);
    }
}
