package com.percussion.scoredb.service;

import com.percussion.scoredb.dto.CaptionScoreDTO;
import com.percussion.scoredb.dto.PerformanceResultDTO;
import com.percussion.scoredb.dto.ShowResultsDTO;
import com.percussion.scoredb.dto.ShowSummaryDTO;
import com.percussion.scoredb.ingest.CaptionCellSplitter;
import com.percussion.scoredb.model.CaptionScore;
import com.percussion.scoredb.model.HostLocation;
import com.percussion.scoredb.model.Performance;
import com.percussion.scoredb.model.Show;
import com.percussion.scoredb.repository.PerformanceRepository;
import com.percussion.scoredb.repository.ShowRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class ShowResultsService {

    private final ShowRepository showRepository;
    private final PerformanceRepository performanceRepository;
    private final CaptionWeightService captionWeightService;

    public ShowResultsService(ShowRepository showRepository,
                              PerformanceRepository performanceRepository,
                              CaptionWeightService captionWeightService) {
        this.showRepository = showRepository;
        this.performanceRepository = performanceRepository;
        this.captionWeightService = captionWeightService;
    }

    public List<ShowSummaryDTO> listShows(int year) {
        return showRepository.findBySeason_YearOrderByDateAscIdAsc(year).stream()
                .map(ShowResultsService::toSummary)
                .toList();
    }

    public Optional<ShowResultsDTO> results(Long showId) {
        return showRepository.findById(showId).map(show -> {
            Map<String, Double> weights = captionWeightService.lookup(show.getSeason().getId());
            List<PerformanceResultDTO> rows = new ArrayList<>();
            for (Performance p : performanceRepository.findResultsForShow(showId)) {
                rows.add(toResult(p, weights));
            }
            return new ShowResultsDTO(toSummary(show), rows);
        });
    }

    /** Writes one line per performance with the caption comp/perf/place columns flattened. */
    public boolean writeCsv(Long showId, Writer out) throws IOException {
        Optional<ShowResultsDTO> results = results(showId);
        if (results.isEmpty()) return false;

        List<String> header = new ArrayList<>(List.of("Group", "HomeCity", "Classification", "Block",
                "Total", "Place", "Penalty", "Weighted"));
        for (String caption : CaptionCellSplitter.CAPTIONS) {
            header.add(caption + " Comp");
            header.add(caption + " Perf");
            header.add(caption + " Place");
        }
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader(header.toArray(String[]::new))
                .build();
        CSVPrinter printer = new CSVPrinter(out, fmt);
        for (PerformanceResultDTO p : results.get().performances()) {
            List<Object> record = new ArrayList<>(List.of(
                    p.group(), nullToEmpty(p.homeCity()), nullToEmpty(p.classification()), nullToEmpty(p.block()),
                    nullToEmpty(p.totalScore()), nullToEmpty(p.placement()), nullToEmpty(p.penalty()),
                    String.format(Locale.ROOT, "%.3f", p.weightedScore())));
            for (String caption : CaptionCellSplitter.CAPTIONS) {
                Optional<CaptionScoreDTO> cs = p.captions().stream().filter(c -> caption.equals(c.caption())).findFirst();
                record.add(cs.map(CaptionScoreDTO::compScore).map(Object.class::cast).orElse(""));
                record.add(cs.map(CaptionScoreDTO::perfScore).map(Object.class::cast).orElse(""));
                record.add(cs.map(CaptionScoreDTO::placement).map(Object.class::cast).orElse(""));
            }
            printer.printRecord(record);
        }
        printer.flush();
        return true;
    }

    private static PerformanceResultDTO toResult(Performance p, Map<String, Double> weights) {
        List<CaptionScoreDTO> captions = new ArrayList<>();
        for (CaptionScore cs : p.getCaptionScores()) {
            captions.add(new CaptionScoreDTO(cs.getCaption(), cs.getWeight(), cs.getCompScore(), cs.getPerfScore(), cs.getPlacement()));
        }
        return new PerformanceResultDTO(
                p.getId(),
                p.getGroup().getName(),
                p.getGroup().getHomeCity(),
                p.getClassification() != null ? p.getClassification().getName() : null,
                p.getBlockNumber(),
                p.getTotalScore(),
                p.getPlacement(),
                p.getPenalty(),
                WeightedScoreCalculator.weightedScore(p.getCaptionScores(), weights),
                captions);
    }

    private static ShowSummaryDTO toSummary(Show show) {
        HostLocation host = show.getHost();
        return new ShowSummaryDTO(
                show.getId(),
                show.getName(),
                show.getDate(),
                show.getSeason().getYear(),
                show.getWeek(),
                host != null ? host.getName() : null,
                host != null ? host.getCity() : null,
                host != null ? host.getState() : null,
                show.getSourceFile());
    }

    private static Object nullToEmpty(Object value) {
        return value != null ? value : "";
    }
}
