package com.percussion.scoredb.service;

import com.percussion.scoredb.ingest.CaptionCellSplitter;
import com.percussion.scoredb.ingest.ClassificationBlock;
import com.percussion.scoredb.ingest.ClassificationBlockSplitter;
import com.percussion.scoredb.ingest.FilenameIdentity;
import com.percussion.scoredb.ingest.FilenameIdentityParser;
import com.percussion.scoredb.ingest.HeaderScanner;
import com.percussion.scoredb.ingest.RowValidator;
import com.percussion.scoredb.ingest.ScoreRow;
import com.percussion.scoredb.ingest.ScoreTable;
import com.percussion.scoredb.ingest.SheetFormatException;
import com.percussion.scoredb.ingest.SheetHeader;
import com.percussion.scoredb.ingest.TableNormalizer;
import com.percussion.scoredb.model.*;
import com.percussion.scoredb.pdf.PageTextExtractor;
import com.percussion.scoredb.pdf.RawTable;
import com.percussion.scoredb.pdf.ScoreTableExtractor;
import com.percussion.scoredb.repository.PerformanceRepository;
import com.percussion.scoredb.repository.ShowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.percussion.scoredb.ingest.CaptionCellSplitter.COMP;
import static com.percussion.scoredb.ingest.CaptionCellSplitter.PERF;
import static com.percussion.scoredb.ingest.CaptionCellSplitter.PLACE;
import static com.percussion.scoredb.ingest.CaptionCellSplitter.TOTAL;

/**
 * Ingests one score sheet document: resolves the show, replaces its performances and writes
 * the caption breakdown of every valid table row. Each call is one transaction; any failure
 * leaves the database exactly as it was before the call.
 */
@Service
public class ScoreSheetIngestService {

    private static final Logger log = LoggerFactory.getLogger(ScoreSheetIngestService.class);

    private static final String SUBTOTAL = CaptionCellSplitter.slug(CaptionCellSplitter.SUBTOTAL);

    private final PageTextExtractor pageTextExtractor;
    private final ScoreTableExtractor tableExtractor;
    private final ReferenceDataResolver referenceData;
    private final ShowRepository showRepository;
    private final PerformanceRepository performanceRepository;
    private final CaptionWeightService captionWeightService;

    @Value("${scoredb.ingest.unknown-classification:Unknown}")
    private String unknownClassification = ClassificationBlockSplitter.UNKNOWN;

    public ScoreSheetIngestService(PageTextExtractor pageTextExtractor,
                                   ScoreTableExtractor tableExtractor,
                                   ReferenceDataResolver referenceData,
                                   ShowRepository showRepository,
                                   PerformanceRepository performanceRepository,
                                   CaptionWeightService captionWeightService) {
        this.pageTextExtractor = pageTextExtractor;
        this.tableExtractor = tableExtractor;
        this.referenceData = referenceData;
        this.showRepository = showRepository;
        this.performanceRepository = performanceRepository;
        this.captionWeightService = captionWeightService;
    }

    private record ShowIdentity(String name, LocalDate date, String hostName, String city, String state) {}

    @Transactional(rollbackFor = Exception.class)
    public IngestResult ingest(Path document) throws IOException {
        String fileName = document.getFileName().toString();
        String firstPageText = pageTextExtractor.pageText(document, 0);
        ShowIdentity identity = resolveIdentity(firstPageText, fileName);

        Season season = referenceData.season(identity.date().getYear());
        HostLocation host = referenceData.host(identity.hostName(), identity.city(), identity.state());
        int week = (int) showRepository.countEarlierInSeason(season.getId(), identity.date(), fileName) + 1;

        Show show = showRepository.findBySourceFile(fileName).orElseGet(() -> new Show(fileName));
        boolean existing = show.getId() != null;
        show.setName(identity.name());
        show.setDate(identity.date());
        show.setSeason(season);
        show.setHost(host);
        show.setWeek(week);
        show = showRepository.save(show);

        long replaced = 0;
        if (existing) {
            replaced = performanceRepository.deleteByShow_Id(show.getId());
            performanceRepository.flush();
        }

        Map<String, Double> weights = captionWeightService.lookup(season.getId());

        int pages = pageTextExtractor.pageCount(document);
        int created = 0;
        for (int page = 0; page < pages; page++) {
            String text = page == 0 ? firstPageText : pageTextExtractor.pageText(document, page);
            String classText = HeaderScanner.scan(text).getClassificationText().orElse(null);
            ClassificationBlock context = ClassificationBlockSplitter.split(classText, unknownClassification);
            Classification classification = null;

            List<RawTable> tables = tableExtractor.extract(document, page);
            log.debug("[INGEST] {} page {}: {} table(s), classification='{}', block={}",
                    fileName, page, tables.size(), context.label(), context.block());
            for (RawTable raw : tables) {
                ScoreTable table = CaptionCellSplitter.split(TableNormalizer.normalize(raw.cells()));
                Optional<String> penaltyColumn = table.findColumnContaining("penalty");
                List<String> captions = CaptionCellSplitter.CAPTIONS.stream()
                        .filter(c -> table.hasColumn(CaptionCellSplitter.slug(c) + COMP))
                        .toList();
                for (ScoreRow row : RowValidator.validRows(table)) {
                    if (classification == null) classification = referenceData.classification(context.label());
                    createPerformance(show, row, classification, context.block(), captions, penaltyColumn, weights);
                    created++;
                }
            }
        }

        log.info("[INGEST] {} -> show '{}' ({}), week {}, {} performance(s) created, {} replaced",
                fileName, show.getName(), show.getDate(), week, created, replaced);
        return new IngestResult(show.getId(), show.getName(), show.getDate(), week, pages, created, replaced);
    }

    private void createPerformance(Show show,
                                   ScoreRow row,
                                   Classification classification,
                                   Integer block,
                                   List<String> captions,
                                   Optional<String> penaltyColumn,
                                   Map<String, Double> weights) {
        Group group = referenceData.group(row.text(ScoreTable.GROUP).trim(), row.text(ScoreTable.HOME_CITY).trim(), classification);

        Performance perf = new Performance();
        perf.setShow(show);
        perf.setGroup(group);
        perf.setClassification(classification);
        perf.setBlockNumber(block);
        perf.setTotalScore(row.decimal(SUBTOTAL + TOTAL));
        perf.setPlacement(row.integer(SUBTOTAL + PLACE));
        Double penalty = penaltyColumn.map(row::decimal).orElse(null);
        perf.setPenalty(penalty != null ? penalty : 0.0);

        for (String caption : captions) {
            String slug = CaptionCellSplitter.slug(caption);
            perf.addCaptionScore(new CaptionScore(
                    caption,
                    weights.getOrDefault(caption, 0.0),
                    orZero(row.decimal(slug + COMP)),
                    orZero(row.decimal(slug + PERF)),
                    row.integer(slug + PLACE)));
        }
        performanceRepository.save(perf);
    }

    private ShowIdentity resolveIdentity(String firstPageText, String fileName) {
        SheetHeader header = HeaderScanner.scan(firstPageText);
        String name = header.getShowName().orElse(null);
        LocalDate date = header.getShowDate().orElse(null);

        FilenameIdentity fallback = null;
        if (name == null || date == null) {
            log.debug("[INGEST] Header of {} incomplete ({}), using file name", fileName, header);
            fallback = FilenameIdentityParser.parse(fileName);
            if (name == null) name = fallback.showName();
            if (date == null) date = fallback.showDate();
        }

        String city = header.getLocationCity().orElse(null);
        String state = header.getLocationState().orElse(null);
        if (city == null) {
            if (fallback == null) fallback = tryParseFileName(fileName);
            if (fallback != null) {
                city = fallback.city();
                state = fallback.state();
            }
        }
        return new ShowIdentity(name, date, hostName(name), city, state);
    }

    private static FilenameIdentity tryParseFileName(String fileName) {
        try {
            return FilenameIdentityParser.parse(fileName);
        } catch (SheetFormatException e) {
            log.debug("[INGEST] No host location in header or file name of {}: {}", fileName, e.getMessage());
            return null;
        }
    }

    /** "Arcadia HS Saturday" hosts as "Arcadia HS". */
    static String hostName(String showName) {
        String trimmed = showName.trim();
        int lastSpace = trimmed.lastIndexOf(' ');
        if (lastSpace > 0 && FilenameIdentityParser.WEEKDAYS.contains(trimmed.substring(lastSpace + 1).toLowerCase(Locale.ROOT))) {
            return trimmed.substring(0, lastSpace).trim();
        }
        return trimmed;
    }

    private static Double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
