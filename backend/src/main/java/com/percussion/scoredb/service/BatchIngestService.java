package com.percussion.scoredb.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.percussion.scoredb.dto.BatchIngestSummary;
import com.percussion.scoredb.dto.ImportRunSummaryDTO;
import com.percussion.scoredb.model.ImportRun;
import com.percussion.scoredb.repository.ImportRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Drives {@link ScoreSheetIngestService} over a folder or an uploaded file. Files are handled
 * one at a time in name order; a failing file is logged, recorded and skipped.
 * <p>
 * Not transactional: each document commits or rolls back on its own, and {@link ImportRun}
 * rows are written outside the document transaction.
 */
@Service
public class BatchIngestService {

    private static final Logger log = LoggerFactory.getLogger(BatchIngestService.class);

    public static final String SOURCE_FOLDER = "FOLDER";
    public static final String SOURCE_UPLOAD = "UPLOAD";

    private final ScoreSheetIngestService ingestService;
    private final ImportRunRepository importRunRepository;
    private final ObjectMapper mapper;

    @Value("${scoredb.ingest.extension:.pdf}")
    private String extension = ".pdf";

    @Value("${scoredb.imports-dir:data/imports/scoresheets}")
    private String importsDir = "data/imports/scoresheets";

    public BatchIngestService(ScoreSheetIngestService ingestService,
                              ImportRunRepository importRunRepository,
                              ObjectMapper mapper) {
        this.ingestService = ingestService;
        this.importRunRepository = importRunRepository;
        this.mapper = mapper;
    }

    public BatchIngestSummary ingestFolder(Path folder) throws IOException {
        Objects.requireNonNull(folder, "folder must not be null");
        if (!Files.isDirectory(folder)) {
            throw new IllegalArgumentException("Not a directory: " + folder);
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(folder)) {
            String ext = extension.toLowerCase(Locale.ROOT);
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(ext))
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .toList();
        }
        log.info("[INGEST] {} score sheet(s) found in {}", files.size(), folder);

        List<ImportRunSummaryDTO> runs = new ArrayList<>(files.size());
        int ok = 0, failed = 0;
        for (Path file : files) {
            ImportRun run = ingestFile(file, SOURCE_FOLDER);
            if (ImportRun.COMPLETED.equals(run.getStatus())) ok++; else failed++;
            runs.add(ImportRunSummaryDTO.from(run));
        }
        log.info("[INGEST] Folder {} done: {} ok, {} failed", folder, ok, failed);
        return new BatchIngestSummary(folder.toString(), files.size(), ok, failed, runs);
    }

    /** Stores the upload under its original name, which is the show's identity key, then ingests it. */
    public ImportRun ingestUpload(MultipartFile file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        String original = file.getOriginalFilename();
        if (original == null || original.isBlank()) {
            throw new IllegalArgumentException("Uploaded file has no name");
        }
        Path namePart = Path.of(original).getFileName();
        String safeName = namePart == null ? "" : namePart.toString();
        if (safeName.equals(".") || safeName.equals("..")
                || !safeName.toLowerCase(Locale.ROOT).endsWith(extension.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Uploaded file must be a " + extension + " file: '" + original + "'");
        }
        Path baseDir = Path.of(importsDir);
        Files.createDirectories(baseDir);
        Path target = baseDir.resolve(safeName).normalize();
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return ingestFile(target, SOURCE_UPLOAD);
    }

    public ImportRun ingestFile(Path file, String sourceType) {
        String fileName = file.getFileName().toString();
        ImportRun run = new ImportRun();
        run.setFilename(fileName);
        run.setFilePath(file.toAbsolutePath().toString());
        run.setSourceType(sourceType);
        run.setCreatedBy("system");
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("sourceType", sourceType);
        params.put("extension", extension);
        run.setParams(toJson(params));
        run.setStartedAt(Instant.now());
        run.setStatus(ImportRun.IN_PROGRESS);
        run = importRunRepository.save(run);

        try {
            IngestResult result = ingestService.ingest(file);
            run.setShowId(result.showId());
            run.setPerformancesCreated(result.performancesCreated());
            run.setPerformancesReplaced((int) result.performancesReplaced());
            run.setStatus(ImportRun.COMPLETED);
        } catch (Exception e) {
            log.error("[INGEST][ERROR] {}: {}", fileName, e.getMessage());
            log.debug("[INGEST][ERROR] {} stack trace", fileName, e);
            run.setStatus(ImportRun.FAILED);
            run.setReason(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        run.setFinishedAt(Instant.now());
        return importRunRepository.save(run);
    }

    private String toJson(Map<String, Object> params) {
        try {
            return mapper.writeValueAsString(params);
        } catch (JsonProcessingException ex) {
            return "{}";
        }
    }
}
