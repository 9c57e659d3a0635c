package com.percussion.scoredb.config;

import com.percussion.scoredb.dto.BatchIngestSummary;
import com.percussion.scoredb.service.BatchIngestService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.beans.factory.annotation.Value;

import java.nio.file.Path;

/**
 * Ingests every score sheet of {@code scoredb.ingest.folder} once at startup. Per-file failures
 * are logged and recorded as import runs; they do not affect startup.
 */
@Component
@ConditionalOnProperty(name = "scoredb.ingest.folder")
public class BatchIngestRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchIngestRunner.class);

    private final BatchIngestService batchIngestService;

    @Value("${scoredb.ingest.folder}")
    private String folder;

    public BatchIngestRunner(BatchIngestService batchIngestService) {
        this.batchIngestService = batchIngestService;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (folder == null || folder.isBlank()) return;
        log.info("[INGEST] Startup ingestion of folder '{}'", folder);
        BatchIngestSummary summary = batchIngestService.ingestFolder(Path.of(folder));
        log.info("[INGEST] Startup ingestion finished: {}/{} file(s) ingested", summary.filesSucceeded(), summary.filesTotal());
    }
}
