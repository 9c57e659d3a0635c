package com.percussion.scoredb.controller;

import com.percussion.scoredb.dto.BatchIngestSummary;
import com.percussion.scoredb.dto.ImportRunSummaryDTO;
import com.percussion.scoredb.model.ImportRun;
import com.percussion.scoredb.repository.ImportRunRepository;
import com.percussion.scoredb.service.BatchIngestService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/imports")
public class ScoreSheetImportController {

    private final BatchIngestService batchIngestService;
    private final ImportRunRepository importRunRepository;

    public ScoreSheetImportController(BatchIngestService batchIngestService,
                                      ImportRunRepository importRunRepository) {
        this.batchIngestService = batchIngestService;
        this.importRunRepository = importRunRepository;
    }

    @PostMapping(value = "/scoresheets", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> upload(@RequestParam("file") MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("message", "file is required"));
        }
        ImportRun run = batchIngestService.ingestUpload(file);
        ImportRunSummaryDTO dto = ImportRunSummaryDTO.from(run);
        if (ImportRun.FAILED.equals(run.getStatus())) {
            return ResponseEntity.unprocessableEntity().body(dto);
        }
        return ResponseEntity.ok(dto);
    }

    @PostMapping("/folder")
    public BatchIngestSummary ingestFolder(@RequestParam("path") String path) throws IOException {
        return batchIngestService.ingestFolder(Path.of(path));
    }

    @GetMapping("/runs")
    public List<ImportRunSummaryDTO> listRuns(@RequestParam(value = "page", defaultValue = "0") int page,
                                              @RequestParam(value = "size", defaultValue = "20") int size) {
        Page<ImportRun> p = importRunRepository.findAllByOrderByStartedAtDesc(
                PageRequest.of(Math.max(0, page), Math.max(1, Math.min(size, 200))));
        return p.map(ImportRunSummaryDTO::from).getContent();
    }

    @GetMapping("/runs/{id}")
    public ResponseEntity<ImportRunSummaryDTO> getRun(@PathVariable("id") Long id) {
        return importRunRepository.findById(id)
                .map(ImportRunSummaryDTO::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("message", String.valueOf(ex.getMessage())));
    }
}
