package com.percussion.scoredb.controller;

import com.percussion.scoredb.dto.ShowResultsDTO;
import com.percussion.scoredb.dto.ShowSummaryDTO;
import com.percussion.scoredb.service.ShowResultsService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

@RestController
@RequestMapping("/api/shows")
public class ShowController {

    private final ShowResultsService showResultsService;

    public ShowController(ShowResultsService showResultsService) {
        this.showResultsService = showResultsService;
    }

    @GetMapping
    public List<ShowSummaryDTO> list(@RequestParam("year") int year) {
        return showResultsService.listShows(year);
    }

    @GetMapping("/{id}/results")
    public ResponseEntity<ShowResultsDTO> results(@PathVariable("id") Long id) {
        return showResultsService.results(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/{id}/results.csv", produces = "text/csv")
    public ResponseEntity<String> resultsCsv(@PathVariable("id") Long id) throws IOException {
        StringWriter out = new StringWriter();
        if (!showResultsService.writeCsv(id, out)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"show-" + id + "-results.csv\"")
                .body(out.toString());
    }
}
