package com.percussion.scoredb.controller;

import com.percussion.scoredb.dto.CaptionWeightDTO;
import com.percussion.scoredb.service.CaptionWeightService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/seasons/{year}/caption-weights")
public class SeasonController {

    private final CaptionWeightService captionWeightService;

    public SeasonController(CaptionWeightService captionWeightService) {
        this.captionWeightService = captionWeightService;
    }

    @GetMapping
    public List<CaptionWeightDTO> list(@PathVariable("year") int year) {
        return captionWeightService.list(year);
    }

    @PutMapping
    public ResponseEntity<?> upsert(@PathVariable("year") int year, @RequestBody List<CaptionWeightDTO> weights) {
        if (weights == null || weights.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("message", "at least one caption weight is required"));
        }
        try {
            return ResponseEntity.ok(captionWeightService.upsert(year, weights));
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.badRequest().body(Map.of("message", ex.getMessage()));
        }
    }
}
