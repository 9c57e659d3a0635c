package com.percussion.scoredb.dto;

import com.percussion.scoredb.model.ImportRun;

import java.time.Instant;

public class ImportRunSummaryDTO {
    private Long id;
    private String status;
    private String filename;
    private String sourceType;
    private Long showId;
    private Integer performancesCreated;
    private Integer performancesReplaced;
    private String reason;
    private String createdBy;
    private Instant startedAt;
    private Instant finishedAt;

    public ImportRunSummaryDTO() {}

    public ImportRunSummaryDTO(Long id, String status, String filename, String sourceType, Long showId,
                               Integer performancesCreated, Integer performancesReplaced, String reason,
                               String createdBy, Instant startedAt, Instant finishedAt) {
        this.id = id;
        this.status = status;
        this.filename = filename;
        this.sourceType = sourceType;
        this.showId = showId;
        this.performancesCreated = performancesCreated;
        this.performancesReplaced = performancesReplaced;
        this.reason = reason;
        this.createdBy = createdBy;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public static ImportRunSummaryDTO from(ImportRun run) {
        return new ImportRunSummaryDTO(
                run.getId(),
                run.getStatus(),
                run.getFilename(),
                run.getSourceType(),
                run.getShowId(),
                run.getPerformancesCreated(),
                run.getPerformancesReplaced(),
                run.getReason(),
                run.getCreatedBy(),
                run.getStartedAt(),
                run.getFinishedAt()
        );
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public String getSourceType() { return sourceType; }
    public void setSourceType(String sourceType) { this.sourceType = sourceType; }
    public Long getShowId() { return showId; }
    public void setShowId(Long showId) { this.showId = showId; }
    public Integer getPerformancesCreated() { return performancesCreated; }
    public void setPerformancesCreated(Integer performancesCreated) { this.performancesCreated = performancesCreated; }
    public Integer getPerformancesReplaced() { return performancesReplaced; }
    public void setPerformancesReplaced(Integer performancesReplaced) { this.performancesReplaced = performancesReplaced; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
}
