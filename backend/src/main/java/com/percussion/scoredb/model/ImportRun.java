package com.percussion.scoredb.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One ingestion attempt of a score sheet file. Saved outside the document transaction so that
 * failed attempts are kept alongside their reason.
 */
@Entity
@Table(name = "import_run", indexes = {
        @Index(name = "idx_importrun_filename", columnList = "filename")
})
public class ImportRun {

    public static final String IN_PROGRESS = "IN_PROGRESS";
    public static final String COMPLETED = "COMPLETED";
    public static final String FAILED = "FAILED";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 255, nullable = false)
    private String filename;

    @Column(name = "file_path", length = 1000)
    private String filePath;

    @Column(name = "source_type", length = 32)
    private String sourceType; // FOLDER or UPLOAD

    @Column(length = 100)
    private String createdBy;

    @Column(columnDefinition = "TEXT")
    private String params;

    @Column(name = "show_id")
    private Long showId;

    @Column(name = "performances_created")
    private Integer performancesCreated = 0;

    @Column(name = "performances_replaced")
    private Integer performancesReplaced = 0;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(length = 32)
    private String status = IN_PROGRESS;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public String getFilePath() { return filePath; }
    public void setFilePath(String filePath) { this.filePath = filePath; }
    public String getSourceType() { return sourceType; }
    public void setSourceType(String sourceType) { this.sourceType = sourceType; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public String getParams() { return params; }
    public void setParams(String params) { this.params = params; }
    public Long getShowId() { return showId; }
    public void setShowId(Long showId) { this.showId = showId; }
    public Integer getPerformancesCreated() { return performancesCreated; }
    public void setPerformancesCreated(Integer performancesCreated) { this.performancesCreated = performancesCreated; }
    public Integer getPerformancesReplaced() { return performancesReplaced; }
    public void setPerformancesReplaced(Integer performancesReplaced) { this.performancesReplaced = performancesReplaced; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
}
