package com.percussion.scoredb.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "shows", uniqueConstraints = {
        @UniqueConstraint(name = "uk_show_source_file", columnNames = {"source_file"})
}, indexes = {
        @Index(name = "idx_show_season_date", columnList = "season_id, show_date")
})
public class Show {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name; // distinguishes Saturday / Sunday / Finals rounds

    @Column(name = "show_date", nullable = false)
    private LocalDate date;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "season_id", nullable = false, foreignKey = @ForeignKey(name = "fk_show_season"))
    @JsonIgnore
    private Season season;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "host_id", foreignKey = @ForeignKey(name = "fk_show_host"))
    @JsonIgnore
    private HostLocation host;

    @Column(nullable = false)
    private Integer week;

    @Column(name = "source_file", nullable = false)
    private String sourceFile;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    public void touch() {
        updatedAt = Instant.now();
    }

    public Show() {}

    public Show(String sourceFile) {
        this.sourceFile = sourceFile;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }

    public Season getSeason() { return season; }
    public void setSeason(Season season) { this.season = season; }

    public HostLocation getHost() { return host; }
    public void setHost(HostLocation host) { this.host = host; }

    public Integer getWeek() { return week; }
    public void setWeek(Integer week) { this.week = week; }

    public String getSourceFile() { return sourceFile; }
    public void setSourceFile(String sourceFile) { this.sourceFile = sourceFile; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
