package com.percussion.scoredb.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;

/**
 * Per-caption breakdown of a performance. The weight is copied from the season's
 * caption weights when the sheet is ingested and does not follow later edits.
 */
@Entity
@Table(name = "caption_scores", indexes = {
        @Index(name = "idx_caption_score_performance", columnList = "performance_id")
})
public class CaptionScore {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "performance_id", nullable = false, foreignKey = @ForeignKey(name = "fk_caption_score_performance"))
    @JsonIgnore
    private Performance performance;

    @Column(nullable = false, length = 64)
    private String caption;

    private Double weight;

    @Column(name = "comp_score")
    private Double compScore;

    @Column(name = "perf_score")
    private Double perfScore;

    private Integer placement;

    // recap sheets are judge-aggregated; stays null until per-judge sheets are ingested
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "judge_id", foreignKey = @ForeignKey(name = "fk_caption_score_judge"))
    @JsonIgnore
    private Judge judge;

    public CaptionScore() {}

    public CaptionScore(String caption, Double weight, Double compScore, Double perfScore, Integer placement) {
        this.caption = caption;
        this.weight = weight;
        this.compScore = compScore;
        this.perfScore = perfScore;
        this.placement = placement;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Performance getPerformance() { return performance; }
    public void setPerformance(Performance performance) { this.performance = performance; }

    public String getCaption() { return caption; }
    public void setCaption(String caption) { this.caption = caption; }

    public Double getWeight() { return weight; }
    public void setWeight(Double weight) { this.weight = weight; }

    public Double getCompScore() { return compScore; }
    public void setCompScore(Double compScore) { this.compScore = compScore; }

    public Double getPerfScore() { return perfScore; }
    public void setPerfScore(Double perfScore) { this.perfScore = perfScore; }

    public Integer getPlacement() { return placement; }
    public void setPlacement(Integer placement) { this.placement = placement; }

    public Judge getJudge() { return judge; }
    public void setJudge(Judge judge) { this.judge = judge; }
}
