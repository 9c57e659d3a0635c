package com.percussion.scoredb.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import java.util.ArrayList;
import java.util.List;

/**
 * One group's scored result at one show.
 */
@Entity
@Table(name = "performances", indexes = {
        @Index(name = "idx_performance_show", columnList = "show_id"),
        @Index(name = "idx_performance_group", columnList = "group_id")
})
public class Performance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "show_id", nullable = false, foreignKey = @ForeignKey(name = "fk_performance_show"))
    @JsonIgnore
    private Show show;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "group_id", nullable = false, foreignKey = @ForeignKey(name = "fk_performance_group"))
    @JsonIgnore
    private Group group;

    // division the group competed in at this show
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "classification_id", foreignKey = @ForeignKey(name = "fk_performance_classification"))
    @JsonIgnore
    private Classification classification;

    @Column(name = "block_number")
    private Integer blockNumber;

    @Column(name = "total_score", nullable = false)
    private Double totalScore;

    private Integer placement;

    @Column(nullable = false)
    private Double penalty = 0.0;

    @OneToMany(mappedBy = "performance", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @JsonIgnore
    private List<CaptionScore> captionScores = new ArrayList<>();

    public Performance() {}

    public void addCaptionScore(CaptionScore score) {
        score.setPerformance(this);
        captionScores.add(score);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Show getShow() { return show; }
    public void setShow(Show show) { this.show = show; }

    public Group getGroup() { return group; }
    public void setGroup(Group group) { this.group = group; }

    public Classification getClassification() { return classification; }
    public void setClassification(Classification classification) { this.classification = classification; }

    public Integer getBlockNumber() { return blockNumber; }
    public void setBlockNumber(Integer blockNumber) { this.blockNumber = blockNumber; }

    public Double getTotalScore() { return totalScore; }
    public void setTotalScore(Double totalScore) { this.totalScore = totalScore; }

    public Integer getPlacement() { return placement; }
    public void setPlacement(Integer placement) { this.placement = placement; }

    public Double getPenalty() { return penalty; }
    public void setPenalty(Double penalty) { this.penalty = penalty; }

    public List<CaptionScore> getCaptionScores() { return captionScores; }
    public void setCaptionScores(List<CaptionScore> captionScores) { this.captionScores = captionScores; }
}
