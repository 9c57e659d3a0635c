package com.percussion.scoredb.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;

/**
 * Scoring weight (percent) of one caption within a season.
 */
@Entity
@Table(name = "caption_weights", uniqueConstraints = {
        @UniqueConstraint(name = "uk_caption_weight_season_caption", columnNames = {"season_id", "caption"})
})
public class CaptionWeight {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "season_id", nullable = false, foreignKey = @ForeignKey(name = "fk_caption_weight_season"))
    @JsonIgnore
    private Season season;

    @Column(nullable = false, length = 64)
    private String caption;

    @Column(nullable = false)
    private Double weight;

    public CaptionWeight() {}

    public CaptionWeight(Season season, String caption, Double weight) {
        this.season = season;
        this.caption = caption;
        this.weight = weight;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Season getSeason() { return season; }
    public void setSeason(Season season) { this.season = season; }

    public String getCaption() { return caption; }
    public void setCaption(String caption) { this.caption = caption; }

    public Double getWeight() { return weight; }
    public void setWeight(Double weight) { this.weight = weight; }
}
