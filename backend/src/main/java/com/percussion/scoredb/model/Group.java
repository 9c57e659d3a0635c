package com.percussion.scoredb.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;

/**
 * A competing ensemble. Identified by (name, home city); the classification is whatever
 * division the group was last ingested under.
 */
@Entity(name = "PerformingGroup")
@Table(name = "performing_groups", uniqueConstraints = {
        @UniqueConstraint(name = "uk_group_name_home_city", columnNames = {"name", "home_city"})
})
public class Group {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "home_city")
    private String homeCity;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "classification_id", foreignKey = @ForeignKey(name = "fk_group_classification"))
    @JsonIgnore
    private Classification classification;

    public Group() {}

    public Group(String name, String homeCity, Classification classification) {
        this.name = name;
        this.homeCity = homeCity;
        this.classification = classification;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getHomeCity() { return homeCity; }
    public void setHomeCity(String homeCity) { this.homeCity = homeCity; }

    public Classification getClassification() { return classification; }
    public void setClassification(Classification classification) { this.classification = classification; }
}
