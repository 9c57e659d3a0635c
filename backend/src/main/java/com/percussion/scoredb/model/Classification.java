package com.percussion.scoredb.model;

import jakarta.persistence.*;

// PSA, PSO, PIW, ... or the "Unknown" placeholder
@Entity
@Table(name = "classifications", uniqueConstraints = {
        @UniqueConstraint(name = "uk_classification_name", columnNames = {"name"})
})
public class Classification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String name;

    public Classification() {}

    public Classification(String name) {
        this.name = name;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
}
