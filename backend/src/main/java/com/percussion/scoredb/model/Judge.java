package com.percussion.scoredb.model;

import jakarta.persistence.*;

@Entity
@Table(name = "judges", uniqueConstraints = {
        @UniqueConstraint(name = "uk_judge_name", columnNames = {"name"})
})
public class Judge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    public Judge() {}

    public Judge(String name) {
        this.name = name;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
}
