package com.percussion.scoredb.model;

import jakarta.persistence.*;

/**
 * Host school or venue, e.g. "Arcadia HS" in Arcadia, CA.
 */
@Entity
@Table(name = "hosts", indexes = {
        @Index(name = "idx_host_name_city_state", columnList = "name, city, state")
})
public class HostLocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String city;

    @Column(length = 8)
    private String state;

    public HostLocation() {}

    public HostLocation(String name, String city, String state) {
        this.name = name;
        this.city = city;
        this.state = state;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }

    public String getState() { return state; }
    public void setState(String state) { this.state = state; }
}
