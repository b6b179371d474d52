package com.cdcportal.backend.modules.age.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Catalog row as stored. {@code ageRange} is free text and may use a legacy encoding.
 */
@Entity
@Table(name = "age_groups")
public class AgeBand {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "age_range", nullable = false, length = 64)
    private String ageRange;

    protected AgeBand() {
    }

    public AgeBand(String ageRange) {
        this.ageRange = ageRange;
    }

    public Long getId() {
        return id;
    }

    public String getAgeRange() {
        return ageRange;
    }

    /** Key under which this row appears in an {@link AgeBandTable} and in content age filters. */
    public String bandKey() {
        return keyOf(id);
    }

    public static String keyOf(Long ageBandId) {
        return String.valueOf(ageBandId);
    }
}
