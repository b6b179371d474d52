package com.cdcportal.backend.modules.tenant.domain;

import com.cdcportal.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "cdc_location")
public class TenantLocation extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "region", nullable = false, length = 100)
    private String region;

    @Column(name = "province", nullable = false, length = 100)
    private String province;

    @Column(name = "municipality", nullable = false, length = 100)
    private String municipality;

    @Column(name = "barangay", nullable = false, length = 100)
    private String barangay;

    protected TenantLocation() {
    }

    public TenantLocation(String region, String province, String municipality, String barangay) {
        this.region = region;
        this.province = province;
        this.municipality = municipality;
        this.barangay = barangay;
    }

    public Long getId() {
        return id;
    }

    public String getRegion() {
        return region;
    }

    public String getProvince() {
        return province;
    }

    public String getMunicipality() {
        return municipality;
    }

    public String getBarangay() {
        return barangay;
    }

    public Geography toGeography() {
        return new Geography(barangay, municipality, province, region);
    }
}
