package com.example.smartbin.model;

import jakarta.persistence.*;

@Entity
@Table(name = "bins")
public class BinEntity {

    @Id
    @Column(length = 64)
    private String binId;

    @Column(length = 40)
    private String locationType; // residential | commercial | public | ...

    private Double capacityKg;

    @Column(length = 200)
    private String location;

    public String getBinId() {
        return binId;
    }

    public void setBinId(String binId) {
        this.binId = binId;
    }

    public String getLocationType() {
        return locationType;
    }

    public void setLocationType(String locationType) {
        this.locationType = locationType;
    }

    public Double getCapacityKg() {
        return capacityKg;
    }

    public void setCapacityKg(Double capacityKg) {
        this.capacityKg = capacityKg;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }
}
