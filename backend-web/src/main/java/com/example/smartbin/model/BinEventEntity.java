package com.example.smartbin.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "bin_events", indexes = {
        @Index(name = "idx_bin_events_created_at", columnList = "createdAt"),
        @Index(name = "idx_bin_events_bin_created_at", columnList = "binId, createdAt")
})
public class BinEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 64)
    private String binId;

    private Instant createdAt;

    private Double weightKg;

    private Double fillLevelPct;

    private Integer batteryPct;

    private Double purityScore; // joined from the AI insight of the event

    private boolean anomalyDetected;

    @Convert(converter = MaterialCountsConverter.class)
    @Column(columnDefinition = "text")
    private Map<String, Integer> materialCounts;

    @Column(length = 64)
    private String userId;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getBinId() {
        return binId;
    }

    public void setBinId(String binId) {
        this.binId = binId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Double getWeightKg() {
        return weightKg;
    }

    public void setWeightKg(Double weightKg) {
        this.weightKg = weightKg;
    }

    public Double getFillLevelPct() {
        return fillLevelPct;
    }

    public void setFillLevelPct(Double fillLevelPct) {
        this.fillLevelPct = fillLevelPct;
    }

    public Integer getBatteryPct() {
        return batteryPct;
    }

    public void setBatteryPct(Integer batteryPct) {
        this.batteryPct = batteryPct;
    }

    public Double getPurityScore() {
        return purityScore;
    }

    public void setPurityScore(Double purityScore) {
        this.purityScore = purityScore;
    }

    public boolean isAnomalyDetected() {
        return anomalyDetected;
    }

    public void setAnomalyDetected(boolean anomalyDetected) {
        this.anomalyDetected = anomalyDetected;
    }

    public Map<String, Integer> getMaterialCounts() {
        return materialCounts;
    }

    public void setMaterialCounts(Map<String, Integer> materialCounts) {
        this.materialCounts = materialCounts;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }
}
