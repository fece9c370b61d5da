package com.example.smartbin.service;

import com.example.smartbin.model.StoredAnomaly;

import java.time.Instant;
import java.util.List;

public interface AnomalyStore {

    /**
     * Anomalies stored for the bin at or after {@code since}.
     */
    List<StoredAnomaly> findRecent(String binId, Instant since);

    void persist(List<StoredAnomaly> anomalies);
}
