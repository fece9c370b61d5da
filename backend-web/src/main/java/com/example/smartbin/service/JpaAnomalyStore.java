package com.example.smartbin.service;

import com.example.smartbin.exception.UpstreamUnavailableException;
import com.example.smartbin.model.Anomaly;
import com.example.smartbin.model.AnomalyEntity;
import com.example.smartbin.model.StoredAnomaly;
import com.example.smartbin.repository.AnomalyRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Service
public class JpaAnomalyStore implements AnomalyStore {

    private final AnomalyRepository anomalyRepository;

    public JpaAnomalyStore(AnomalyRepository anomalyRepository) {
        this.anomalyRepository = anomalyRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredAnomaly> findRecent(String binId, Instant since) {
        try {
            return anomalyRepository.findByBinIdAndCreatedAtAfter(binId, since.minusNanos(1)).stream()
                    .map(JpaAnomalyStore::toStored)
                    .toList();
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("Cannot load anomalies of bin " + binId, e);
        }
    }

    @Override
    @Transactional
    public void persist(List<StoredAnomaly> anomalies) {
        if (anomalies.isEmpty()) {
            return;
        }
        try {
            anomalyRepository.saveAll(anomalies.stream().map(JpaAnomalyStore::toEntity).toList());
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("Cannot store " + anomalies.size() + " anomalies", e);
        }
    }

    private static AnomalyEntity toEntity(StoredAnomaly stored) {
        Anomaly anomaly = stored.anomaly();
        AnomalyEntity entity = new AnomalyEntity();
        entity.setBinId(stored.binId());
        entity.setEventId(stored.eventId());
        entity.setAnomalyType(anomaly.type());
        entity.setSeverity(anomaly.severity());
        entity.setConfidence(anomaly.confidence());
        entity.setSource(anomaly.source());
        entity.setDetails(anomaly.details());
        entity.setCreatedAt(stored.detectedAt());
        return entity;
    }

    private static StoredAnomaly toStored(AnomalyEntity entity) {
        Anomaly anomaly = new Anomaly(
                entity.getAnomalyType(),
                entity.getSeverity(),
                entity.getConfidence(),
                entity.getDetails(),
                entity.getSource()
        );
        return new StoredAnomaly(entity.getBinId(), entity.getEventId(), anomaly, entity.getCreatedAt());
    }
}
