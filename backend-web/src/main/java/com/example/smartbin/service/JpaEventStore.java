package com.example.smartbin.service;

import com.example.smartbin.exception.MalformedEventException;
import com.example.smartbin.exception.UpstreamUnavailableException;
import com.example.smartbin.model.BinEntity;
import com.example.smartbin.model.BinEvent;
import com.example.smartbin.model.BinEventEntity;
import com.example.smartbin.model.BinProfile;
import com.example.smartbin.repository.BinEventRepository;
import com.example.smartbin.repository.BinRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

@Slf4j
@Service
@Transactional(readOnly = true)
public class JpaEventStore implements EventStore {

    private final BinEventRepository binEventRepository;
    private final BinRepository binRepository;

    public JpaEventStore(BinEventRepository binEventRepository, BinRepository binRepository) {
        this.binEventRepository = binEventRepository;
        this.binRepository = binRepository;
    }

    @Override
    public List<BinEvent> fetchRecentEvents(Instant since) {
        List<BinEventEntity> rows = query("recent events", () -> binEventRepository.findByCreatedAtAfterOrderByCreatedAtDesc(since));
        return toEvents(rows);
    }

    @Override
    public List<BinEvent> fetchBinEvents(String binId, Instant since) {
        List<BinEventEntity> rows = query("events of bin " + binId,
                () -> binEventRepository.findByBinIdAndCreatedAtAfterOrderByCreatedAtDesc(binId, since));
        return toEvents(rows);
    }

    @Override
    public Optional<BinProfile> fetchBinProfile(String binId) {
        Optional<BinEntity> bin = query("bin " + binId, () -> binRepository.findById(binId));
        return bin.map(b -> BinProfile.of(b.getBinId(), b.getLocationType(), b.getCapacityKg(), b.getLocation()));
    }

    private List<BinEvent> toEvents(List<BinEventEntity> rows) {
        Map<String, Optional<BinEntity>> bins = new HashMap<>();
        List<BinEvent> events = new ArrayList<>(rows.size());
        for (BinEventEntity row : rows) {
            Optional<BinEntity> bin = row.getBinId() == null
                    ? Optional.empty()
                    : bins.computeIfAbsent(row.getBinId(), id -> query("bin " + id, () -> binRepository.findById(id)));
            try {
                events.add(toEvent(row, bin.orElse(null)));
            } catch (MalformedEventException e) {
                log.warn("Skipping bin event {}: {}", row.getId(), e.getMessage());
            }
        }
        return events;
    }

    private static BinEvent toEvent(BinEventEntity row, BinEntity bin) {
        return BinEvent.builder()
                .eventId(row.getId())
                .binId(row.getBinId())
                .timestamp(row.getCreatedAt())
                .weightKg(row.getWeightKg())
                .fillLevelPct(row.getFillLevelPct())
                .batteryPct(row.getBatteryPct())
                .purityScore(row.getPurityScore())
                .materialCounts(row.getMaterialCounts())
                .userId(row.getUserId())
                .anomalyFlagged(row.isAnomalyDetected())
                .locationClass(bin != null ? bin.getLocationType() : null)
                .ratedCapacityKg(bin != null ? bin.getCapacityKg() : null)
                .locationLabel(bin != null ? bin.getLocation() : null)
                .build();
    }

    private static <T> T query(String what, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException("Cannot load " + what, e);
        }
    }
}
