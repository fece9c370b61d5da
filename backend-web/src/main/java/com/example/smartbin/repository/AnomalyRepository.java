package com.example.smartbin.repository;

import com.example.smartbin.model.AnomalyEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface AnomalyRepository extends JpaRepository<AnomalyEntity, Long> {

    List<AnomalyEntity> findByBinIdAndCreatedAtAfter(String binId, Instant since);
}
