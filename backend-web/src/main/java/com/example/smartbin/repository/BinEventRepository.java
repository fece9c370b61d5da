package com.example.smartbin.repository;

import com.example.smartbin.model.BinEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface BinEventRepository extends JpaRepository<BinEventEntity, Long> {

    List<BinEventEntity> findByCreatedAtAfterOrderByCreatedAtDesc(Instant since);

    List<BinEventEntity> findByBinIdAndCreatedAtAfterOrderByCreatedAtDesc(String binId, Instant since);
}
