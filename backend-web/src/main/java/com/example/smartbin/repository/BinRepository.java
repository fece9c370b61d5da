package com.example.smartbin.repository;

import com.example.smartbin.model.BinEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BinRepository extends JpaRepository<BinEntity, String> {
}
