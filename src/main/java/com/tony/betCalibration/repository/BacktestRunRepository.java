package com.tony.betCalibration.repository;

import com.tony.betCalibration.model.entity.BacktestRunEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BacktestRunRepository extends JpaRepository<BacktestRunEntity, Long> {

    // Historique du plus récent au plus ancien
    List<BacktestRunEntity> findAllByOrderByCreatedAtDesc();
}
