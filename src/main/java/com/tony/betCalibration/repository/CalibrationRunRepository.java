package com.tony.betCalibration.repository;

import com.tony.betCalibration.model.entity.CalibrationRunEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CalibrationRunRepository extends JpaRepository<CalibrationRunEntity, Long> {

    List<CalibrationRunEntity> findByCalibratorNameOrderByCreatedAtDesc(String calibratorName);
}
