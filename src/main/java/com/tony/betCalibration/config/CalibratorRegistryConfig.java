package com.tony.betCalibration.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.betCalibration.service.registry.CalibratorCache;
import com.tony.betCalibration.service.registry.CalibratorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@Slf4j
public class CalibratorRegistryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CalibratorCache calibratorCache() {
        return new CalibratorCache();
    }

    @Bean
    public CalibratorRegistry calibratorRegistry(CalibrationProperties properties,
                                                 ObjectMapper objectMapper,
                                                 Clock clock,
                                                 CalibratorCache calibratorCache) {
        Path root = Path.of(properties.getRegistryPath()).toAbsolutePath();
        log.info("📦 Registre de calibrateurs : {}", root);
        return new CalibratorRegistry(root, objectMapper, clock, calibratorCache);
    }
}
