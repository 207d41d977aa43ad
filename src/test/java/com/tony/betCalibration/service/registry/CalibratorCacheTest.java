package com.tony.betCalibration.service.registry;

import com.tony.betCalibration.model.PlattCalibrator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CalibratorCacheTest {

    @Test
    void entriesShouldBeKeyedByNameAndVersion() {
        CalibratorCache cache = new CalibratorCache();
        cache.put("nba", "v1", new PlattCalibrator(1, 0));
        cache.put("nba", "v2", new PlattCalibrator(2, 0));
        cache.put("nfl", "v1", new PlattCalibrator(3, 0));

        cache.evict("nba", "v1");

        assertThat(cache.get("nba", "v1")).isEmpty();
        assertThat(cache.get("nba", "v2")).contains(new PlattCalibrator(2, 0));
        assertThat(cache.get("nfl", "v1")).contains(new PlattCalibrator(3, 0));
        assertThat(cache.size()).isEqualTo(2);
    }
}
