package com.tony.betCalibration.job;

import com.tony.betCalibration.config.CalibrationProperties;
import com.tony.betCalibration.exception.CalibratorPersistenceException;
import com.tony.betCalibration.service.registry.CalibratorRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CalibratorRetentionJobTest {

    @Mock
    private CalibratorRegistry registry;

    @Test
    @DisplayName("Chaque calibrateur est purgé, un échec n'arrête pas les suivants")
    void shouldPruneEveryNameAndContinueOnFailure() {
        CalibrationProperties properties = new CalibrationProperties();
        properties.setRetentionKeep(3);
        when(registry.listNames()).thenReturn(List.of("nba", "nfl", "nhl"));
        when(registry.prune("nba", 3)).thenReturn(2);
        when(registry.prune("nfl", 3)).thenThrow(new CalibratorPersistenceException("disque plein"));
        when(registry.prune("nhl", 3)).thenReturn(1);

        int removed = new CalibratorRetentionJob(registry, properties).pruneOldVersions();

        assertThat(removed).isEqualTo(3);
        verify(registry).prune("nhl", 3);
    }

    @Test
    void retentionDisabledShouldNotTouchRegistry() {
        CalibrationProperties properties = new CalibrationProperties();
        properties.setRetentionKeep(0);

        assertThat(new CalibratorRetentionJob(registry, properties).pruneOldVersions()).isZero();
        verifyNoInteractions(registry);
    }
}
