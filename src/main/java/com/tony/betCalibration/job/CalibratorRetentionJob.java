package com.tony.betCalibration.job;

import com.tony.betCalibration.config.CalibrationProperties;
import com.tony.betCalibration.service.registry.CalibratorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class CalibratorRetentionJob {

    private final CalibratorRegistry registry;
    private final CalibrationProperties properties;

    /**
     * Purge du registre : on garde les N versions les plus récentes de chaque calibrateur.
     * Fréquence : calibration.retention-cron (par défaut tous les jours à 03:00).
     */
    @Scheduled(cron = "${calibration.retention-cron:0 0 3 * * *}")
    public void scheduledPrune() {
        pruneOldVersions();
    }

    public int pruneOldVersions() {
        int keep = properties.getRetentionKeep();
        if (keep < 1) {
            log.debug("Purge du registre désactivée (retention-keep = {})", keep);
            return 0;
        }

        log.info("⏰ [CRON] Purge du registre de calibrateurs (conservation : {} versions)", keep);
        int total = 0;
        for (String name : registry.listNames()) {
            try {
                int removed = registry.prune(name, keep);
                if (removed > 0) {
                    log.info("   -> {} : {} version(s) supprimée(s)", name, removed);
                }
                total += removed;
            } catch (RuntimeException e) {
                log.error("❌ [CRON] Echec de la purge pour {}", name, e);
            }
        }
        log.info("✅ [CRON] Purge terminée : {} version(s) supprimée(s)", total);
        return total;
    }
}
