package com.tony.betCalibration.service.registry;

import com.tony.betCalibration.model.CalibratorModel;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache mémoire des calibrateurs déjà lus sur disque, indexé par (nom, version).
 * Une instance par registre : pas d'état partagé entre registres (ni entre tests).
 */
public class CalibratorCache {

    private final Map<String, CalibratorModel> entries = new ConcurrentHashMap<>();

    public Optional<CalibratorModel> get(String name, String versionId) {
        return Optional.ofNullable(entries.get(key(name, versionId)));
    }

    public void put(String name, String versionId, CalibratorModel model) {
        entries.put(key(name, versionId), model);
    }

    public void evict(String name, String versionId) {
        entries.remove(key(name, versionId));
    }

    public int size() {
        return entries.size();
    }

    private static String key(String name, String versionId) {
        return name + "@" + versionId;
    }
}
