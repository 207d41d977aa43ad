package com.tony.betCalibration.service.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tony.betCalibration.exception.CalibratorNotFoundException;
import com.tony.betCalibration.exception.CalibratorPersistenceException;
import com.tony.betCalibration.model.CalibratorModel;
import com.tony.betCalibration.model.CalibratorRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Registre de calibrateurs versionnés sur disque.
 * <pre>
 * &lt;root&gt;/&lt;nom&gt;/versions/&lt;version_id&gt;/calibrator.json
 * &lt;root&gt;/&lt;nom&gt;/versions/&lt;version_id&gt;/metadata.json
 * </pre>
 * version_id = sha1(nom, metadata, date de création)[:12]. Chaque répertoire de version est écrit une seule fois ;
 * la fiche metadata.json est écrite en dernier, une version sans fiche est ignorée à la lecture.
 * <p>
 * Un nom déjà sûr pour le système de fichiers sert tel quel de répertoire ; sinon il est assaini et suffixé par
 * un hash du nom d'origine, pour que deux noms distincts ne partagent jamais le même répertoire.
 */
@Slf4j
public class CalibratorRegistry {

    static final String CALIBRATOR_FILE = "calibrator.json";
    static final String METADATA_FILE = "metadata.json";
    private static final String VERSIONS_DIR = "versions";
    private static final int VERSION_ID_LENGTH = 12;
    private static final int NAME_HASH_LENGTH = 8;
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9._-]+");
    private static final Pattern VERSION_ID = Pattern.compile("[0-9a-f]{" + VERSION_ID_LENGTH + "}");

    private final Path root;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final CalibratorCache cache;

    public CalibratorRegistry(Path root, ObjectMapper objectMapper, Clock clock, CalibratorCache cache) {
        this.root = root;
        this.mapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
        this.cache = cache;
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Enregistre une nouvelle version. Deux appels successifs créent toujours deux versions distinctes.
     */
    public CalibratorRecord register(String name, CalibratorModel model, Map<String, Object> metadata) {
        String safeName = safeName(name);
        Map<String, Object> meta = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        Instant createdAt = clock.instant();
        String versionId = computeVersionId(name, meta, createdAt);

        Path versionDir = versionsDir(safeName).resolve(versionId);
        Path calibratorPath = versionDir.resolve(CALIBRATOR_FILE);
        try {
            Files.createDirectories(versionDir.getParent());
            Files.createDirectory(versionDir);
        } catch (FileAlreadyExistsException e) {
            throw new CalibratorPersistenceException("Version déjà existante pour " + name + " : " + versionId, e);
        } catch (IOException e) {
            throw new CalibratorPersistenceException("Impossible de créer le répertoire " + versionDir, e);
        }

        CalibratorRecord record = CalibratorRecord.builder()
                .name(name)
                .versionId(versionId)
                .createdAt(createdAt)
                .calibratorPath(calibratorPath.toAbsolutePath().toString())
                .metadata(meta)
                .build();
        try {
            mapper.writerFor(CalibratorModel.class).writeValue(calibratorPath.toFile(), model);
            mapper.writeValue(versionDir.resolve(METADATA_FILE).toFile(), record);
        } catch (IOException e) {
            throw new CalibratorPersistenceException("Écriture du calibrateur " + name + "/" + versionId + " impossible", e);
        }

        cache.put(safeName, versionId, model);
        log.info("✅ Calibrateur {} enregistré ({} - version {})", name, model.kind(), versionId);
        return record;
    }

    public Optional<CalibratorRecord> latest(String name) {
        return listVersions(name).stream().reduce((first, second) -> second);
    }

    public Optional<CalibratorRecord> get(String name, String versionId) {
        Path sidecar = versionDir(safeName(name), versionId).resolve(METADATA_FILE);
        if (!Files.exists(sidecar)) return Optional.empty();
        return Optional.of(readRecord(sidecar)).filter(record -> name.equals(record.getName()));
    }

    public CalibratorModel loadModel(String name, String versionId) {
        String safeName = safeName(name);
        Optional<CalibratorModel> cached = cache.get(safeName, versionId);
        if (cached.isPresent()) return cached.get();

        Path file = versionDir(safeName, versionId).resolve(CALIBRATOR_FILE);
        if (!Files.exists(file)) {
            throw new CalibratorNotFoundException(name, versionId);
        }
        try {
            CalibratorModel model = mapper.readValue(file.toFile(), CalibratorModel.class);
            cache.put(safeName, versionId, model);
            return model;
        } catch (IOException e) {
            throw new CalibratorPersistenceException("Lecture du calibrateur " + file + " impossible", e);
        }
    }

    public Optional<CalibratorModel> loadLatestModel(String name) {
        return latest(name).map(record -> loadModel(name, record.getVersionId()));
    }

    /**
     * Noms d'origine des calibrateurs présents, lus dans les fiches (un répertoire sans fiche lisible est ignoré).
     */
    public List<String> listNames() {
        if (!Files.isDirectory(root)) return List.of();
        try (Stream<Path> dirs = Files.list(root)) {
            return dirs.filter(Files::isDirectory)
                    .map(dir -> storedName(dir.resolve(VERSIONS_DIR)))
                    .flatMap(Optional::stream)
                    .distinct()
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new CalibratorPersistenceException("Lecture du registre " + root + " impossible", e);
        }
    }

    /**
     * Versions d'un nom, de la plus ancienne à la plus récente (created_at).
     */
    public List<CalibratorRecord> listVersions(String name) {
        Path dir = versionsDir(safeName(name));
        if (!Files.isDirectory(dir)) return List.of();

        List<CalibratorRecord> records = new ArrayList<>();
        try (Stream<Path> versions = Files.list(dir)) {
            for (Path versionDir : versions.filter(Files::isDirectory).toList()) {
                Path sidecar = versionDir.resolve(METADATA_FILE);
                // Version en cours d'écriture : la fiche n'existe pas encore
                if (!Files.exists(sidecar)) continue;
                try {
                    CalibratorRecord record = readRecord(sidecar);
                    if (name.equals(record.getName())) {
                        records.add(record);
                    } else {
                        log.warn("Fiche d'un autre calibrateur ignorée : {} ({})", sidecar, record.getName());
                    }
                } catch (CalibratorPersistenceException e) {
                    log.warn("Fiche illisible ignorée : {} ({})", sidecar, e.getCause().getMessage());
                }
            }
        } catch (IOException e) {
            throw new CalibratorPersistenceException("Lecture des versions de " + name + " impossible", e);
        }
        records.sort(Comparator.comparing(CalibratorRecord::getCreatedAt)
                .thenComparing(CalibratorRecord::getVersionId));
        return records;
    }

    public boolean delete(String name, String versionId) {
        String safeName = safeName(name);
        Path versionDir = versionDir(safeName, versionId);
        cache.evict(safeName, versionId);
        try {
            boolean deleted = FileSystemUtils.deleteRecursively(versionDir);
            if (deleted) log.info("🗑️ Version {} du calibrateur {} supprimée", versionId, name);
            return deleted;
        } catch (IOException e) {
            throw new CalibratorPersistenceException("Suppression de " + versionDir + " impossible", e);
        }
    }

    /**
     * Ne garde que les {@code keep} versions les plus récentes. Renvoie le nombre de versions supprimées.
     */
    public int prune(String name, int keep) {
        if (keep < 1) throw new IllegalArgumentException("keep doit être >= 1");
        List<CalibratorRecord> versions = listVersions(name);
        int toDelete = versions.size() - keep;
        int deleted = 0;
        for (int i = 0; i < toDelete; i++) {
            if (delete(name, versions.get(i).getVersionId())) deleted++;
        }
        return deleted;
    }

    String computeVersionId(String name, Map<String, Object> metadata, Instant createdAt) {
        Map<String, Object> payload = new TreeMap<>();
        payload.put("name", name);
        payload.put("metadata", new TreeMap<>(metadata));
        payload.put("created_at", createdAt.toString());
        try {
            byte[] json = mapper.writer().without(SerializationFeature.INDENT_OUTPUT).writeValueAsBytes(payload);
            return sha1Hex(json).substring(0, VERSION_ID_LENGTH);
        } catch (JsonProcessingException e) {
            throw new CalibratorPersistenceException("Métadonnées non sérialisables pour " + name, e);
        }
    }

    private Optional<String> storedName(Path versionsDir) {
        if (!Files.isDirectory(versionsDir)) return Optional.empty();
        try (Stream<Path> versions = Files.list(versionsDir)) {
            for (Path versionDir : versions.filter(Files::isDirectory).toList()) {
                Path sidecar = versionDir.resolve(METADATA_FILE);
                if (!Files.exists(sidecar)) continue;
                try {
                    return Optional.ofNullable(readRecord(sidecar).getName());
                } catch (CalibratorPersistenceException e) {
                    log.warn("Fiche illisible ignorée : {} ({})", sidecar, e.getCause().getMessage());
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new CalibratorPersistenceException("Lecture de " + versionsDir + " impossible", e);
        }
    }

    private CalibratorRecord readRecord(Path sidecar) {
        try {
            return mapper.readValue(sidecar.toFile(), CalibratorRecord.class);
        } catch (IOException e) {
            throw new CalibratorPersistenceException("Fiche " + sidecar + " illisible", e);
        }
    }

    private Path versionsDir(String safeName) {
        return checkInsideRoot(root.resolve(safeName).resolve(VERSIONS_DIR));
    }

    private Path versionDir(String safeName, String versionId) {
        if (versionId == null || !VERSION_ID.matcher(versionId).matches()) {
            throw new IllegalArgumentException("Identifiant de version invalide : " + versionId);
        }
        return checkInsideRoot(versionsDir(safeName).resolve(versionId));
    }

    private Path checkInsideRoot(Path path) {
        Path base = root.toAbsolutePath().normalize();
        Path resolved = path.toAbsolutePath().normalize();
        if (!resolved.startsWith(base) || resolved.equals(base)) {
            throw new IllegalArgumentException("Chemin hors du registre : " + path);
        }
        return path;
    }

    /**
     * Répertoire d'un nom : le nom lui-même s'il est sûr, sinon sa version assainie suffixée par sha1(nom)[:8].
     */
    static String safeName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Nom de calibrateur manquant");
        }
        if (name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Nom de calibrateur invalide : " + name);
        }
        if (SAFE_NAME.matcher(name).matches()) {
            return name;
        }
        String cleaned = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned + "-" + sha1Hex(name.getBytes(StandardCharsets.UTF_8)).substring(0, NAME_HASH_LENGTH);
    }

    private static String sha1Hex(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 indisponible", e);
        }
    }
}
