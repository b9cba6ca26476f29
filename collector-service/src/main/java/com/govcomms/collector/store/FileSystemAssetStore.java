package com.govcomms.collector.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.govcomms.collector.config.CollectorProperties;
import com.govcomms.collector.dto.AssetKind;
import com.govcomms.collector.dto.AssetScope;
import com.govcomms.collector.dto.AssetSignal;
import com.govcomms.collector.exception.RenderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Asset store on the local filesystem.
 *
 * <pre>
 * {baseDir}/global/monthly_counts.json
 * {baseDir}/global/monthly_counts.png
 * {baseDir}/global/manifest.json
 * {baseDir}/sources/{id}/...
 * </pre>
 *
 * Artifact files hold only the rendered data. Generation time and recorded signal live in
 * {@code manifest.json}, keyed by asset kind.
 */
@Component
@Slf4j
public class FileSystemAssetStore implements AssetStore {

    static final String MANIFEST_FILE = "manifest.json";

    private static final TypeReference<Map<String, ManifestEntry>> MANIFEST_TYPE = new TypeReference<>() {};

    private final Path baseDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileSystemAssetStore(CollectorProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getAssets().getBaseDir()), objectMapper);
    }

    public FileSystemAssetStore(Path baseDir, ObjectMapper objectMapper) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        log.info("Asset store rooted at {}", this.baseDir);
    }

    @Override
    public synchronized Optional<AssetSignal> getRecordedSignal(AssetScope scope, AssetKind kind) {
        ManifestEntry entry = readManifest(scope).get(kind.getValue());
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new AssetSignal(entry.maxItemTimestamp(), entry.itemCount()));
    }

    @Override
    public synchronized void writeArtifact(AssetScope scope, AssetKind kind, Object data,
                                           LocalDateTime generatedAt, AssetSignal signal) {
        Path dir = scopeDir(scope);
        Path dataFile = dir.resolve(dataFileName(kind));
        try {
            Files.createDirectories(dir);
            writeAtomically(dataFile, objectMapper.writeValueAsBytes(data));

            List<String> files = new ArrayList<>();
            files.add(dataFile.getFileName().toString());
            Path chartFile = dir.resolve(chartFileName(kind));
            if (kind.hasChart() && Files.exists(chartFile)) {
                files.add(chartFile.getFileName().toString());
            }

            Map<String, ManifestEntry> manifest = readManifest(scope);
            manifest.put(kind.getValue(), new ManifestEntry(
                    generatedAt, signal.maxTimestamp(), signal.itemCount(), files));
            writeAtomically(dir.resolve(MANIFEST_FILE), objectMapper.writeValueAsBytes(manifest));
        } catch (IOException e) {
            throw new RenderException("Failed to write " + kind.getValue() + " for " + scope.key(), e);
        }
    }

    @Override
    public synchronized void writeChart(AssetScope scope, AssetKind kind, byte[] png) {
        Path dir = scopeDir(scope);
        try {
            Files.createDirectories(dir);
            writeAtomically(dir.resolve(chartFileName(kind)), png);
        } catch (IOException e) {
            throw new RenderException("Failed to write chart " + kind.getValue() + " for " + scope.key(), e);
        }
    }

    @Override
    public synchronized boolean artifactExists(AssetScope scope, AssetKind kind) {
        Path dir = scopeDir(scope);
        if (!Files.isRegularFile(dir.resolve(dataFileName(kind)))) {
            return false;
        }
        ManifestEntry entry = readManifest(scope).get(kind.getValue());
        if (entry == null || entry.files() == null) {
            return true;
        }
        return entry.files().stream().allMatch(name -> Files.isRegularFile(dir.resolve(name)));
    }

    Path scopeDir(AssetScope scope) {
        if (scope.isGlobal()) {
            return baseDir.resolve("global");
        }
        return baseDir.resolve("sources").resolve(String.valueOf(scope.sourceId()));
    }

    static String dataFileName(AssetKind kind) {
        return kind.getValue() + ".json";
    }

    static String chartFileName(AssetKind kind) {
        return kind.getValue() + ".png";
    }

    private Map<String, ManifestEntry> readManifest(AssetScope scope) {
        Path manifestFile = scopeDir(scope).resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifestFile)) {
            return new TreeMap<>();
        }
        try {
            Map<String, ManifestEntry> manifest = objectMapper.readValue(manifestFile.toFile(), MANIFEST_TYPE);
            return manifest != null ? new TreeMap<>(manifest) : new TreeMap<>();
        } catch (IOException e) {
            // an unreadable manifest only forces a re-render
            log.warn("Ignoring unreadable manifest {}: {}", manifestFile, e.getMessage());
            return new TreeMap<>();
        }
    }

    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * One manifest record per asset kind.
     */
    public record ManifestEntry(
            LocalDateTime generatedAt,
            LocalDateTime maxItemTimestamp,
            long itemCount,
            List<String> files
    ) {
    }
}
