package com.mermaiduml.core.source;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads {@link TypeSnapshot} documents produced by the analysis front end.
 *
 * <p>Files ending in {@code .yaml} or {@code .yml} are parsed as YAML, everything
 * else as JSON. Unknown properties are ignored and enum values are matched
 * case-insensitively, so {@code "kind": "interface"} and {@code INTERFACE} are equivalent.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TypeSnapshot snapshot = SnapshotReader.read(Path.of("types.json"));
 * }</pre>
 */
public final class SnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotReader.class);

    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private SnapshotReader() {
    }

    /**
     * Reads a snapshot file.
     *
     * @param path JSON or YAML snapshot
     * @return parsed snapshot
     * @throws SnapshotReadException if the file is missing, unreadable or malformed
     */
    public static TypeSnapshot read(Path path) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new SnapshotReadException(path, "Snapshot file is not readable: " + path, null);
        }

        log.debug("Reading type snapshot from: {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            TypeSnapshot snapshot = mapperFor(path).readValue(in, TypeSnapshot.class);
            if (snapshot == null) {
                throw new SnapshotReadException(path, "Snapshot file is empty: " + path, null);
            }
            log.info("Loaded snapshot '{}' with {} types and {} enums from {} units",
                snapshot.project(), snapshot.typeCount(), snapshot.enumCount(), snapshot.units().size());
            return snapshot;
        } catch (IOException e) {
            throw new SnapshotReadException(path, "Failed to parse snapshot " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a snapshot from JSON text.
     *
     * @param json JSON document
     * @return parsed snapshot
     * @throws SnapshotReadException if the document is malformed
     */
    public static TypeSnapshot readJson(String json) {
        try {
            return JSON_MAPPER.readValue(json, TypeSnapshot.class);
        } catch (IOException e) {
            throw new SnapshotReadException(null, "Failed to parse snapshot: " + e.getMessage(), e);
        }
    }

    private static ObjectMapper mapperFor(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
    }
}
