package com.di.pitnova.agent.degradation;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;

/**
 * Serialises a {@link ModelSnapshot} to JSON on the local file system and reads it back.
 * Writes go to a sibling temp file first and are then moved into place.
 */
@Component
@Slf4j
public class ModelSnapshotRepository {

    private final ObjectMapper objectMapper;

    public ModelSnapshotRepository() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ModelSnapshot write(Path file, Collection<FittedDegradationModel> models) {
        ModelSnapshot snapshot = ModelSnapshot.builder()
                .version(ModelSnapshot.CURRENT_VERSION)
                .savedAt(Instant.now())
                .models(models.stream().sorted(Comparator.comparing(FittedDegradationModel::getKey)).toList())
                .build();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), snapshot);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write model snapshot to " + file, e);
        }
        log.info("[DEGRADATION] snapshot written: {} models → {}", snapshot.getModels().size(), file);
        return snapshot;
    }

    public ModelSnapshot read(Path file) {
        ModelSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(file.toFile(), ModelSnapshot.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read model snapshot from " + file, e);
        }
        if (snapshot.getVersion() != ModelSnapshot.CURRENT_VERSION) {
            throw new IllegalStateException("Unsupported model snapshot version " + snapshot.getVersion()
                    + " in " + file + " (expected " + ModelSnapshot.CURRENT_VERSION + ")");
        }
        log.info("[DEGRADATION] snapshot read: {} models ← {}", snapshot.getModels().size(), file);
        return snapshot;
    }
}
