package com.gatekeeper.history.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gatekeeper.core.error.StateException;
import com.gatekeeper.history.model.RepositorySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON encoding of {@link RepositorySnapshot}, plus file helpers used by the CLI.
 * <p>
 * Writes go to a sibling temp file first and are moved into place, so a failed write
 * never leaves a half-written snapshot behind.
 */
@Component
public class RepositorySnapshotCodec {

    private static final Logger log = LoggerFactory.getLogger(RepositorySnapshotCodec.class);

    private final ObjectMapper objectMapper;

    public RepositorySnapshotCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(RepositorySnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new StateException("Failed to serialize repository snapshot", e);
        }
    }

    public RepositorySnapshot fromJson(String json) {
        try {
            return objectMapper.readValue(json, RepositorySnapshot.class);
        } catch (JsonProcessingException e) {
            throw new StateException("Invalid repository snapshot: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @return empty when the file does not exist yet
     */
    public Optional<RepositorySnapshot> read(Path path) {
        if (!Files.exists(path)) {
            log.debug("No snapshot at {}", path);
            return Optional.empty();
        }
        try {
            return Optional.of(fromJson(Files.readString(path)));
        } catch (IOException e) {
            throw new StateException("Failed to read snapshot " + path, e);
        }
    }

    public void write(Path path, RepositorySnapshot snapshot) {
        String json = toJson(snapshot);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(temp, json);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Wrote snapshot {} ({} commits)", path, snapshot.commits().size());
        } catch (IOException e) {
            throw new StateException("Failed to write snapshot " + path, e);
        }
    }
}
