package com.debtchecker.output;

import com.debtchecker.model.CheckpointSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the checkpoint as a single JSON file, e.g. temp_files/checkpoint.json.
 *
 * Writes go to a temp file in the same directory which is then renamed over
 * the target, so a crash mid-write leaves the previous snapshot intact.
 */
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

    public static final String FILE_NAME = "checkpoint.json";

    private final Path file;
    private final ObjectMapper objectMapper;

    public FileCheckpointStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<CheckpointSnapshot> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            CheckpointSnapshot snapshot = objectMapper.readValue(file.toFile(), CheckpointSnapshot.class);
            log.info("Loaded checkpoint {}: {} completed, {} remaining",
                    file, snapshot.completed().size(), snapshot.remaining().size());
            return Optional.of(snapshot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read checkpoint " + file, e);
        }
    }

    @Override
    public void save(CheckpointSnapshot snapshot) {
        Path dir = file.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "checkpoint-", ".json.tmp");
            objectMapper.writeValue(tmp.toFile(), snapshot);
            moveIntoPlace(tmp);
            log.debug("Checkpoint written to {}: {} completed, {} remaining",
                    file, snapshot.completed().size(), snapshot.remaining().size());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Failed to write checkpoint " + file, e);
        }
    }

    @Override
    public void clear() {
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Removed checkpoint {}", file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove checkpoint " + file, e);
        }
    }

    public Path file() {
        return file;
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp checkpoint {}: {}", tmp, e.getMessage());
        }
    }
}
