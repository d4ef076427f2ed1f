package com.verdictrag.service.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.springframework.stereotype.Component;

import com.verdictrag.config.LegalRagProperties;
import com.verdictrag.exception.MalformedInputException;
import com.verdictrag.exception.RagException;
import com.verdictrag.util.IndexSnapshotSerializer;
import com.verdictrag.util.IndexSnapshotSerializer.SerializableIndex;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the index from {@code legal-rag.index.snapshot-path} at startup and writes it
 * back on shutdown. Disabled when the path is blank.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexSnapshotStore {

    private final InMemoryEmbeddingIndex index;
    private final LegalRagProperties properties;

    public boolean isEnabled() {
        String path = properties.getIndex().getSnapshotPath();
        return path != null && !path.isBlank();
    }

    /**
     * @return whether a snapshot was found and loaded
     */
    public boolean load() {
        if (!isEnabled()) {
            return false;
        }
        String path = properties.getIndex().getSnapshotPath();
        if (!Files.exists(Paths.get(path))) {
            log.info("No index snapshot at {}, starting empty", path);
            return false;
        }

        SerializableIndex snapshot;
        try {
            snapshot = IndexSnapshotSerializer.loadIndex(path);
        } catch (IOException | ClassNotFoundException e) {
            throw new RagException("Failed to read index snapshot " + path, e);
        }

        String model = index.getEmbeddingFunction().modelName();
        if (!model.equals(snapshot.getEmbeddingModel())) {
            throw new MalformedInputException(String.format(
                    "Snapshot was built with %s but the index uses %s", snapshot.getEmbeddingModel(), model));
        }
        if (snapshot.getDimension() != index.getDimension()) {
            throw MalformedInputException.dimensionMismatch("Snapshot", index.getDimension(), snapshot.getDimension());
        }

        index.load(IndexSnapshotSerializer.toChunks(snapshot));
        return true;
    }

    public void save() {
        if (!isEnabled()) {
            return;
        }
        SerializableIndex snapshot = IndexSnapshotSerializer.toSnapshot(
                index.getEmbeddingFunction().modelName(), index.getDimension(), index.allChunks());
        try {
            IndexSnapshotSerializer.saveIndex(snapshot, properties.getIndex().getSnapshotPath());
        } catch (IOException e) {
            throw new RagException("Failed to write index snapshot", e);
        }
    }

    @PreDestroy
    public void saveOnShutdown() {
        try {
            save();
        } catch (RagException e) {
            log.error("Index snapshot not saved: {}", e.getMessage(), e);
        }
    }
}
