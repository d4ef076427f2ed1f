package com.verdictrag.util;

import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import com.verdictrag.model.Chunk;
import com.verdictrag.model.ChunkMetadata;
import com.verdictrag.model.ExtractedCitation;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Embedding index serialization utility.
 * Save/Load indexed chunks with their vectors to/from disk with GZIP compression.
 */
@Slf4j
public class IndexSnapshotSerializer {

    private IndexSnapshotSerializer() {
    }

    @Data
    public static class SerializableIndex implements Serializable {
        private static final long serialVersionUID = 1L;

        private String embeddingModel;
        private int dimension;
        private List<SerializableChunk> chunks;

        @Data
        public static class SerializableChunk implements Serializable {
            private static final long serialVersionUID = 1L;

            private String id;
            private String documentId;
            private int index;
            private String text;
            private int startOffset;
            private int endOffset;
            private int overlapWithPrevious;
            private List<ExtractedCitation> citations;
            private float[] embedding;
            private ChunkMetadata metadata;
        }
    }

    public static SerializableIndex toSnapshot(String embeddingModel, int dimension, List<Chunk> chunks) {
        SerializableIndex index = new SerializableIndex();
        index.setEmbeddingModel(embeddingModel);
        index.setDimension(dimension);

        List<SerializableIndex.SerializableChunk> serialized = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            SerializableIndex.SerializableChunk data = new SerializableIndex.SerializableChunk();
            data.setId(chunk.getId());
            data.setDocumentId(chunk.getDocumentId());
            data.setIndex(chunk.getIndex());
            data.setText(chunk.getText());
            data.setStartOffset(chunk.getStartOffset());
            data.setEndOffset(chunk.getEndOffset());
            data.setOverlapWithPrevious(chunk.getOverlapWithPrevious());
            data.setCitations(new ArrayList<>(chunk.getCitations()));
            data.setEmbedding(chunk.getEmbedding());
            data.setMetadata(chunk.getMetadata());
            serialized.add(data);
        }
        index.setChunks(serialized);
        return index;
    }

    public static List<Chunk> toChunks(SerializableIndex index) {
        List<Chunk> chunks = new ArrayList<>(index.getChunks().size());
        for (SerializableIndex.SerializableChunk data : index.getChunks()) {
            chunks.add(Chunk.builder()
                    .id(data.getId())
                    .documentId(data.getDocumentId())
                    .index(data.getIndex())
                    .text(data.getText())
                    .startOffset(data.getStartOffset())
                    .endOffset(data.getEndOffset())
                    .overlapWithPrevious(data.getOverlapWithPrevious())
                    .citations(data.getCitations() != null ? List.copyOf(data.getCitations()) : List.of())
                    .embedding(data.getEmbedding())
                    .metadata(data.getMetadata())
                    .build());
        }
        return chunks;
    }

    /**
     * Save index snapshot to file with GZIP compression
     */
    public static void saveIndex(SerializableIndex index, String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }

        long startTime = System.currentTimeMillis();

        try (FileOutputStream fos = new FileOutputStream(path.toFile());
             GZIPOutputStream gzos = new GZIPOutputStream(fos);
             ObjectOutputStream oos = new ObjectOutputStream(gzos)) {

            oos.writeObject(index);
        }

        long duration = System.currentTimeMillis() - startTime;
        long fileSize = Files.size(path);

        log.info("Index snapshot saved | path={} | chunks={} | size={}KB | time={}ms",
                path, index.getChunks().size(), fileSize / 1024, duration);
    }

    /**
     * Load index snapshot from file
     */
    public static SerializableIndex loadIndex(String filePath) throws IOException, ClassNotFoundException {
        long startTime = System.currentTimeMillis();

        SerializableIndex index;
        try (FileInputStream fis = new FileInputStream(filePath);
             GZIPInputStream gzis = new GZIPInputStream(fis);
             ObjectInputStream ois = new ObjectInputStream(gzis)) {

            index = (SerializableIndex) ois.readObject();
        }

        long duration = System.currentTimeMillis() - startTime;

        log.info("Index snapshot loaded | chunks={} | model={} | time={}ms",
                index.getChunks().size(), index.getEmbeddingModel(), duration);

        return index;
    }
}
