package com.verdictrag.model;

import java.util.Arrays;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * A bounded span of a document's text, independently embeddable and retrievable.
 * Instances are never mutated; the index stores a copy carrying the embedding. The vector is
 * copied on the way in and out, so no caller can alter what an index snapshot holds.
 */
@Value
@Builder(toBuilder = true)
public class Chunk {

    String id;

    String documentId;

    /**
     * Ordinal position within the owning document, starting at 0.
     */
    int index;

    String text;

    int startOffset;

    int endOffset;

    /**
     * Leading characters shared with the previous chunk; 0 for the first chunk.
     */
    int overlapWithPrevious;

    @Builder.Default
    List<ExtractedCitation> citations = List.of();

    float[] embedding;

    ChunkMetadata metadata;

    public static String chunkId(String documentId, int index) {
        return documentId + "_chunk_" + index;
    }

    public List<String> citationStrings() {
        return citations.stream().map(ExtractedCitation::getText).toList();
    }

    public float[] getEmbedding() {
        return embedding == null ? null : embedding.clone();
    }

    /**
     * Cosine similarity between this chunk's vector and {@code query}; 0 when either has zero norm.
     */
    public double similarityTo(float[] query) {
        double dot = 0.0;
        double chunkNorm = 0.0;
        double queryNorm = 0.0;
        for (int i = 0; i < query.length; i++) {
            dot += embedding[i] * query[i];
            chunkNorm += embedding[i] * embedding[i];
            queryNorm += query[i] * query[i];
        }
        if (chunkNorm == 0.0 || queryNorm == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(chunkNorm) * Math.sqrt(queryNorm));
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public Chunk withEmbedding(float[] vector) {
        return toBuilder().embedding(vector).build();
    }

    public Chunk withMetadata(ChunkMetadata newMetadata) {
        return toBuilder().metadata(newMetadata).build();
    }

    public static class ChunkBuilder {

        public ChunkBuilder embedding(float[] embedding) {
            this.embedding = embedding == null ? null : Arrays.copyOf(embedding, embedding.length);
            return this;
        }
    }
}
