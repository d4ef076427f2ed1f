package com.verdictrag.dto.internal;

import com.verdictrag.model.Chunk;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScoredChunk {

    Chunk chunk;

    /**
     * Cosine similarity between the query vector and the chunk vector.
     */
    double score;

    int rank;

    public String getChunkId() {
        return chunk.getId();
    }

    public String getDocumentId() {
        return chunk.getDocumentId();
    }

    public String getText() {
        return chunk.getText();
    }
}
