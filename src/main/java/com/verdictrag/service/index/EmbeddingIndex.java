package com.verdictrag.service.index;

import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.verdictrag.dto.internal.IndexStatistics;
import com.verdictrag.dto.internal.ScoredChunk;
import com.verdictrag.model.Chunk;
import com.verdictrag.model.ChunkMetadata;

/**
 * Vector store over document chunks. Every write is atomic per call: readers observe
 * the index either before or after it, never in between.
 */
public interface EmbeddingIndex {

    /**
     * Stores chunks, embedding those without a vector. A chunk whose id already exists
     * is overwritten.
     *
     * @return number of chunks stored
     */
    int add(List<Chunk> chunks);

    /**
     * Replaces every chunk of {@code documentId} with {@code chunks}.
     *
     * @return number of chunks that were removed
     */
    int replace(String documentId, List<Chunk> chunks);

    List<ScoredChunk> query(String text, int k, ChunkFilter filter);

    List<ScoredChunk> query(float[] vector, int k, ChunkFilter filter);

    /**
     * @return number of chunks removed, 0 when the document is unknown
     */
    int delete(String documentId);

    /**
     * Re-tags every chunk of a document. Vectors are left untouched.
     *
     * @return number of chunks updated
     */
    int updateMetadata(String documentId, UnaryOperator<ChunkMetadata> edit);

    List<Chunk> chunksOf(String documentId);

    boolean contains(String documentId);

    Set<String> documentIds();

    int size();

    IndexStatistics statistics();
}
