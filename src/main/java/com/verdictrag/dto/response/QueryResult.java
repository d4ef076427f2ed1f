package com.verdictrag.dto.response;

import java.util.List;
import java.util.Map;

import com.verdictrag.dto.internal.ScoredChunk;
import com.verdictrag.dto.internal.SourceSummary;
import com.verdictrag.model.Chunk;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueryResult {

    String question;

    List<ScoredChunk> retrieved;

    String answer;

    List<SourceSummary> sources;

    /**
     * Set when retrieval found no context; the answer is not grounded in the corpus.
     */
    boolean unsupported;

    Double totalTime;

    Map<String, Double> stepDurations;

    public List<Chunk> getChunks() {
        return retrieved.stream().map(ScoredChunk::getChunk).toList();
    }
}
