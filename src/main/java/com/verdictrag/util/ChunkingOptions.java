package com.verdictrag.util;

import java.util.List;

import com.verdictrag.config.LegalRagProperties;
import com.verdictrag.exception.MalformedInputException;

/**
 * Character-based chunking parameters.
 *
 * @param targetSize maximum chunk length
 * @param overlap    characters shared by adjacent chunks, strictly less than targetSize
 * @param separators split separators, highest priority first
 */
public record ChunkingOptions(int targetSize, int overlap, List<String> separators) {

    public ChunkingOptions {
        if (targetSize <= 0) {
            throw new MalformedInputException("Chunk target size must be positive: " + targetSize);
        }
        if (overlap < 0 || overlap >= targetSize) {
            throw new MalformedInputException(
                    "Chunk overlap must be in [0, " + targetSize + "): " + overlap);
        }
        separators = separators == null
                ? List.of()
                : separators.stream().filter(s -> s != null && !s.isEmpty()).toList();
    }

    public static ChunkingOptions from(LegalRagProperties.Chunking chunking) {
        return new ChunkingOptions(chunking.getTargetSize(), chunking.getOverlap(), chunking.getSeparators());
    }
}
