package com.verdictrag.service.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps text to a fixed-length vector. The same instance must be used for indexing and
 * querying; {@link #modelName()} and {@link #dimension()} identify it in persisted snapshots.
 */
public interface EmbeddingFunction {

    String modelName();

    int dimension();

    /**
     * @throws com.verdictrag.exception.EmbeddingException when the vector cannot be produced
     */
    float[] embed(String text);

    default List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }
}
