package com.verdictrag.service.embedding;

import java.nio.charset.StandardCharsets;
import java.util.List;

import com.verdictrag.util.LegalTokenizer;

import lombok.RequiredArgsConstructor;

/**
 * Deterministic feature-hashing embedding over content unigrams and bigrams, L2-normalised.
 * Runs in-process with no model download, so indexing works offline and in tests.
 */
@RequiredArgsConstructor
public class HashingEmbeddingFunction implements EmbeddingFunction {

    private static final double UNIGRAM_WEIGHT = 1.0;
    private static final double BIGRAM_WEIGHT = 0.5;

    private final LegalTokenizer tokenizer;
    private final int dimension;

    @Override
    public String modelName() {
        return "feature-hashing-" + dimension;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public float[] embed(String text) {
        double[] accumulator = new double[dimension];

        addTokens(accumulator, tokenizer.tokenizeUnigram(text), UNIGRAM_WEIGHT);
        addTokens(accumulator, tokenizer.tokenizeBigram(text), BIGRAM_WEIGHT);

        double norm = 0.0;
        for (double v : accumulator) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);

        float[] vector = new float[dimension];
        if (norm == 0.0) {
            return vector;
        }
        for (int i = 0; i < dimension; i++) {
            vector[i] = (float) (accumulator[i] / norm);
        }
        return vector;
    }

    private void addTokens(double[] accumulator, List<String> tokens, double weight) {
        for (String token : tokens) {
            int hash = fnv1a(token);
            int bucket = Math.floorMod(hash, dimension);
            double sign = (hash & 0x4000_0000) == 0 ? 1.0 : -1.0;
            accumulator[bucket] += sign * weight;
        }
    }

    // 32-bit FNV-1a; String.hashCode clusters short tokens into neighbouring buckets
    private static int fnv1a(String token) {
        int hash = 0x811C9DC5;
        for (byte b : token.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xFF;
            hash *= 0x01000193;
        }
        return hash;
    }
}
