package com.modelgateway.service.embedding;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Local, dependency-free embedder using the hashing trick.
 *
 * Algorithm:
 * 1. Normalize text (lower case, collapsed whitespace)
 * 2. Tokenize into words and character trigrams
 * 3. Hash each token to a dimension and a sign
 * 4. Accumulate weighted counts (words weigh more than trigrams, stop words less)
 * 5. L2-normalize
 *
 * Deterministic, so equal texts always embed equally and small edits move the
 * vector only slightly.
 */
@Slf4j
public class HashingEmbeddingService implements EmbeddingService {

    private static final int NGRAM_SIZE = 3;
    private static final float WORD_WEIGHT = 2.0f;
    private static final float STOP_WORD_WEIGHT = 0.5f;
    private static final float NGRAM_WEIGHT = 1.0f;

    // Common stop words to downweight
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "as", "is", "was", "are", "be", "been",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "can", "this", "that", "these", "those"
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int dimensions;

    public HashingEmbeddingService(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        log.info("Using local hashing embeddings ({} dimensions)", dimensions);
    }

    @Override
    public float[] embed(String text) {
        if (text == null) {
            throw new EmbeddingException("Cannot embed null text");
        }

        float[] vector = new float[dimensions];
        String normalized = WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (normalized.isEmpty()) {
            return vector;
        }

        // Word tokens
        for (String word : WHITESPACE.split(normalized)) {
            if (word.length() < 2) {
                continue;
            }
            add(vector, "w:" + word, STOP_WORDS.contains(word) ? STOP_WORD_WEIGHT : WORD_WEIGHT);
        }

        // Character n-grams for robustness to typos and inflection
        for (int i = 0; i <= normalized.length() - NGRAM_SIZE; i++) {
            add(vector, "g:" + normalized.substring(i, i + NGRAM_SIZE), NGRAM_WEIGHT);
        }

        normalize(vector);
        return vector;
    }

    private void add(float[] vector, String token, float weight) {
        int hash = murmurMix(token);
        int index = Math.floorMod(hash, dimensions);
        float sign = ((hash >>> 31) == 0) ? 1.0f : -1.0f;
        vector[index] += sign * weight;
    }

    private static void normalize(float[] vector) {
        double norm = 0.0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm == 0.0) {
            return;
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
    }

    private static int murmurMix(String token) {
        int h = 0;
        for (byte b : token.getBytes(StandardCharsets.UTF_8)) {
            h = 31 * h + b;
        }
        // fmix32 finalizer spreads the polynomial hash across all bits
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelName() {
        return "hashing-" + dimensions;
    }

    @Override
    public boolean isReady() {
        return true;
    }
}
