package com.modelgateway.service.embedding;

/**
 * Service for generating text embeddings.
 * Implementations can be local (feature hashing) or remote (Ollama).
 */
public interface EmbeddingService {

    /**
     * Generate embedding vector for text.
     *
     * @param text input text
     * @return embedding vector (float array)
     * @throws EmbeddingException if the vector cannot be produced
     */
    float[] embed(String text);

    /**
     * Get embedding dimensions.
     *
     * @return number of dimensions in output vector
     */
    int dimensions();

    /**
     * Get model name/identifier.
     *
     * @return model name
     */
    String modelName();

    /**
     * Check if service is ready.
     *
     * @return true if ready to embed
     */
    boolean isReady();
}
