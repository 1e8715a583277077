package com.modelgateway.service.embedding;

/**
 * Embedding could not be computed. Always recoverable: the semantic cache
 * treats it as a miss.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
