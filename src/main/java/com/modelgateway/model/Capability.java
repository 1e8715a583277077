package com.modelgateway.model;

/**
 * Features a model can offer and a request can require.
 *
 * Routing matches on set inclusion: a model is eligible only when its capability
 * set contains every capability the request requires.
 */
public enum Capability {
    /** Multi-turn chat completion. */
    CHAT,
    /** Single-prompt text completion. */
    COMPLETION,
    /** Vector embeddings. */
    EMBEDDINGS,
    /** Image understanding. */
    VISION,
    /** Tool / function calling. */
    TOOLS,
    /** Guaranteed JSON output. */
    JSON_MODE,
    /** Incremental token streaming. */
    STREAMING
}
