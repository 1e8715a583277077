package com.modelgateway.model;

/**
 * Caller-supplied content volatility. Selects the semantic cache TTL:
 * time-sensitive answers expire quickly, stable factual answers live longer.
 */
public enum Volatility {
    VOLATILE,
    STANDARD,
    STABLE
}
