package com.modelgateway.model;

/**
 * How the router orders the candidates that survive filtering. Every strategy
 * breaks ties by estimated cost, then latency class, provider and model id, so
 * routing stays deterministic.
 */
public enum RoutingStrategy {
    /** Cheapest estimated cost first. */
    COST,
    /** Fastest latency class first. */
    LATENCY,
    /** Highest catalog quality score for the request's quality dimension first. */
    QUALITY,
    /**
     * Only models from the request's preferred providers, when any of them can
     * serve it; otherwise behaves like {@link #COST}.
     */
    PROVIDER_PINNED
}
