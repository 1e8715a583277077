package com.modelgateway.service.cache;

import com.modelgateway.model.InferenceResult;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One cached inference result. Immutable apart from the hit counter.
 */
public final class CacheEntry {

    private final String id;
    private final float[] embedding;
    private final String fingerprint;
    private final String capabilityKey;
    private final InferenceResult result;
    private final Instant createdAt;
    private final Duration ttl;
    private final AtomicLong hitCount = new AtomicLong();

    CacheEntry(String id, float[] embedding, String fingerprint, String capabilityKey,
               InferenceResult result, Instant createdAt, Duration ttl) {
        this.id = id;
        this.embedding = embedding;
        this.fingerprint = fingerprint;
        this.capabilityKey = capabilityKey;
        this.result = result;
        this.createdAt = createdAt;
        this.ttl = ttl;
    }

    public String getId() {
        return id;
    }

    /**
     * Null when the embedding could not be computed at store time; such entries
     * only match by exact fingerprint.
     */
    float[] getEmbedding() {
        return embedding;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getCapabilityKey() {
        return capabilityKey;
    }

    public InferenceResult getResult() {
        return result;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Duration getTtl() {
        return ttl;
    }

    public long getHitCount() {
        return hitCount.get();
    }

    long recordHit() {
        return hitCount.incrementAndGet();
    }

    /**
     * TTL runs from creation, not last access.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(createdAt.plus(ttl));
    }
}
