package com.modelgateway.service.cache;

/**
 * A cache hit: the matched entry and how similar it was to the request.
 *
 * @param entry      matched entry
 * @param similarity cosine similarity, 1.0 for an exact fingerprint match
 * @param exact      whether the hit came from the fingerprint fast path
 */
public record CacheLookup(CacheEntry entry, double similarity, boolean exact) {
}
