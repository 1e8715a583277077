package com.modelgateway.service.cache;

import com.modelgateway.config.GatewayProperties;
import com.modelgateway.model.InferenceRequest;
import com.modelgateway.model.InferenceResult;
import com.modelgateway.model.Volatility;
import com.modelgateway.model.dto.CacheStatistics;
import com.modelgateway.service.embedding.EmbeddingService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Approximate-match response cache keyed by request embedding.
 *
 * Flow:
 * 1. Select the partition for the request's exact capability set
 * 2. Check the partition for an exact fingerprint match (no embedding needed)
 * 3. Otherwise embed the normalized payload and scan the partition for the
 *    highest cosine similarity
 * 4. Return the best entry at or above the threshold
 *
 * Entries are partitioned by capability set, so requests with different
 * capability requirements can never hit each other's entries whatever their
 * similarity. TTLs run from creation. Expired entries are dropped when a read
 * touches them and by {@link #sweepExpired()}. When the entry count exceeds
 * {@code gateway.cache.max-entries}, the least-hit entries (oldest first among
 * equals) are evicted.
 *
 * Embedding failures never propagate: lookups degrade to a miss and stores
 * fall back to fingerprint-only entries.
 */
@Slf4j
public class SemanticCache {

    private final GatewayProperties.CacheConfig config;
    private final EmbeddingService embeddingService;
    private final RequestFingerprinter fingerprinter;
    private final Clock clock;

    private final Map<String, Map<String, CacheEntry>> partitions = new ConcurrentHashMap<>();
    private final ReentrantLock evictionLock = new ReentrantLock();

    private final LongAdder hits = new LongAdder();
    private final LongAdder exactHits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder stores = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder expirations = new LongAdder();
    private final LongAdder embeddingFailures = new LongAdder();

    public SemanticCache(GatewayProperties.CacheConfig config,
                         EmbeddingService embeddingService,
                         RequestFingerprinter fingerprinter,
                         Clock clock) {
        this.config = config;
        this.embeddingService = embeddingService;
        this.fingerprinter = fingerprinter;
        this.clock = clock;
        log.info("SemanticCache initialized (threshold={}, maxEntries={}, embeddings={})",
                config.getSimilarityThreshold(), config.getMaxEntries(), embeddingService.modelName());
    }

    /**
     * Find a cached result for the request.
     *
     * @return the best live entry at or above the similarity threshold
     */
    public Optional<CacheLookup> lookup(InferenceRequest request) {
        if (!config.isEnabled() || !request.isCacheable()) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        String capabilityKey = RequestFingerprinter.capabilityKey(request.effectiveCapabilities());
        Map<String, CacheEntry> partition = partitions.get(capabilityKey);
        if (partition == null || partition.isEmpty()) {
            return miss(request);
        }

        // 1. Exact fingerprint
        CacheEntry exact = partition.get(fingerprinter.fingerprint(request));
        if (exact != null) {
            if (!exact.isExpired(now)) {
                exact.recordHit();
                hits.increment();
                exactHits.increment();
                log.debug("Cache HIT (exact) request={} entry={}", request.getRequestId(), exact.getId());
                return Optional.of(new CacheLookup(exact, 1.0, true));
            }
            expire(partition, exact);
        }

        // 2. Nearest neighbour by embedding
        float[] embedding = embedQuietly(request);
        if (embedding == null) {
            return miss(request);
        }

        CacheEntry best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (CacheEntry candidate : partition.values()) {
            if (candidate.isExpired(now)) {
                expire(partition, candidate);
                continue;
            }
            double score = VectorSimilarity.cosine(embedding, candidate.getEmbedding());
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }

        double threshold = thresholdFor(request);
        if (best == null || bestScore < threshold) {
            log.debug("Cache MISS request={} bestScore={} threshold={}",
                    request.getRequestId(), best == null ? "n/a" : String.format("%.3f", bestScore), threshold);
            return miss(request);
        }

        best.recordHit();
        hits.increment();
        log.debug("Cache HIT (semantic) request={} entry={} score={}",
                request.getRequestId(), best.getId(), String.format("%.3f", bestScore));
        return Optional.of(new CacheLookup(best, bestScore, false));
    }

    /**
     * Cache the result of a successful inference.
     */
    public void store(InferenceRequest request, InferenceResult result) {
        if (!config.isEnabled() || !request.isCacheable()) {
            return;
        }

        try {
            Instant now = clock.instant();
            String capabilityKey = RequestFingerprinter.capabilityKey(request.effectiveCapabilities());
            String fingerprint = fingerprinter.fingerprint(request);
            Duration ttl = ttlFor(request);

            CacheEntry entry = new CacheEntry(
                    UUID.randomUUID().toString(),
                    embedQuietly(request),
                    fingerprint,
                    capabilityKey,
                    result.toBuilder().cacheHit(false).cacheSimilarity(0.0).build(),
                    now,
                    ttl);

            partitions.computeIfAbsent(capabilityKey, key -> new ConcurrentHashMap<>())
                    .put(fingerprint, entry);
            stores.increment();
            log.debug("Stored cache entry {} for request={} ttl={} capabilities={}",
                    entry.getId(), request.getRequestId(), ttl, capabilityKey);

            if (size() > config.getMaxEntries()) {
                enforceCapacity();
            }
        } catch (RuntimeException e) {
            // Cache failures shouldn't break requests
            log.error("Error storing request {} in cache", request.getRequestId(), e);
        }
    }

    /**
     * Remove every entry whose TTL has elapsed.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map<String, CacheEntry> partition : partitions.values()) {
            for (CacheEntry entry : partition.values()) {
                if (entry.isExpired(now) && expire(partition, entry)) {
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired cache entries", removed);
        }
        return removed;
    }

    public void clear() {
        evictionLock.lock();
        try {
            partitions.clear();
        } finally {
            evictionLock.unlock();
        }
        log.info("Cleared semantic cache");
    }

    /**
     * Live entry count, summed over the partitions so that writes racing a
     * {@link #clear()} cannot skew it.
     */
    public int size() {
        int total = 0;
        for (Map<String, CacheEntry> partition : partitions.values()) {
            total += partition.size();
        }
        return total;
    }

    public CacheStatistics getStatistics() {
        long hitCount = hits.sum();
        long missCount = misses.sum();
        long lookups = hitCount + missCount;

        Map<String, Long> byCapabilities = new TreeMap<>();
        partitions.forEach((key, partition) -> {
            if (!partition.isEmpty()) {
                byCapabilities.put(key, (long) partition.size());
            }
        });

        return CacheStatistics.builder()
                .entries(size())
                .hits(hitCount)
                .exactHits(exactHits.sum())
                .misses(missCount)
                .hitRate(lookups == 0 ? 0.0 : (double) hitCount / lookups)
                .stores(stores.sum())
                .evictions(evictions.sum())
                .expirations(expirations.sum())
                .embeddingFailures(embeddingFailures.sum())
                .entriesByCapabilities(byCapabilities)
                .build();
    }

    private Optional<CacheLookup> miss(InferenceRequest request) {
        misses.increment();
        log.debug("Cache MISS request={}", request.getRequestId());
        return Optional.empty();
    }

    private float[] embedQuietly(InferenceRequest request) {
        if (!embeddingService.isReady() || request.getPayload() == null) {
            return null;
        }
        try {
            return embeddingService.embed(request.getPayload().normalizedText());
        } catch (RuntimeException e) {
            embeddingFailures.increment();
            log.warn("Embedding failed for request {}, treating as cache miss: {}",
                    request.getRequestId(), e.getMessage());
            return null;
        }
    }

    private boolean expire(Map<String, CacheEntry> partition, CacheEntry entry) {
        if (partition.remove(entry.getFingerprint(), entry)) {
            expirations.increment();
            return true;
        }
        return false;
    }

    private void enforceCapacity() {
        evictionLock.lock();
        try {
            if (size() <= config.getMaxEntries()) {
                return;
            }
            sweepExpired();

            Comparator<CacheEntry> leastValuable = Comparator
                    .comparingLong(CacheEntry::getHitCount)
                    .thenComparing(CacheEntry::getCreatedAt);

            while (size() > config.getMaxEntries()) {
                CacheEntry victim = partitions.values().stream()
                        .flatMap(partition -> partition.values().stream())
                        .min(leastValuable)
                        .orElse(null);
                if (victim == null) {
                    break;
                }
                Map<String, CacheEntry> partition = partitions.get(victim.getCapabilityKey());
                if (partition != null && partition.remove(victim.getFingerprint(), victim)) {
                    evictions.increment();
                    log.debug("Evicted cache entry {} (hits={})", victim.getId(), victim.getHitCount());
                }
            }
        } finally {
            evictionLock.unlock();
        }
    }

    private double thresholdFor(InferenceRequest request) {
        String kind = request.getPayload().kind();
        return config.getSimilarityThresholds().getOrDefault(kind, config.getSimilarityThreshold());
    }

    private Duration ttlFor(InferenceRequest request) {
        Duration ttl = config.getTtl().get(request.getVolatility());
        if (ttl == null) {
            ttl = config.getTtl().getOrDefault(Volatility.STANDARD, Duration.ofHours(1));
        }
        return ttl;
    }
}
