package com.modelgateway.config;

import com.modelgateway.model.Capability;
import com.modelgateway.model.LatencyClass;
import com.modelgateway.model.RoutingStrategy;
import com.modelgateway.model.Volatility;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the model gateway.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private Map<String, ProviderConfig> providers = new HashMap<>();
    private List<ModelConfig> models = new ArrayList<>();
    private CatalogConfig catalog = new CatalogConfig();
    @Valid
    private RateLimitConfig rateLimit = new RateLimitConfig();
    @Valid
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    @Valid
    private CacheConfig cache = new CacheConfig();
    @Valid
    private EmbeddingConfig embedding = new EmbeddingConfig();
    @Valid
    private QueueConfig queue = new QueueConfig();
    @Valid
    private RouterConfig router = new RouterConfig();
    @Valid
    private WorkerConfig workers = new WorkerConfig();

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(60);
    }

    /**
     * Inline catalog entry. Converted to an immutable descriptor on load.
     */
    @Data
    public static class ModelConfig {
        private String id;
        private String provider;
        private Set<Capability> capabilities = new HashSet<>();
        private double inputCostPer1k;
        private double outputCostPer1k;
        private int maxContextTokens;
        private LatencyClass latencyClass = LatencyClass.STANDARD;
        private boolean enabled = true;
        private Set<String> regions = new HashSet<>();
        private Map<String, Double> qualityScores = new HashMap<>();
    }

    @Data
    public static class CatalogConfig {
        /**
         * JSON catalog file. When set it replaces the inline model list.
         */
        private String location;
    }

    @Data
    public static class RateLimitConfig {
        private boolean enabled = true;
        @Positive
        private long defaultCapacity = 100_000;
        @Positive
        private double defaultRefillPerSecond = 1_000;
        private Map<String, BucketConfig> providers = new HashMap<>();
        private Duration idleTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class BucketConfig {
        private long capacity;
        private double refillPerSecond;
    }

    @Data
    public static class CircuitBreakerConfig {
        @Min(1)
        private int failureThreshold = 5;
        private Duration failureWindow = Duration.ofSeconds(60);
        private Duration cooldown = Duration.ofSeconds(30);
        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;
        private Duration maxCooldown = Duration.ofMinutes(10);
        private Duration recoveryWindow = Duration.ofSeconds(60);
        @Min(1)
        private int recoveryMinSuccesses = 3;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double similarityThreshold = 0.85;
        /**
         * Per payload kind (chat, embedding, vision, opaque) overrides of the threshold.
         */
        private Map<String, Double> similarityThresholds = new HashMap<>();
        private Map<Volatility, Duration> ttl = defaultTtls();
        @Min(1)
        private int maxEntries = 10_000;
        private Duration sweepInterval = Duration.ofMinutes(1);

        private static Map<Volatility, Duration> defaultTtls() {
            Map<Volatility, Duration> ttls = new EnumMap<>(Volatility.class);
            ttls.put(Volatility.VOLATILE, Duration.ofMinutes(5));
            ttls.put(Volatility.STANDARD, Duration.ofHours(1));
            ttls.put(Volatility.STABLE, Duration.ofHours(24));
            return ttls;
        }
    }

    @Data
    public static class EmbeddingConfig {
        /**
         * "hashing" (local, default) or "ollama".
         */
        private String provider = "hashing";
        private String baseUrl = "http://localhost:11434";
        private String model = "nomic-embed-text";
        @Min(1)
        private int dimensions = 384;
        private Duration timeout = Duration.ofSeconds(2);
    }

    @Data
    public static class QueueConfig {
        @Min(1)
        private int maxDepth = 1_000;
        /**
         * Consecutive dequeues granted to a caller per round-robin turn. Default 1.
         */
        private Map<String, Integer> callerWeights = new HashMap<>();
        private Duration sweepInterval = Duration.ofSeconds(1);
    }

    @Data
    public static class RouterConfig {
        /**
         * Additional candidates tried after the primary fails transiently.
         */
        @Min(0)
        private int maxFailover = 2;
        /**
         * Upper bound for one provider call when the request has no deadline.
         */
        private Duration invokeTimeout = Duration.ofSeconds(60);
        /**
         * Ranking used when a request names no strategy.
         */
        private RoutingStrategy defaultStrategy = RoutingStrategy.COST;
    }

    @Data
    public static class WorkerConfig {
        @Min(1)
        private int poolSize = 16;
        private Duration pollTimeout = Duration.ofMillis(500);
    }
}
