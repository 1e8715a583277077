package com.modelgateway.service.registry;

import com.modelgateway.MutableClock;
import com.modelgateway.config.GatewayProperties;
import com.modelgateway.config.JacksonConfiguration;
import com.modelgateway.exception.InvalidCatalogException;
import com.modelgateway.exception.ModelNotFoundException;
import com.modelgateway.model.Capability;
import com.modelgateway.model.LatencyClass;
import com.modelgateway.model.ModelDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for ModelRegistry and its catalog sources.
 */
class ModelRegistryTest {

    private MutableClock clock;
    private CatalogSource source;
    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        source = mock(CatalogSource.class);
        when(source.describe()).thenReturn("test");
        registry = new ModelRegistry(source, clock);
    }

    @Test
    void testEmptyBeforeFirstLoad() {
        assertEquals(0, registry.snapshot().size());
        assertEquals(0, registry.snapshot().getVersion());
    }

    @Test
    void testReloadPublishesSnapshot() {
        when(source.load()).thenReturn(List.of(
                model("gpt-4o", "openai", Capability.CHAT, Capability.VISION),
                model("text-embedding-3-small", "openai", Capability.EMBEDDINGS),
                model("claude-3-5-sonnet", "anthropic", Capability.CHAT)));

        CatalogSnapshot snapshot = registry.reload();

        assertEquals(1, snapshot.getVersion());
        assertEquals(clock.instant(), snapshot.getLoadedAt());
        assertEquals(3, snapshot.size());
        assertEquals(List.of("anthropic", "openai"), snapshot.providers());
        assertEquals(2, registry.list(Capability.CHAT).size());
        assertEquals("gpt-4o", registry.get("gpt-4o").getId());
    }

    @Test
    void testListByCapabilitySetRequiresAll() {
        registry.replace(List.of(
                model("gpt-4o", "openai", Capability.CHAT, Capability.VISION),
                model("claude-3-5-sonnet", "anthropic", Capability.CHAT)));

        List<ModelDescriptor> models = registry.snapshot().list(Set.of(Capability.CHAT, Capability.VISION));

        assertEquals(1, models.size());
        assertEquals("gpt-4o", models.get(0).getId());
    }

    @Test
    void testDisabledModelsAreNotListed() {
        registry.replace(List.of(
                model("gpt-4o", "openai", Capability.CHAT).toBuilder().enabled(false).build(),
                model("claude-3-5-sonnet", "anthropic", Capability.CHAT)));

        assertEquals(1, registry.list(Capability.CHAT).size());
        assertFalse(registry.get("gpt-4o").isEnabled());
    }

    @Test
    void testUnknownModelThrows() {
        assertThrows(ModelNotFoundException.class, () -> registry.get("missing"));
    }

    @Test
    void testFailedReloadKeepsCurrentSnapshot() {
        when(source.load()).thenReturn(List.of(model("gpt-4o", "openai", Capability.CHAT)));
        CatalogSnapshot first = registry.reload();

        when(source.load()).thenReturn(List.of(
                model("gpt-4o", "openai", Capability.CHAT),
                model("gpt-4o", "azure", Capability.CHAT)));

        assertThrows(InvalidCatalogException.class, () -> registry.reload());
        assertSame(first, registry.snapshot());
    }

    @Test
    void testInvalidDescriptorsAreRejected() {
        assertThrows(InvalidCatalogException.class,
                () -> registry.replace(List.of(model("m", "openai", Capability.CHAT).toBuilder().maxContextTokens(0).build())));
        assertThrows(InvalidCatalogException.class,
                () -> registry.replace(List.of(model("m", "openai", Capability.CHAT).toBuilder().inputCostPer1k(-1).build())));
        assertThrows(InvalidCatalogException.class,
                () -> registry.replace(List.of(model("m", null, Capability.CHAT))));
        assertThrows(InvalidCatalogException.class,
                () -> registry.replace(List.of(ModelDescriptor.builder().id("m").provider("openai").maxContextTokens(10).build())));
    }

    @Test
    void testPropertiesCatalogSource() {
        GatewayProperties properties = new GatewayProperties();
        GatewayProperties.ModelConfig config = new GatewayProperties.ModelConfig();
        config.setId("llama3.1");
        config.setProvider("ollama");
        config.setCapabilities(Set.of(Capability.CHAT));
        config.setMaxContextTokens(8192);
        config.setLatencyClass(LatencyClass.SLOW);
        config.setRegions(Set.of("local"));
        config.getQualityScores().put("coding", 0.55);
        properties.getModels().add(config);

        List<ModelDescriptor> models = new PropertiesCatalogSource(properties).load();

        assertEquals(1, models.size());
        ModelDescriptor model = models.get(0);
        assertEquals("ollama", model.getProvider());
        assertEquals(LatencyClass.SLOW, model.getLatencyClass());
        assertEquals(Set.of("local"), model.getRegions());
        assertEquals(0.55, model.qualityScore("coding"), 1e-9);
        assertEquals(0.0, model.qualityScore("reasoning"));
        assertTrue(model.isEnabled());
    }

    @Test
    void testJsonFileCatalogSource(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("catalog.json");
        Files.writeString(file, "[{\"id\":\"gpt-4o-mini\",\"provider\":\"openai\","
                + "\"capabilities\":[\"CHAT\",\"VISION\"],\"inputCostPer1k\":0.00015,"
                + "\"outputCostPer1k\":0.0006,\"maxContextTokens\":128000,\"latencyClass\":\"FAST\","
                + "\"qualityScores\":{\"reasoning\":0.7}}]");
        ModelRegistry fileRegistry = new ModelRegistry(
                new JsonFileCatalogSource(file, JacksonConfiguration.createObjectMapper()), clock);

        CatalogSnapshot snapshot = fileRegistry.reload();

        ModelDescriptor model = snapshot.get("gpt-4o-mini").orElseThrow();
        assertEquals(Set.of(Capability.CHAT, Capability.VISION), model.getCapabilities());
        assertEquals(LatencyClass.FAST, model.getLatencyClass());
        assertEquals(0.7, model.qualityScore("reasoning"), 1e-9);
        assertTrue(model.isEnabled());
    }

    @Test
    void testMissingCatalogFileFailsReload(@TempDir Path dir) {
        ModelRegistry fileRegistry = new ModelRegistry(
                new JsonFileCatalogSource(dir.resolve("missing.json"), JacksonConfiguration.createObjectMapper()), clock);

        assertThrows(InvalidCatalogException.class, fileRegistry::reload);
        assertEquals(0, fileRegistry.snapshot().size());
    }

    static ModelDescriptor model(String id, String provider, Capability... capabilities) {
        return ModelDescriptor.builder()
                .id(id)
                .provider(provider)
                .capabilities(List.of(capabilities))
                .inputCostPer1k(0.001)
                .outputCostPer1k(0.002)
                .maxContextTokens(128_000)
                .build();
    }
}
