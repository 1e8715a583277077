package com.modelgateway.service.registry;

import com.modelgateway.config.GatewayProperties;
import com.modelgateway.model.ModelDescriptor;

import java.util.List;

/**
 * Catalog declared inline under {@code gateway.models}.
 */
public class PropertiesCatalogSource implements CatalogSource {

    private final GatewayProperties properties;

    public PropertiesCatalogSource(GatewayProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<ModelDescriptor> load() {
        return properties.getModels().stream()
                .map(PropertiesCatalogSource::toDescriptor)
                .toList();
    }

    @Override
    public String describe() {
        return "gateway.models";
    }

    static ModelDescriptor toDescriptor(GatewayProperties.ModelConfig config) {
        return ModelDescriptor.builder()
                .id(config.getId())
                .provider(config.getProvider())
                .capabilities(config.getCapabilities())
                .inputCostPer1k(config.getInputCostPer1k())
                .outputCostPer1k(config.getOutputCostPer1k())
                .maxContextTokens(config.getMaxContextTokens())
                .latencyClass(config.getLatencyClass())
                .enabled(config.isEnabled())
                .regions(config.getRegions())
                .qualityScores(config.getQualityScores())
                .build();
    }
}
