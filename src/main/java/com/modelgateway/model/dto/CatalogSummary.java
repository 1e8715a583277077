package com.modelgateway.model.dto;

import com.modelgateway.model.Capability;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Identity and shape of the published model catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogSummary {

    private long version;
    private Instant loadedAt;
    private int models;
    private List<String> providers;
    private List<Capability> capabilities;
}
