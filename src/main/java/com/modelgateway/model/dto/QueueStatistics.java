package com.modelgateway.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Admission queue counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatistics {

    private int depth;
    private int maxDepth;
    private long accepted;
    private long rejected;
    private long expired;
    private long dequeued;

    /**
     * Queued requests per priority tier.
     */
    private Map<Integer, Integer> depthByPriority;
}
