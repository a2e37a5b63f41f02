package com.purchasingpower.timegraph.model.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetrics {

    private double totalProcessingTimeMs;
    private int totalDocuments;
    private double avgChunkTimeMs;
    private double avgChunkSize;

    /** Modelled cost of analysing every document pair at once. */
    private double estimatedUnwindowedTimeMs;

    /** {@code estimatedUnwindowedTimeMs / totalProcessingTimeMs}; null when no time was measured. */
    private Double speedupFactor;
}
