package com.purchasingpower.timegraph.configuration;

import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

/**
 * Relative weights of the importance score terms. These are tuning knobs with no benchmarked
 * optimum; each term is in [0, 1] so the score stays in [0, sum of weights].
 */
@Data
public class ImportanceWeights {

    @DecimalMin("0.0")
    private double connectivity = 0.5;

    @DecimalMin("0.0")
    private double attention = 0.3;

    @DecimalMin("0.0")
    private double recency = 0.2;
}
