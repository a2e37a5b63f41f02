package com.purchasingpower.timegraph.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class GraphProperties {

    /**
     * Width of one layer-index bucket. Changing it only changes index granularity, never query results.
     */
    @Min(1)
    private int layerDurationDays = 7;
}
