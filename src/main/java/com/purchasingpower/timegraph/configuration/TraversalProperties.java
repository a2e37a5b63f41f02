package com.purchasingpower.timegraph.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Defaults used by the convenience overloads of the traversal service.
 */
@Data
public class TraversalProperties {

    @Min(0)
    private int defaultTimeWindowDays = 365;

    @Min(0)
    private int defaultMaxHops = 5;

    @Min(1)
    private int defaultMaxResults = 50;

    @Min(0)
    private int pathMaxHops = 10;
}
