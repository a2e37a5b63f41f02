package com.purchasingpower.timegraph.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class SimilarityProperties {

    /** Tokens shorter than this are ignored when building term vectors. */
    @Min(1)
    private int minTokenLength = 3;

    /** Upper bound on memoized pair scores; least recently used pairs are evicted first. */
    @Min(1)
    private long pairCacheMaxSize = 100_000;

    /** Time window used when collecting attention candidates. */
    @Min(0)
    private int attentionTimeWindowDays = 90;

    @Min(0)
    private int attentionMaxHops = 5;
}
