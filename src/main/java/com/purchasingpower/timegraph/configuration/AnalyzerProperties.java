package com.purchasingpower.timegraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * Settings of the chunked analyzer.
 *
 * <p>The carryover capacities are what keeps a run at constant memory: they bound the state passed
 * from one window to the next regardless of how many documents the graph holds.
 */
@Data
public class AnalyzerProperties {

    @Min(1)
    private int chunkSizeDays = 90;

    @Min(0)
    private int maxDays = 1825;

    @Min(1)
    private int maxCarryoverEvents = 10;

    @Min(1)
    private int maxCarryoverEntities = 15;

    @Min(1)
    private int maxCarryoverChains = 20;

    /** Carried chains keep only their most recent documents. */
    @Min(2)
    private int maxChainLength = 50;

    @Min(1)
    private int maxAttentionScores = 20;

    @Min(1)
    private int maxOpenQuestions = 10;

    @Min(1)
    private int minEntityMentions = 2;

    @Min(1)
    private int minEntityLength = 5;

    /** Characters of document content kept in a critical event summary. */
    @Min(10)
    private int summaryLength = 100;

    /** Hop bound when following carried documents into the current window. */
    @Min(1)
    private int continuationMaxHops = 3;

    /** Score window documents on the common fork-join pool. Output order is unaffected. */
    private boolean parallelScoring = false;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ImportanceWeights weights = new ImportanceWeights();
}
