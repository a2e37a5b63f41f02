package com.purchasingpower.timegraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

/**
 * Root of the engine configuration, bound from the {@code app} namespace in application.yml.
 *
 * <p>All groups carry usable defaults so components can also be built with
 * {@code new EngineProperties()} outside a Spring context.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class EngineProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private TimeProperties time = new TimeProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GraphProperties graph = new GraphProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private TraversalProperties traversal = new TraversalProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SimilarityProperties similarity = new SimilarityProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private AnalyzerProperties analyzer = new AnalyzerProperties();
}
