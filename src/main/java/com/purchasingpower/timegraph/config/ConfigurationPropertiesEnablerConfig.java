package com.purchasingpower.timegraph.config;

import com.purchasingpower.timegraph.configuration.EngineProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the engine's {@code @ConfigurationProperties} tree with Spring's binder.
 *
 * <p>{@link EngineProperties} is not itself a component, so it is only bound when enabled here.
 * Its nested groups (time, graph, traversal, similarity, analyzer) are bound through it.
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class ConfigurationPropertiesEnablerConfig {
    // Binding only; no additional beans.
}
