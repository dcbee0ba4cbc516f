package com.e2eq.argumentation.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;

import java.util.Map;

/**
 * Builds {@link ReasoningOptions} outside a CDI container, from system properties, environment
 * variables and {@code META-INF/microprofile-config.properties}.
 */
public final class ReasoningConfigLoader {
    private ReasoningConfigLoader() {}

    static final int OVERRIDE_ORDINAL = 500;

    public static ReasoningConfig loadConfig() {
        return loadConfig(Map.of());
    }

    /**
     * @param overrides properties that win over every other source, keyed by full property name
     */
    public static ReasoningConfig loadConfig(Map<String, String> overrides) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(overrides, "reasoning-overrides", OVERRIDE_ORDINAL))
                .withMapping(ReasoningConfig.class)
                .build();
        return config.getConfigMapping(ReasoningConfig.class);
    }

    /**
     * Reads the mapping from an existing configuration, which must be backed by SmallRye Config
     * and have {@link ReasoningConfig} registered as a mapping.
     */
    public static ReasoningOptions load(Config config) {
        return ReasoningOptions.fromConfig(config.unwrap(SmallRyeConfig.class).getConfigMapping(ReasoningConfig.class));
    }

    public static ReasoningOptions load() {
        return ReasoningOptions.fromConfig(loadConfig());
    }

    public static ReasoningOptions load(Map<String, String> overrides) {
        return ReasoningOptions.fromConfig(loadConfig(overrides));
    }
}
