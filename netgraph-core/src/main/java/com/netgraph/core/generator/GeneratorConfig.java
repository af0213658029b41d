package com.netgraph.core.generator;

import java.util.Map;

/**
 * Configuration for artifact generation.
 *
 * @param headerComment whether generated source starts with a comment header
 * @param customSettings generator-specific custom settings
 */
public record GeneratorConfig(
    boolean headerComment,
    Map<String, Object> customSettings
) {
    /** Setting key overriding an artifact's base file name */
    public static final String BASE_NAME = "baseName";

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        customSettings = customSettings == null ? Map.of() : Map.copyOf(customSettings);
    }

    /**
     * Creates a default configuration.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(false, Map.of());
    }

    /**
     * Gets a custom setting value.
     *
     * @param key setting key
     * @param <T> expected type
     * @return setting value or null
     */
    @SuppressWarnings("unchecked")
    public <T> T getSetting(String key) {
        return (T) customSettings.get(key);
    }

    /**
     * Gets a custom setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @param <T> expected type
     * @return setting value or default
     */
    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Returns the configured artifact base name.
     *
     * @param defaultName generator's own default
     * @return configured or default base name
     */
    public String baseName(String defaultName) {
        return getSettingOrDefault(BASE_NAME, defaultName);
    }
}
