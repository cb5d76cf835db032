package com.cppformatter.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the formatter: tool-level settings plus the
 * already-validated formatting rules.
 */
public class FormatterConfig {
    private final Map<String, Object> generalConfig;
    private final FormatConfiguration formatConfiguration;

    public FormatterConfig(Map<String, Object> generalConfig, FormatConfiguration formatConfiguration) {
        this.generalConfig = generalConfig;
        this.formatConfiguration = formatConfiguration;
    }

    /**
     * Configuration with built-in defaults and no ignore patterns.
     */
    public static FormatterConfig defaults() {
        Map<String, Object> general = new HashMap<>();
        general.put("ignoreFiles", new ArrayList<String>());
        return new FormatterConfig(general, FormatConfiguration.defaults());
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    public FormatConfiguration getFormatConfiguration() {
        return formatConfiguration;
    }

    @SuppressWarnings("unchecked")
    public <T> T getGeneralConfig(String key, T defaultValue) {
        Object value = generalConfig.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            if (defaultValue instanceof Integer && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            } else if (defaultValue instanceof Boolean && value instanceof String) {
                return (T) Boolean.valueOf(value.toString());
            } else if (defaultValue instanceof String) {
                return (T) value.toString();
            }
            return defaultValue;
        }
        return (T) value;
    }

    @SuppressWarnings("unchecked")
    public List<String> getIgnorePatterns() {
        Object value = generalConfig.get("ignoreFiles");
        if (value instanceof List) {
            List<String> patterns = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                patterns.add(String.valueOf(item));
            }
            return patterns;
        }
        return new ArrayList<>();
    }
}
