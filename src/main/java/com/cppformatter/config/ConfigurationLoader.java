package com.cppformatter.config;

import com.cppformatter.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads the YAML configuration file, validates it and falls back to the
 * bundled defaults. Unknown option names are dropped here so the formatting
 * core only ever sees a validated {@link FormatConfiguration}.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class.getName());
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    private static final Set<String> KNOWN_FORMAT_OPTIONS = Set.of(
            "indentWidth", "maxLineLength", "continuationIndentMax", "minConditionalIndent",
            "useAllmanBraces", "bindPointerToType", "collapseTemplateCloseAngles", "convertTabsToSpaces");

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.warning("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.fine("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);
            if (config == null) {
                logger.warning("Configuration file is empty: " + configPath + ", using default configuration");
                return loadDefaultConfig();
            }

            FormatterConfig formatterConfig = _createConfigFromMap(config);
            logger.info("Configuration loaded successfully: " + formatterConfig.getFormatConfiguration());

            return formatterConfig;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return FormatterConfig.defaults();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return FormatterConfig.defaults();
        }
    }

    /**
     * Creates a configuration from a parsed Map, with validation.
     */
    @SuppressWarnings("unchecked")
    static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else if (config.containsKey("general")) {
            logger.warning("Invalid 'general' section in config, using defaults");
        }

        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }

        Map<String, Object> formatSection = new HashMap<>();
        if (config.get("format") instanceof Map) {
            formatSection = new HashMap<>((Map<String, Object>) config.get("format"));
        } else {
            logger.warning("Missing or invalid 'format' section in config, using defaults");
        }

        for (String key : new ArrayList<>(formatSection.keySet())) {
            if (!KNOWN_FORMAT_OPTIONS.contains(key)) {
                logger.warning("Ignoring unrecognized format option '" + key + "'");
                formatSection.remove(key);
            }
        }

        _validateIntRange(formatSection, "indentWidth", 1, 8);
        _validateIntRange(formatSection, "maxLineLength", 40, 1000);
        _validateIntRange(formatSection, "continuationIndentMax", 0, 1000);
        _validateIntRange(formatSection, "minConditionalIndent", 0, 40);

        FormatConfiguration.Builder builder = FormatConfiguration.builder();
        _intOption(formatSection, "indentWidth").ifPresent(builder::indentWidth);
        _intOption(formatSection, "maxLineLength").ifPresent(builder::maxLineLength);
        _intOption(formatSection, "continuationIndentMax").ifPresent(builder::continuationIndentMax);
        _intOption(formatSection, "minConditionalIndent").ifPresent(builder::minConditionalIndent);
        _booleanOption(formatSection, "useAllmanBraces").ifPresent(builder::useAllmanBraces);
        _booleanOption(formatSection, "bindPointerToType").ifPresent(builder::bindPointerToType);
        _booleanOption(formatSection, "collapseTemplateCloseAngles").ifPresent(builder::collapseTemplateCloseAngles);
        _booleanOption(formatSection, "convertTabsToSpaces").ifPresent(builder::convertTabsToSpaces);

        return new FormatterConfig(generalConfig, builder.build());
    }

    /**
     * Removes an integer option that is outside the acceptable range so the default applies.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.containsKey(key)) {
            if (!(config.get(key) instanceof Number)) {
                logger.warning("Configuration value '" + key + "' is not a number. Using default value.");
                config.remove(key);
                return;
            }
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        }
    }

    private static Optional<Integer> _intOption(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value instanceof Number) {
            return Optional.of(((Number) value).intValue());
        }
        return Optional.empty();
    }

    private static Optional<Boolean> _booleanOption(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value instanceof Boolean) {
            return Optional.of((Boolean) value);
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
                return Optional.of(Boolean.parseBoolean(text));
            }
        }
        if (value != null) {
            logger.warning("Configuration value '" + key + "' is not a boolean. Using default value.");
        }
        return Optional.empty();
    }

    /**
     * Saves configuration to a file.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            FormatConfiguration format = config.getFormatConfiguration();
            Map<String, Object> formatMap = new LinkedHashMap<>();
            formatMap.put("indentWidth", format.getIndentWidth());
            formatMap.put("maxLineLength", format.getMaxLineLength());
            formatMap.put("continuationIndentMax", format.getContinuationIndentMax());
            formatMap.put("minConditionalIndent", format.getMinConditionalIndent());
            formatMap.put("useAllmanBraces", format.isUseAllmanBraces());
            formatMap.put("bindPointerToType", format.isBindPointerToType());
            formatMap.put("collapseTemplateCloseAngles", format.isCollapseTemplateCloseAngles());
            formatMap.put("convertTabsToSpaces", format.isConvertTabsToSpaces());

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", config.getGeneralConfigMap());
            configMap.put("format", formatMap);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
