package com.modelicaformatter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.modelicaformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads formatter configuration from YAML, filling gaps and replacing out-of-range
 * values with the bundled defaults.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    static final List<String> DEFAULT_TIGHT_IDENTIFIERS = List.of("nUniShc", "nUniHea", "nUniCoo");

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file, falling back to defaults when the file is
     * missing or cannot be parsed.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
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

            return _createConfigFromMap(config);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error parsing configuration file " + configPath + ": " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the configuration bundled on the classpath. The result is cached.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    @SuppressWarnings("unchecked")
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else if (config.containsKey("general")) {
            logger.warning("Invalid 'general' section in config, using defaults");
        }

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        if (config.get("plugins") instanceof Map) {
            Map<String, Object> pluginsMap = (Map<String, Object>) config.get("plugins");

            for (Map.Entry<String, Object> entry : pluginsMap.entrySet()) {
                if (entry.getValue() instanceof Map) {
                    pluginConfigs.put(entry.getKey(), new HashMap<>((Map<String, Object>) entry.getValue()));
                } else {
                    logger.warning("Invalid configuration for plugin '" + entry.getKey() + "', using defaults");
                    pluginConfigs.put(entry.getKey(), new HashMap<>());
                }
            }
        } else if (config.containsKey("plugins")) {
            logger.warning("Invalid 'plugins' section in config, using defaults");
        }

        _validateConfigurationValues(generalConfig, pluginConfigs);

        _ensureDefaultGeneralConfig(generalConfig);
        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    private static void _validateConfigurationValues(Map<String, Object> generalConfig,
                                                     Map<String, Map<String, Object>> pluginConfigs) {
        _validateIntRange(generalConfig, "tabWidth", 1, 16);
        _validateIntRange(generalConfig, "printWidth", 20, 400);

        Map<String, Object> modelicaConfig = pluginConfigs.get(FormatterConfig.MODELICA_PLUGIN);
        if (modelicaConfig != null && modelicaConfig.containsKey("tightIdentifiers")
                && !(modelicaConfig.get("tightIdentifiers") instanceof List)) {
            logger.warning("Configuration value 'tightIdentifiers' must be a list. Using default value.");
            modelicaConfig.remove("tightIdentifiers");
        }
    }

    /**
     * Removes an integer value that is non-numeric or outside [min, max] so the default applies.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (!config.containsKey(key)) {
            return;
        }
        Object raw = config.get(key);
        if (!(raw instanceof Number)) {
            logger.warning("Configuration value '" + key + "' is not a number. Using default value.");
            config.remove(key);
            return;
        }
        int value = ((Number) raw).intValue();
        if (value < min || value > max) {
            logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                    "(" + min + "-" + max + "). Using default value.");
            config.remove(key);
        }
    }

    private static FormatterConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        generalConfig.putIfAbsent("tabWidth", FormatOptions.DEFAULT_TAB_WIDTH);
        generalConfig.putIfAbsent("printWidth", FormatOptions.DEFAULT_PRINT_WIDTH);
        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }
    }

    private static void _ensureDefaultPluginConfigs(Map<String, Map<String, Object>> pluginConfigs) {
        Map<String, Object> modelicaConfig =
                pluginConfigs.computeIfAbsent(FormatterConfig.MODELICA_PLUGIN, k -> new HashMap<>());
        if (!(modelicaConfig.get("tightIdentifiers") instanceof List)) {
            modelicaConfig.put("tightIdentifiers", new ArrayList<>(DEFAULT_TIGHT_IDENTIFIERS));
        }
        if (!(modelicaConfig.get("reportUnbalancedBlocks") instanceof Boolean)) {
            modelicaConfig.put("reportUnbalancedBlocks", false);
        }
        if (!(modelicaConfig.get("extendedSyntax") instanceof Boolean)) {
            modelicaConfig.put("extendedSyntax", false);
        }
    }

    /**
     * Writes configuration as YAML, creating parent directories as needed.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new HashMap<>();
            configMap.put("general", config.getGeneralConfigMap());
            configMap.put("plugins", config.getPluginConfigsMap());

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
