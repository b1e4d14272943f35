package com.modelicaformatter.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the formatter: a "general" section shared by all plugins and one
 * section per plugin, as loaded from YAML.
 */
public class FormatterConfig {
    public static final String MODELICA_PLUGIN = "modelica";

    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> pluginConfigs;

    public FormatterConfig(Map<String, Object> generalConfig,
                           Map<String, Map<String, Object>> pluginConfigs) {
        this.generalConfig = generalConfig;
        this.pluginConfigs = pluginConfigs;
    }

    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    public Map<String, Map<String, Object>> getPluginConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : pluginConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    /**
     * Returns a copy with one general value replaced. Used for command-line overrides.
     */
    public FormatterConfig withGeneral(String key, Object value) {
        Map<String, Object> general = getGeneralConfigMap();
        general.put(key, value);
        return new FormatterConfig(general, getPluginConfigsMap());
    }

    /**
     * Returns a copy with one value of a plugin section replaced, creating the section if needed.
     */
    public FormatterConfig withPlugin(String plugin, String key, Object value) {
        Map<String, Map<String, Object>> plugins = getPluginConfigsMap();
        plugins.computeIfAbsent(plugin, k -> new HashMap<>()).put(key, value);
        return new FormatterConfig(getGeneralConfigMap(), plugins);
    }

    @SuppressWarnings("unchecked")
    public <T> T getGeneralConfig(String key, T defaultValue) {
        return (T) _coerce(generalConfig.get(key), defaultValue);
    }

    @SuppressWarnings("unchecked")
    public <T> T getPluginConfig(String plugin, String key, T defaultValue) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        if (pluginConfig == null) {
            return defaultValue;
        }
        return (T) _coerce(pluginConfig.get(key), defaultValue);
    }

    /**
     * Reads a list of strings from a plugin section; scalar values are treated as a one-element list.
     */
    public List<String> getPluginStringList(String plugin, String key, List<String> defaultValue) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        Object value = pluginConfig == null ? null : pluginConfig.get(key);
        if (value == null) {
            return defaultValue;
        }
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        } else {
            result.add(value.toString());
        }
        return result;
    }

    /**
     * Builds the engine options from the general section.
     */
    public FormatOptions toFormatOptions() {
        return new FormatOptions(
                getGeneralConfig("tabWidth", FormatOptions.DEFAULT_TAB_WIDTH),
                getGeneralConfig("printWidth", FormatOptions.DEFAULT_PRINT_WIDTH));
    }

    private static Object _coerce(Object value, Object defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue == null || defaultValue.getClass().isInstance(value)) {
            return value;
        }
        if (defaultValue instanceof Integer && value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (defaultValue instanceof Integer && value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        if (defaultValue instanceof Boolean && value instanceof String) {
            return Boolean.valueOf((String) value);
        }
        if (defaultValue instanceof String) {
            return value.toString();
        }
        if (defaultValue instanceof List && value instanceof List) {
            return value;
        }
        return defaultValue;
    }
}
