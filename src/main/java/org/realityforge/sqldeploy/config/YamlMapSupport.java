package org.realityforge.sqldeploy.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

public final class YamlMapSupport {
    private YamlMapSupport() {}

    public static Map<String, Object> parseRoot(final String yaml, final String sourceName) {
        final LoadSettings settings = LoadSettings.builder()
                .setAllowDuplicateKeys(false)
                .setLabel(sourceName)
                .build();
        final Object loaded;
        try {
            loaded = new Load(settings).loadFromString(yaml);
        } catch (final YamlEngineException yee) {
            throw new ConfigException("Unable to parse " + sourceName + ": " + yee.getMessage(), yee);
        }
        if (null == loaded) {
            return new LinkedHashMap<>();
        }
        if (!(loaded instanceof Map<?, ?> loadedMap)) {
            throw new ConfigException("Expected root object in " + sourceName + " to be a map.");
        }
        return toStringMap(loadedMap, sourceName);
    }

    public static void assertKeys(final Map<String, Object> map, final Set<String> allowedKeys, final String path) {
        for (final String key : map.keySet()) {
            if (!allowedKeys.contains(key)) {
                throw new ConfigException(
                        "Unknown key '" + key + "' at " + path + ". Allowed keys: " + allowedKeys + '.');
            }
        }
    }

    public static @Nullable String optionalString(final Map<String, Object> map, final String key, final String path) {
        final Object value = map.get(key);
        if (null == value) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new ConfigException("Expected string for key '" + key + "' at " + path + '.');
        }
        return text;
    }

    public static @Nullable Boolean optionalBoolean(
            final Map<String, Object> map, final String key, final String path) {
        final Object value = map.get(key);
        if (null == value) {
            return null;
        }
        if (!(value instanceof Boolean flag)) {
            throw new ConfigException("Expected boolean for key '" + key + "' at " + path + '.');
        }
        return flag;
    }

    public static @Nullable Integer optionalInteger(
            final Map<String, Object> map, final String key, final String path) {
        final Object value = map.get(key);
        if (null == value) {
            return null;
        }
        if (!(value instanceof Integer number)) {
            throw new ConfigException("Expected integer for key '" + key + "' at " + path + '.');
        }
        return number;
    }

    public static Map<String, Object> toStringMap(final Map<?, ?> map, final String path) {
        final Map<String, Object> result = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            final Object key = entry.getKey();
            if (!(key instanceof String text)) {
                throw new ConfigException("Expected string map key at " + path + " but got: " + key);
            }
            result.put(text, entry.getValue());
        }
        return result;
    }
}
