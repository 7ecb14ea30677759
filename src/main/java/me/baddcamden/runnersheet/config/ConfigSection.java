package me.baddcamden.runnersheet.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view over a parsed YAML mapping with typed, defaulted accessors.
 * <p>
 * Paths are dot separated ({@code creation.caps.resources}). Numeric accessors accept any YAML
 * number and fall back to the supplied default when the path is missing or holds a non-numeric
 * value.
 */
final class ConfigSection {

    private final Map<String, Object> values;

    ConfigSection(Map<?, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (values != null) {
            for (Map.Entry<?, ?> entry : values.entrySet()) {
                if (entry.getKey() != null) {
                    copy.put(String.valueOf(entry.getKey()), entry.getValue());
                }
            }
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    static ConfigSection empty() {
        return new ConfigSection(Map.of());
    }

    Set<String> getKeys() {
        return new LinkedHashSet<>(values.keySet());
    }

    boolean isSet(String path) {
        return get(path) != null;
    }

    Object get(String path) {
        int dot = path.indexOf('.');
        if (dot < 0) {
            return values.get(path);
        }
        ConfigSection child = getSection(path.substring(0, dot));
        return child == null ? null : child.get(path.substring(dot + 1));
    }

    /**
     * Nested section at {@code path}, or {@code null} when the path is missing or not a mapping.
     */
    ConfigSection getSection(String path) {
        Object value = get(path);
        return value instanceof Map<?, ?> map ? new ConfigSection(map) : null;
    }

    List<?> getList(String path) {
        Object value = get(path);
        return value instanceof List<?> list ? list : List.of();
    }

    int getInt(String path, int fallback) {
        return get(path) instanceof Number number ? number.intValue() : fallback;
    }

    double getDouble(String path, double fallback) {
        return get(path) instanceof Number number ? number.doubleValue() : fallback;
    }

    boolean getBoolean(String path, boolean fallback) {
        return get(path) instanceof Boolean flag ? flag : fallback;
    }

    String getString(String path, String fallback) {
        Object value = get(path);
        return value == null ? fallback : String.valueOf(value);
    }
}
