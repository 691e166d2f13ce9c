package io.ringbag.storage;

import io.ringbag.core.error.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Opaque, backend-specific settings with typed accessors. Each backend reads the keys it knows about.
 */
public final class BackendConfig {
    private static final BackendConfig EMPTY = new BackendConfig(Map.of());

    private final Map<String, Object> values;

    private BackendConfig(final Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static BackendConfig of(final Map<String, ?> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        return new BackendConfig(values);
    }

    public static BackendConfig empty() {
        return EMPTY;
    }

    public int intValue(final String key, final int defaultValue) {
        final Object v = values.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
            try {
                return Math.toIntExact(((Number) v).longValue());
            } catch (final ArithmeticException e) {
                throw new ConfigurationException("Backend option '" + key + "' is out of range: " + v, e);
            }
        }
        // BigInteger, decimals and strings go through the parser, which rejects anything outside int range.
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (final NumberFormatException e) {
            throw new ConfigurationException("Backend option '" + key + "' is not an integer in range: " + v, e);
        }
    }

    public boolean booleanValue(final String key, final boolean defaultValue) {
        final Object v = values.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Boolean b) return b;
        final String s = v.toString().trim();
        if ("true".equalsIgnoreCase(s)) return true;
        if ("false".equalsIgnoreCase(s)) return false;
        throw new ConfigurationException("Backend option '" + key + "' is not a boolean: " + v);
    }

    @Override
    public String toString() {
        return "BackendConfig" + values;
    }
}
