package com.security.anomaly.engine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Strict conversion of settings values received as JSON. Anything that does not
 * parse is rejected with IllegalArgumentException naming the offending key.
 */
public final class SettingValues {

    private SettingValues() {}

    public static double toDouble(String key, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw invalid(key, value, "a number");
            }
        }
        throw invalid(key, value, "a number");
    }

    public static int toInt(String key, Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            long longValue = ((Number) value).longValue();
            if (longValue > Integer.MAX_VALUE || longValue < Integer.MIN_VALUE) {
                throw invalid(key, value, "an integer");
            }
            return (int) longValue;
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw invalid(key, value, "an integer");
            }
        }
        throw invalid(key, value, "an integer");
    }

    public static boolean toBool(String key, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if ("true".equalsIgnoreCase(trimmed)) return true;
            if ("false".equalsIgnoreCase(trimmed)) return false;
        }
        throw invalid(key, value, "a boolean");
    }

    /**
     * Window table such as {"60": 30, "300": 100}: positive window seconds to positive counts.
     */
    public static Map<Long, Integer> toWindowTable(String key, Object value) {
        if (!(value instanceof Map<?, ?> raw)) {
            throw invalid(key, value, "an object of window seconds to counts");
        }
        Map<Long, Integer> table = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            long window;
            try {
                window = Long.parseLong(String.valueOf(entry.getKey()).trim());
            } catch (NumberFormatException e) {
                throw invalid(key, entry.getKey(), "window seconds");
            }
            int count = toInt(key + "." + window, entry.getValue());
            if (window <= 0 || count <= 0) {
                throw new IllegalArgumentException(key + " entries must be positive, got " + window + "=" + count);
            }
            table.put(window, count);
        }
        return table;
    }

    public static void requireRange(String key, double value, double min, double max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(key + " must be between " + min + " and " + max + ", got " + value);
        }
    }

    public static void requirePositive(String key, double value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, got " + value);
        }
    }

    private static IllegalArgumentException invalid(String key, Object value, String expected) {
        return new IllegalArgumentException("Invalid value for " + key + ": " + value + " (expected " + expected + ")");
    }
}
