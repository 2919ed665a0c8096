package com.bikerly.util;

import org.springframework.core.env.Environment;

/**
 * Utility class for safely reading configuration properties.
 * Blank values count as missing.
 */
public final class ConfigHelper {

    private ConfigHelper() {
        // Utility class
    }

    /**
     * Reads an optional configuration property with a default value.
     *
     * @param env The Spring Environment
     * @param key The property key
     * @param defaultValue The default value to use if the property is missing or blank
     * @return The property value or defaultValue if missing/blank
     */
    public static String optionalProperty(Environment env, String key, String defaultValue) {
        String value = env.getProperty(key);
        if (isBlank(value)) {
            return defaultValue != null ? defaultValue : "";
        }
        return value;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
