package com.airquality.karachi.utils;

import com.airquality.karachi.models.WindowPolicy;

import java.util.Locale;
import java.util.Optional;

/**
 * Configuration loader from environment variables.
 * No hardcoded secrets, fails fast on missing required keys.
 */
public final class ConfigLoader {

    private ConfigLoader() {}

    // --- Raw input ---
    public static String rawAirPath() {
        return getRequired("RAW_AIR_PATH");
    }

    /** Local snapshot used when the primary raw source cannot be read. */
    public static Optional<String> rawAirBackupPath() {
        return getOptional("RAW_AIR_BACKUP_PATH");
    }

    public static Optional<String> rawWeatherPath() {
        return getOptional("RAW_WEATHER_PATH");
    }

    // --- Output artifacts ---
    public static String featureTablePath() {
        return getOrDefault("FEATURE_TABLE_PATH", "features_data.csv");
    }

    public static String featureSpecPath() {
        return getOrDefault("FEATURE_SPEC_PATH", "feature_columns.json");
    }

    // --- Feature settings (compact formats parsed by PipelineConfig) ---
    public static Optional<String> featureChannels() {
        return getOptional("FEATURE_CHANNELS");
    }

    public static Optional<String> featureLags() {
        return getOptional("FEATURE_LAGS");
    }

    public static Optional<String> featureWindows() {
        return getOptional("FEATURE_WINDOWS");
    }

    public static Optional<String> featureTargets() {
        return getOptional("FEATURE_TARGETS");
    }

    public static WindowPolicy windowPolicy() {
        String value = getOrDefault("WINDOW_POLICY", "FULL");
        try {
            return WindowPolicy.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                    "FATAL: WINDOW_POLICY must be FULL or PARTIAL, got: " + value, e);
        }
    }

    public static double ratioEpsilon() {
        return Double.parseDouble(getOrDefault("RATIO_EPSILON", "1e-5"));
    }

    public static double imputeDefault() {
        return Double.parseDouble(getOrDefault("IMPUTE_DEFAULT", "0.0"));
    }

    public static boolean retainCalendarFields() {
        return Boolean.parseBoolean(getOrDefault("RETAIN_CALENDAR_FIELDS", "false"));
    }

    public static int schemaVersion() {
        return Integer.parseInt(getOrDefault("SCHEMA_VERSION", "1"));
    }

    // --- Redis Settings ---
    public static boolean redisEnabled() {
        return Boolean.parseBoolean(getOrDefault("REDIS_ENABLED", "false"));
    }

    public static String redisHost() {
        return getOrDefault("REDIS_HOST", "redis");
    }

    public static int redisPort() {
        return Integer.parseInt(getOrDefault("REDIS_PORT", "6379"));
    }

    public static String redisPassword() {
        return getRequired("REDIS_PASSWORD");
    }

    public static String redisKeyPrefix() {
        return getOrDefault("REDIS_KEY_PREFIX", "features:karachi_aqi:");
    }

    // --- Helper Methods ---
    private static String getRequired(String key) {
        return getOptional(key)
                .orElseThrow(() -> new IllegalStateException(
                        "FATAL: Required environment variable not set or empty: " + key));
    }

    private static Optional<String> getOptional(String key) {
        return Optional.ofNullable(System.getenv(key))
                .filter(s -> !s.isEmpty());
    }

    private static String getOrDefault(String key, String defaultValue) {
        return getOptional(key).orElse(defaultValue);
    }
}
