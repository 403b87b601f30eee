package com.partsbin.config;

import com.partsbin.core.match.MatcherSettings;
import com.partsbin.integration.inventory.RetryPolicy;
import com.partsbin.logging.AppLogger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central entry point for configuration. A key resolves from, in order: system property, environment
 * variable ({@code storage.locationMap} becomes {@code STORAGE_LOCATION_MAP}), persisted preference,
 * and the bundled {@code storage.properties} defaults.
 */
public final class ConfigService {
    public static final String LOCATION_MAP = "storage.locationMap";
    public static final String REFERENCE_DATASET = "storage.reference";
    public static final String TOPOLOGY = "storage.topology";
    public static final String INVENTORY_SNAPSHOT = "storage.inventorySnapshot";
    public static final String MATCH_THRESHOLD = "storage.match.threshold";
    public static final String RETRY_ATTEMPTS = "storage.retry.attempts";
    public static final String RETRY_INITIAL_DELAY_MS = "storage.retry.initialDelayMs";

    private static final String DEFAULTS_RESOURCE = "/storage.properties";

    private static final Logger LOGGER = AppLogger.get();

    private static final ConfigService INSTANCE =
        new ConfigService(PreferencesStore.global(), System::getenv, loadDefaults());

    private final PreferencesStore preferences;
    private final UnaryOperator<String> environment;
    private final Properties defaults;

    ConfigService(PreferencesStore preferences, UnaryOperator<String> environment, Properties defaults) {
        this.preferences = Objects.requireNonNull(preferences, "preferences");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    public Optional<String> resolve(String key) {
        String override = System.getProperty(key);
        if (override != null && !override.isBlank()) {
            return Optional.of(override.trim());
        }
        String fromEnv = environment.apply(environmentName(key));
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Optional.of(fromEnv.trim());
        }
        Optional<String> persisted = preferences.getString(key);
        if (persisted.isPresent()) {
            return persisted.map(String::trim);
        }
        String fallback = defaults.getProperty(key);
        return fallback == null || fallback.isBlank() ? Optional.empty() : Optional.of(fallback.trim());
    }

    public Path getLocationMapPath() {
        return requirePath(LOCATION_MAP);
    }

    public void setLocationMapPath(Path path) {
        preferences.putPath(LOCATION_MAP, path);
    }

    public Path getReferenceDatasetPath() {
        return requirePath(REFERENCE_DATASET);
    }

    public void setReferenceDatasetPath(Path path) {
        preferences.putPath(REFERENCE_DATASET, path);
    }

    public Path getInventorySnapshotPath() {
        return requirePath(INVENTORY_SNAPSHOT);
    }

    public void setInventorySnapshotPath(Path path) {
        preferences.putPath(INVENTORY_SNAPSHOT, path);
    }

    /**
     * Topology file, or empty to use the bundled default layout.
     */
    public Optional<Path> getTopologyPath() {
        return resolve(TOPOLOGY).map(Path::of);
    }

    public double getMatchThreshold() {
        return resolve(MATCH_THRESHOLD)
            .map(raw -> parseDouble(MATCH_THRESHOLD, raw, MatcherSettings.DEFAULT_THRESHOLD))
            .orElse(MatcherSettings.DEFAULT_THRESHOLD);
    }

    public MatcherSettings getMatcherSettings() {
        return MatcherSettings.defaults().withThreshold(getMatchThreshold());
    }

    public RetryPolicy getRetryPolicy() {
        int attempts = resolve(RETRY_ATTEMPTS)
            .map(raw -> parseInt(RETRY_ATTEMPTS, raw, RetryPolicy.DEFAULT_ATTEMPTS))
            .orElse(RetryPolicy.DEFAULT_ATTEMPTS);
        long delayMs = resolve(RETRY_INITIAL_DELAY_MS)
            .map(raw -> (long) parseInt(RETRY_INITIAL_DELAY_MS, raw, (int) RetryPolicy.DEFAULT_INITIAL_DELAY.toMillis()))
            .orElse(RetryPolicy.DEFAULT_INITIAL_DELAY.toMillis());
        Duration initialDelay = Duration.ofMillis(Math.max(0, delayMs));
        Duration maxDelay = initialDelay.compareTo(RetryPolicy.DEFAULT_MAX_DELAY) > 0 ? initialDelay : RetryPolicy.DEFAULT_MAX_DELAY;
        return new RetryPolicy(Math.max(1, attempts), initialDelay, RetryPolicy.DEFAULT_MULTIPLIER, maxDelay);
    }

    static String environmentName(String key) {
        StringBuilder builder = new StringBuilder(key.length() + 4);
        for (char c : key.toCharArray()) {
            if (c == '.') {
                builder.append('_');
            } else if (Character.isUpperCase(c)) {
                builder.append('_').append(c);
            } else {
                builder.append(Character.toUpperCase(c));
            }
        }
        return builder.toString().toUpperCase(Locale.ROOT);
    }

    private Path requirePath(String key) {
        return resolve(key).map(Path::of)
            .orElseThrow(() -> new IllegalStateException("No value configured for " + key));
    }

    private static double parseDouble(String key, String raw, double fallback) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            LOGGER.warning("Ignoring invalid %s '%s', using %s".formatted(key, raw, fallback));
            return fallback;
        }
    }

    private static int parseInt(String key, String raw, int fallback) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            LOGGER.warning("Ignoring invalid %s '%s', using %d".formatted(key, raw, fallback));
            return fallback;
        }
    }

    static Properties loadDefaults() {
        Properties properties = new Properties();
        try (InputStream input = ConfigService.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (input != null) {
                properties.load(input);
            }
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Could not read " + DEFAULTS_RESOURCE, ex);
        }
        return properties;
    }
}
