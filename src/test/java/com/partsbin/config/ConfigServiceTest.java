package com.partsbin.config;

import com.partsbin.integration.inventory.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigServiceTest {

    private final Map<String, String> environment = new HashMap<>();
    private final Properties defaults = new Properties();
    private Preferences node;
    private ConfigService config;

    @BeforeEach
    void setUp() {
        node = Preferences.userRoot().node("com/partsbin/test/" + UUID.randomUUID());
        defaults.setProperty(ConfigService.LOCATION_MAP, "location-map.json");
        defaults.setProperty(ConfigService.MATCH_THRESHOLD, "0.8");
        config = new ConfigService(PreferencesStore.forNode(node), environment::get, defaults);
    }

    @AfterEach
    void tearDown() throws BackingStoreException {
        System.clearProperty(ConfigService.LOCATION_MAP);
        node.removeNode();
    }

    @Test
    void resolvesInPrecedenceOrder() {
        assertEquals(Path.of("location-map.json"), config.getLocationMapPath());

        config.setLocationMapPath(Path.of("prefs", "map.json"));
        assertEquals(Path.of("prefs", "map.json"), config.getLocationMapPath());

        environment.put("STORAGE_LOCATION_MAP", "/env/map.json");
        assertEquals(Path.of("/env/map.json"), config.getLocationMapPath());

        System.setProperty(ConfigService.LOCATION_MAP, "/sys/map.json");
        assertEquals(Path.of("/sys/map.json"), config.getLocationMapPath());
    }

    @Test
    void missingRequiredPathFails() {
        IllegalStateException ex = assertThrows(IllegalStateException.class, config::getReferenceDatasetPath);
        assertTrue(ex.getMessage().contains(ConfigService.REFERENCE_DATASET));
        assertEquals(Optional.empty(), config.getTopologyPath());
    }

    @Test
    void environmentNamesAreUpperSnakeCase() {
        assertEquals("STORAGE_LOCATION_MAP", ConfigService.environmentName("storage.locationMap"));
        assertEquals("STORAGE_RETRY_INITIAL_DELAY_MS", ConfigService.environmentName("storage.retry.initialDelayMs"));
    }

    @Test
    void invalidNumbersFallBackToDefaults() {
        environment.put("STORAGE_MATCH_THRESHOLD", "high");
        environment.put("STORAGE_RETRY_ATTEMPTS", "five");

        assertEquals(0.8, config.getMatchThreshold(), 1e-9);
        assertEquals(RetryPolicy.DEFAULT_ATTEMPTS, config.getRetryPolicy().maxAttempts());
    }

    @Test
    void retryPolicyFromConfiguration() {
        environment.put("STORAGE_RETRY_ATTEMPTS", "5");
        environment.put("STORAGE_RETRY_INITIAL_DELAY_MS", "50");

        RetryPolicy policy = config.getRetryPolicy();

        assertEquals(5, policy.maxAttempts());
        assertEquals(Duration.ofMillis(50), policy.initialDelay());
    }

    @Test
    void longInitialDelayRaisesTheCap() {
        environment.put("STORAGE_RETRY_INITIAL_DELAY_MS", "5000");

        RetryPolicy policy = config.getRetryPolicy();

        assertEquals(Duration.ofSeconds(5), policy.initialDelay());
        assertEquals(Duration.ofSeconds(5), policy.maxDelay());
    }

    @Test
    void bundledDefaultsAreReadable() {
        Properties bundled = ConfigService.loadDefaults();

        assertEquals("location-map.json", bundled.getProperty(ConfigService.LOCATION_MAP));
        assertEquals("0.8", bundled.getProperty(ConfigService.MATCH_THRESHOLD));
    }
}
