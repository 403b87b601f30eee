package com.partsbin.config;

import java.util.Map;
import java.util.UUID;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Builds a {@link ConfigService} for tests from other packages: bundled defaults, an in-memory
 * environment and a throwaway preferences node.
 */
public final class TestConfigs {

    private TestConfigs() {
    }

    public static Handle create(Map<String, String> environment) {
        Preferences node = Preferences.userRoot().node("com/partsbin/test/" + UUID.randomUUID());
        ConfigService config = new ConfigService(PreferencesStore.forNode(node), environment::get, ConfigService.loadDefaults());
        return new Handle(config, node);
    }

    public record Handle(ConfigService config, Preferences node) {

        public void close() throws BackingStoreException {
            node.removeNode();
        }
    }
}
