package com.partsbin.config;

import com.partsbin.logging.AppLogger;

import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Thin wrapper around {@link Preferences} for settings the tool remembers between runs.
 */
public final class PreferencesStore {
    private static final String ROOT_NODE = "com/partsbin/storage";

    private static final Logger LOGGER = AppLogger.get();

    private final Preferences delegate;

    private PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    static PreferencesStore forNode(Preferences node) {
        return new PreferencesStore(node);
    }

    public Optional<Path> getPath(String key) {
        return getString(key).map(Path::of);
    }

    public void putPath(String key, Path path) {
        if (path == null) return;
        putString(key, path.toString());
    }

    public Optional<String> getString(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public void putString(String key, String value) {
        if (key == null || key.isBlank() || value == null) return;
        delegate.put(key, value);
        flush();
    }

    public void remove(String key) {
        if (key == null || key.isBlank()) return;
        delegate.remove(key);
        flush();
    }

    private void flush() {
        try {
            delegate.flush();
        } catch (BackingStoreException ex) {
            LOGGER.log(Level.WARNING, "Could not persist preferences under " + delegate.absolutePath(), ex);
        }
    }
}
