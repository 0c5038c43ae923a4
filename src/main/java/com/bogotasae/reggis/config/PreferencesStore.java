package com.bogotasae.reggis.config;

import com.bogotasae.reggis.logging.AppLogger;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Persists exporter settings (reference database location, exchange rates, last used folders) in a
 * {@link Preferences} node. Paths are stored absolute and normalized, so they resolve the same way whatever the
 * working directory of the next run.
 */
public final class PreferencesStore {
    private static final Logger LOGGER = AppLogger.get();
    private static final String ROOT_NODE = "com/bogotasae/reggis";

    private final Preferences node;

    private PreferencesStore(Preferences node) {
        this.node = node;
    }

    public static PreferencesStore global() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    /**
     * Opens a child node below the exporter root, used by tests to keep their state isolated.
     */
    public static PreferencesStore node(String childName) {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE + "/" + childName));
    }

    /**
     * A stored value that is no longer a valid path on this platform is treated as absent.
     */
    public Optional<Path> getPath(String key) {
        return getString(key).flatMap(value -> {
            try {
                return Optional.of(Path.of(value));
            } catch (InvalidPathException ex) {
                LOGGER.warning("Ignoring stored path for '" + key + "': " + ex.getMessage());
                return Optional.empty();
            }
        });
    }

    public void putPath(String key, Path path) {
        if (path == null) return;
        store(key, path.toAbsolutePath().normalize().toString());
    }

    public Optional<String> getString(String key) {
        String value = node.get(key, null);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    public void putString(String key, String value) {
        if (value == null) return;
        store(key, value.trim());
    }

    public void clear() {
        try {
            node.clear();
        } catch (BackingStoreException ex) {
            LOGGER.log(Level.FINE, "Could not clear preferences " + node.absolutePath(), ex);
        }
        flush();
    }

    private void store(String key, String value) {
        if (key == null || key.isBlank()) return;
        node.put(key, value);
        flush();
    }

    private void flush() {
        try {
            node.flush();
        } catch (BackingStoreException ex) {
            LOGGER.log(Level.FINE, "Could not flush preferences " + node.absolutePath(), ex);
        }
    }
}
