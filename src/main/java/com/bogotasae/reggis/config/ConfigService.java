package com.bogotasae.reggis.config;

import com.bogotasae.reggis.logging.AppLogger;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Central entry point for resolving configuration values with overrides and persisted preferences.
 * <p>
 * Precedence is system property, then persisted preference, then built-in default.
 */
public final class ConfigService {
    private static final Logger LOGGER = AppLogger.get();

    static final String DB_PATH_PROPERTY = "reggis.dbPath";
    static final String WORKERS_PROPERTY = "reggis.workers";
    static final String PROGRESS_EVERY_PROPERTY = "reggis.progressEveryLines";
    static final String USD_RATE_PROPERTY = "reggis.usdRate";
    static final String EUR_RATE_PROPERTY = "reggis.eurRate";

    private static final String PREF_KEY_DB_PATH = "db.path";
    private static final String PREF_KEY_USD_RATE = "rate.usd";
    private static final String PREF_KEY_EUR_RATE = "rate.eur";
    private static final String PREF_KEY_LAST_INPUT = "folder.lastInput";
    private static final String PREF_KEY_LAST_OUTPUT = "folder.lastOutput";

    private static final int DEFAULT_PROGRESS_EVERY_LINES = 500;

    private static final ConfigService INSTANCE = new ConfigService(PreferencesStore.global());

    private final PreferencesStore preferences;

    public ConfigService(PreferencesStore preferences) {
        this.preferences = preferences;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    /**
     * Location of the reference database file (without the H2 {@code .mv.db} suffix).
     */
    public Path getReferenceDatabasePath() {
        String override = System.getProperty(DB_PATH_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override.trim());
        }
        return preferences.getPath(PREF_KEY_DB_PATH).orElseGet(ConfigService::defaultDatabasePath);
    }

    public void setReferenceDatabasePath(Path path) {
        if (path == null) return;
        preferences.putPath(PREF_KEY_DB_PATH, path);
    }

    public int getWorkerThreads() {
        int fallback = Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));
        return parsePositiveInt(System.getProperty(WORKERS_PROPERTY), fallback);
    }

    public int getProgressEveryLines() {
        return parsePositiveInt(System.getProperty(PROGRESS_EVERY_PROPERTY), DEFAULT_PROGRESS_EVERY_LINES);
    }

    /**
     * Configured COP per USD, used when an invoice does not state its own exchange rate.
     */
    public Optional<BigDecimal> getUsdRate() {
        return resolveRate(USD_RATE_PROPERTY, PREF_KEY_USD_RATE);
    }

    public void setUsdRate(BigDecimal rate) {
        if (rate == null) return;
        preferences.putString(PREF_KEY_USD_RATE, rate.toPlainString());
    }

    public Optional<BigDecimal> getEurRate() {
        return resolveRate(EUR_RATE_PROPERTY, PREF_KEY_EUR_RATE);
    }

    public void setEurRate(BigDecimal rate) {
        if (rate == null) return;
        preferences.putString(PREF_KEY_EUR_RATE, rate.toPlainString());
    }

    public Optional<Path> getLastInputFolder() {
        return preferences.getPath(PREF_KEY_LAST_INPUT);
    }

    public Optional<Path> getLastOutputFolder() {
        return preferences.getPath(PREF_KEY_LAST_OUTPUT);
    }

    public void rememberFolders(Path inputFolder, Path outputFolder) {
        preferences.putPath(PREF_KEY_LAST_INPUT, inputFolder);
        preferences.putPath(PREF_KEY_LAST_OUTPUT, outputFolder);
    }

    private Optional<BigDecimal> resolveRate(String property, String prefKey) {
        String override = System.getProperty(property);
        String raw = override != null && !override.isBlank()
            ? override
            : preferences.getString(prefKey).orElse(null);
        if (raw == null) {
            return Optional.empty();
        }
        try {
            BigDecimal rate = new BigDecimal(raw.trim().replace(',', '.'));
            if (rate.signum() <= 0) {
                LOGGER.warning("Ignoring non-positive exchange rate '" + raw + "' for " + property);
                return Optional.empty();
            }
            return Optional.of(rate);
        } catch (NumberFormatException ex) {
            LOGGER.warning("Ignoring malformed exchange rate '" + raw + "' for " + property);
            return Optional.empty();
        }
    }

    private static int parsePositiveInt(String raw, int fallback) {
        try {
            return raw == null || raw.isBlank() ? fallback : Math.max(1, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static Path defaultDatabasePath() {
        String appData = System.getenv("APPDATA");
        boolean windows = System.getProperty("os.name", "").toLowerCase(java.util.Locale.ROOT).startsWith("windows");
        if (windows && appData != null && !appData.isBlank()) {
            return Paths.get(appData, "BogotaSAE", "database", "reggis-reference");
        }
        return Paths.get(System.getProperty("user.dir"), "database", "reggis-reference");
    }
}
