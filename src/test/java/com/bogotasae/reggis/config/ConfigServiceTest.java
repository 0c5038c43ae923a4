package com.bogotasae.reggis.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    private PreferencesStore preferences;
    private ConfigService config;

    @BeforeEach
    void setUp() {
        preferences = PreferencesStore.node("test-" + UUID.randomUUID());
        config = new ConfigService(preferences);
    }

    @AfterEach
    void tearDown() {
        preferences.clear();
        System.clearProperty(ConfigService.DB_PATH_PROPERTY);
        System.clearProperty(ConfigService.USD_RATE_PROPERTY);
        System.clearProperty(ConfigService.WORKERS_PROPERTY);
        System.clearProperty(ConfigService.PROGRESS_EVERY_PROPERTY);
    }

    @Test
    void ratesComeFromPreferencesUnlessOverridden() {
        assertTrue(config.getUsdRate().isEmpty());

        config.setUsdRate(new BigDecimal("4100.25"));
        assertEquals(Optional.of(new BigDecimal("4100.25")), config.getUsdRate());

        System.setProperty(ConfigService.USD_RATE_PROPERTY, "3950,5");
        assertEquals(Optional.of(new BigDecimal("3950.5")), config.getUsdRate());
    }

    @Test
    void ignoresUnusableRates() {
        config.setEurRate(new BigDecimal("4450"));
        assertEquals(Optional.of(new BigDecimal("4450")), config.getEurRate());

        preferences.putString("rate.eur", "-1");
        assertTrue(config.getEurRate().isEmpty());

        preferences.putString("rate.eur", "abc");
        assertTrue(config.getEurRate().isEmpty());
    }

    @Test
    void databasePathPrefersSystemProperty() {
        Path stored = tempDir.resolve("stored").resolve("reference");
        config.setReferenceDatabasePath(stored);
        assertEquals(stored.toAbsolutePath(), config.getReferenceDatabasePath());

        Path override = tempDir.resolve("override");
        System.setProperty(ConfigService.DB_PATH_PROPERTY, override.toString());
        assertEquals(override, config.getReferenceDatabasePath());
    }

    @Test
    void storedPathsAreAbsoluteAndNormalized() {
        config.setReferenceDatabasePath(Path.of("data", "..", "db", "reference"));

        assertEquals(Path.of("db", "reference").toAbsolutePath(), config.getReferenceDatabasePath());
    }

    @Test
    void remembersFoldersOfLastRun() {
        Path input = tempDir.resolve("in");
        Path output = tempDir.resolve("out");

        config.rememberFolders(input, output);

        ConfigService reopened = new ConfigService(preferences);
        assertEquals(Optional.of(input.toAbsolutePath()), reopened.getLastInputFolder());
        assertEquals(Optional.of(output.toAbsolutePath()), reopened.getLastOutputFolder());
    }

    @Test
    void workerAndProgressSettingsFallBackOnBadValues() {
        System.setProperty(ConfigService.WORKERS_PROPERTY, "3");
        System.setProperty(ConfigService.PROGRESS_EVERY_PROPERTY, "many");

        assertEquals(3, config.getWorkerThreads());
        assertEquals(500, config.getProgressEveryLines());

        System.setProperty(ConfigService.WORKERS_PROPERTY, "0");
        assertEquals(1, config.getWorkerThreads());
    }
}
