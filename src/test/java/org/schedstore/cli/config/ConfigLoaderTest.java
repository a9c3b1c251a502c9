package org.schedstore.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the precedence of {@link ConfigLoader}: system properties over environment over
 * the configuration file over {@code reference.conf}.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.priority");
        System.clearProperty("store.migration.batchSize");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("File values override reference defaults, untouched keys keep their defaults")
    void loadFromFile_overridesReferenceDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals(250, config.getInt("store.migration.batchSize"));
        assertEquals(5000, config.getInt("store.pagination.defaultLimit"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("store.migration.batchSize", "42");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals(42, config.getInt("store.migration.batchSize"));
    }

    @Test
    @DisplayName("Substitutions in the file see system property overrides")
    void loadFromFile_shouldResolveConfigurationReferences() {
        System.setProperty("test.priority", "system-override");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals("base-suffix", config.getString("test.referenced-value"));
        assertEquals("system-override", config.getString("test.priority"));
    }

    @Test
    @DisplayName("loadDefaults should expose the store block from reference.conf")
    void loadDefaults_containsStoreBlock() {
        Config config = ConfigLoader.loadDefaults();

        assertTrue(config.hasPath("store.database.url"));
        assertTrue(config.hasPath("store.disk.dataDirectory"));
        assertEquals(10, config.getInt("store.migration.progressIntervalSeconds"));
    }

    @Test
    @DisplayName("An explicit config file takes precedence and is reported")
    void resolve_usesExplicitFile() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
            (level, message) -> messages.add(level + ":" + message));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO:Using configuration file given via --config"));
    }

    @Test
    @DisplayName("A missing explicit config file is rejected")
    void resolve_rejectsMissingExplicitFile() {
        File missing = new File("does-not-exist/scheduler-store.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("not found"));
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
