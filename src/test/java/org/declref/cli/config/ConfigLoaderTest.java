package org.declref.cli.config;

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
 * Unit tests for {@link ConfigLoader}: which file is picked, and that system properties
 * override the file, which overrides {@code reference.conf}.
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
        System.clearProperty("test.nested.setting");
        System.clearProperty("declref.check.unresolved-severity");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should load configuration file with defaults when no overrides present")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals("WARNING", config.getString("declref.check.unresolved-severity"));
        assertEquals("PLAIN", config.getString("logging.format"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("declref.check.unresolved-severity", "ERROR");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals("ERROR", config.getString("declref.check.unresolved-severity"));
    }

    @Test
    @DisplayName("loadDefaults should expose reference.conf values")
    void loadDefaults_shouldReturnReferenceValues() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals("ERROR", config.getString("declref.check.unresolved-severity"));
        assertEquals("INFO", config.getString("logging.levels.\"org.declref\""));
    }

    @Test
    @DisplayName("Should resolve substitutions against reference.conf after layering")
    void loadFromFile_shouldResolveConfigurationReferences() {
        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals("ERROR-suffix", config.getString("test.referenced-value"));
    }

    @Test
    @DisplayName("Explicit config file wins and reports its location")
    void resolve_explicitFileIsUsed() {
        List<String> messages = new ArrayList<>();
        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                (level, message) -> messages.add(level + " " + message));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file given via --config"));
    }

    @Test
    @DisplayName("Missing explicit config file is rejected")
    void resolve_missingExplicitFileThrows() {
        File missing = new File("does-not-exist/declref.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("given via --config not found"));
    }

    @Test
    @DisplayName("-Dconfig.file is used when --config is absent")
    void resolve_systemPropertyFileIsUsed() {
        System.setProperty("config.file", testResource("test-config.conf").getAbsolutePath());
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(null, (level, message) -> messages.add(level + " " + message));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file given via -Dconfig.file"));
    }

    @Test
    @DisplayName("Missing -Dconfig.file is rejected")
    void resolve_missingSystemPropertyFileThrows() {
        System.setProperty("config.file", "does-not-exist/declref.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(null, (level, message) -> { }));
        assertTrue(e.getMessage().contains("given via -Dconfig.file not found"));
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
