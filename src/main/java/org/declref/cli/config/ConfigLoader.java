package org.declref.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Loads the HOCON configuration of the {@code declref} CLI.
 * <p>
 * System properties override environment variables, which override the selected
 * configuration file, which overrides {@code reference.conf}. Substitutions are resolved
 * once all layers are stacked.
 */
public final class ConfigLoader {

    static final File DEFAULT_CONFIG_FILE = new File("config", "declref.conf");

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives notes about which configuration file was picked.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Picks the configuration file and loads it. The first of these wins: the file passed via
     * {@code --config}, the file named by {@code -Dconfig.file}, {@code config/declref.conf} in
     * the working directory. Without any of them only {@code reference.conf} applies.
     *
     * @param explicitConfigFile file from {@code --config}, or {@code null}.
     * @param handler            receives a note about the chosen source.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if a file named via {@code --config} or {@code -Dconfig.file} does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or a substitution cannot be resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            return loadNamed(explicitConfigFile, "--config", handler);
        }
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return loadNamed(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file", handler);
        }
        if (DEFAULT_CONFIG_FILE.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + DEFAULT_CONFIG_FILE.getAbsolutePath());
            return loadFromFile(DEFAULT_CONFIG_FILE);
        }
        handler.log(MessageLevel.WARN, "No '" + DEFAULT_CONFIG_FILE.getPath()
                + "' found; using default configuration from classpath.");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return overrides()
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    static Config loadDefaults() {
        return overrides()
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static Config loadNamed(final File file, final String source, final ConfigMessageHandler handler) {
        if (!file.exists()) {
            throw new IllegalArgumentException(
                    "Configuration file given via " + source + " not found: " + file.getAbsolutePath());
        }
        handler.log(MessageLevel.INFO, "Using configuration file given via " + source + ": " + file.getAbsolutePath());
        return loadFromFile(file);
    }

    private static Config overrides() {
        return ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
    }
}
