package org.treesim.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Central configuration loader for the command line.
 * <p>
 * Composes HOCON configuration from multiple sources with the following precedence
 * (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file (e.g., {@code config/treesim.conf})</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * <p>
 * Uses {@link ConfigFactory#defaultReferenceUnresolved()} so that substitutions in
 * {@code reference.conf} see the user's overrides.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "treesim.conf";

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Callback for receiving progress messages during configuration file resolution.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Resolves configuration using the fallback cascade:
     * <ol>
     *   <li><strong>Explicit file:</strong> passed via {@code --config}</li>
     *   <li><strong>System property:</strong> {@code -Dconfig.file}</li>
     *   <li><strong>Working directory:</strong> {@code config/treesim.conf}</li>
     *   <li><strong>Classpath defaults:</strong> {@code reference.conf} only</li>
     * </ol>
     *
     * @param explicitConfigFile config file from the CLI option, or {@code null} for auto-discovery.
     * @param handler            callback for resolution progress messages.
     * @return the fully resolved application {@link Config}.
     * @throws IllegalArgumentException            if an explicitly specified file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: " + systemConfigFile);
            }
            handler.log(MessageLevel.INFO, "Using configuration file specified via -Dconfig.file: " + systemConfigFile);
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        handler.log(MessageLevel.INFO, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + "' found, using default configuration from classpath.");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
