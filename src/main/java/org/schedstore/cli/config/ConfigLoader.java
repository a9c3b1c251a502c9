package org.schedstore.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;

/**
 * Resolves the HOCON configuration for the operator CLI.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dstore.disk.enabled=true})</li>
 *   <li>Environment variables. The well-known ones ({@code DATABASE_URL}, {@code USE_DISK}, ...)
 *       are wired to {@code store.*} keys by optional substitutions in {@code reference.conf}</li>
 *   <li>The user configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * The reference layer is loaded unresolved so substitutions in it see the user's overrides.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "scheduler-store.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Locates the configuration file and loads it. Candidates, in order:
     * <ol>
     *   <li>the file passed with {@code --config}</li>
     *   <li>{@code -Dconfig.file}</li>
     *   <li>{@code config/scheduler-store.conf} under the working directory</li>
     *   <li>{@code config/scheduler-store.conf} under the installation directory</li>
     * </ol>
     * Falls back to classpath defaults when none applies.
     *
     * @param explicitConfigFile file given on the command line, or {@code null}
     * @param handler receives which file was chosen
     * @throws IllegalArgumentException if an explicitly requested file does not exist
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            return loadRequired(explicitConfigFile, "--config", handler);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return loadRequired(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file", handler);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file in working directory: "
                + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        final File installationConfigFile = installationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO, "Using configuration file in installation directory: "
                + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
            + " found, using classpath defaults.");
        return loadDefaults();
    }

    private static Config loadRequired(final File file, final String source, final ConfigMessageHandler handler) {
        if (!file.exists()) {
            throw new IllegalArgumentException(
                "Configuration file given via " + source + " not found: " + file.getAbsolutePath());
        }
        handler.log(MessageLevel.INFO, "Using configuration file given via " + source + ": " + file.getAbsolutePath());
        return loadFromFile(file);
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

    /**
     * {@code APP_HOME/config/scheduler-store.conf}, where {@code APP_HOME} is the parent of the
     * {@code lib} directory holding the running jar.
     *
     * @return the file, or {@code null} when not running from a jar or the file is absent
     */
    private static File installationConfigFile() {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        final File jar;
        try {
            jar = new File(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!jar.isFile() || jar.getParentFile() == null || jar.getParentFile().getParentFile() == null) {
            return null;
        }
        final File candidate = new File(new File(jar.getParentFile().getParentFile(), CONFIG_DIR), CONFIG_FILE_NAME);
        return candidate.isFile() ? candidate : null;
    }
}
