package org.ysim.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URL;
import java.security.CodeSource;
import java.security.ProtectionDomain;
import java.util.Map;

/**
 * Composes the HOCON configuration of a run.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>command-line overrides ({@code --seed}, {@code --sequential}, recommender names)</li>
 *   <li>Java system properties ({@code -Dkey=value})</li>
 *   <li>environment variables</li>
 *   <li>the user configuration file</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Layers are composed unresolved and resolved once, so substitutions in {@code reference.conf}
 * see user overrides.
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "ysim.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages of the file lookup.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Resolves the configuration without command-line overrides.
     *
     * @see #resolve(File, Map, ConfigMessageHandler)
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        return resolve(explicitConfigFile, Map.of(), handler);
    }

    /**
     * Looks up the user file in this order: {@code --config}, {@code -Dconfig.file},
     * {@code config/ysim.conf} in the working directory, {@code config/ysim.conf} in the
     * installation directory. Without any, only classpath defaults are used.
     *
     * @param explicitConfigFile file from {@code --config}, or {@code null}
     * @param overrides          dotted paths to values, applied above everything else
     * @param handler            receives lookup progress
     * @return the resolved configuration
     * @throws IllegalArgumentException                if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException     if a layer cannot be parsed or resolved
     */
    public static Config resolve(final File explicitConfigFile, final Map<String, ?> overrides,
                                 final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return load(explicitConfigFile, overrides);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: "
                                + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file specified via -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return load(systemConfigFile, overrides);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return load(cwdConfigFile, overrides);
        }

        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file from installation directory: "
                            + installationConfigFile.getAbsolutePath());
            return load(installationConfigFile, overrides);
        }

        handler.log(MessageLevel.WARN,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                        + "' found in current directory or installation directory. "
                        + "Using default configuration from classpath.");
        return load(null, overrides);
    }

    /**
     * Composes and resolves all layers.
     *
     * @param configFile user file, or {@code null} for classpath defaults only
     * @param overrides  dotted paths to values
     */
    static Config load(final File configFile, final Map<String, ?> overrides) {
        Config config = ConfigFactory.parseMap(overrides, "command-line overrides")
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(ConfigFactory.systemEnvironment());
        if (configFile != null) {
            config = config.withFallback(ConfigFactory.parseFile(configFile));
        }
        return config.withFallback(ConfigFactory.defaultReferenceUnresolved()).resolve();
    }

    /**
     * Finds {@code APP_HOME/config/ysim.conf}, where {@code APP_HOME} is the parent of the
     * {@code lib} directory holding the running jar.
     *
     * @return the file, or {@code null} if it cannot be determined or does not exist
     */
    private static File detectInstallationConfigFile() {
        try {
            final ProtectionDomain protectionDomain = ConfigLoader.class.getProtectionDomain();
            if (protectionDomain == null) {
                return null;
            }
            final CodeSource codeSource = protectionDomain.getCodeSource();
            if (codeSource == null) {
                return null;
            }
            final URL location = codeSource.getLocation();
            final File jarOrClasses = new File(location.toURI());
            final File appHome = jarOrClasses.isFile()
                    ? (jarOrClasses.getParentFile() == null ? null : jarOrClasses.getParentFile().getParentFile())
                    : jarOrClasses;
            if (appHome == null) {
                return null;
            }
            final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
            return configFile.exists() ? configFile : null;
        } catch (Exception ignored) {
            // Lookup is best effort, the remaining levels still apply.
            return null;
        }
    }
}
