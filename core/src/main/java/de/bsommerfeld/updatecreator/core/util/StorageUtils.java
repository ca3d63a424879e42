package de.bsommerfeld.updatecreator.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves the per-user application data directory following each platform's
 * conventions. Paths are absolute but <strong>not</strong> created.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_CONFIG_HOME/{appName}} (fallback {@code ~/.config})</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "update-creator";

    /** System property that points to a different configuration file. */
    public static final String CONFIG_PROPERTY = "updatecreator.config";

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData != null) {
                return Paths.get(appData, appName);
            }
            return Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
        }
        String xdgConfig = System.getenv("XDG_CONFIG_HOME");
        if (xdgConfig != null && !xdgConfig.isEmpty()) {
            return Paths.get(xdgConfig, appName);
        }
        return Paths.get(System.getProperty("user.home"), ".config", appName);
    }

    /**
     * Location of the configuration file: the {@value #CONFIG_PROPERTY} system property if
     * set, otherwise {@code config.yaml} in the application data directory.
     */
    public static Path getConfigFile() {
        String override = System.getProperty(CONFIG_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override);
        }
        return getAppDataDir(APP_NAME).resolve("config.yaml");
    }
}
