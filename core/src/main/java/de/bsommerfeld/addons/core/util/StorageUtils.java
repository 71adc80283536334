package de.bsommerfeld.addons.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves the directory the store keeps its configuration, state and logs
 * in. Paths are absolute but <strong>not</strong> created here.
 *
 * <p>
 * {@code ADDONS_HOME} wins when set. Otherwise the platform convention
 * applies:
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}}</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "addon-store";
    public static final String HOME_ENV = "ADDONS_HOME";

    private StorageUtils() {
    }

    /** Returns the data directory of this application. */
    public static Path getAppDataDir() {
        String home = System.getenv(HOME_ENV);
        if (home != null && !home.isBlank()) {
            return Paths.get(home).toAbsolutePath();
        }
        return getAppDataDir(APP_NAME);
    }

    /**
     * Returns the platform data directory for {@code appName}, ignoring
     * {@code ADDONS_HOME}.
     */
    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String userHome = System.getProperty("user.home");

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(userHome, "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(userHome, "AppData", "Roaming", appName);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        return xdgData != null && !xdgData.isEmpty()
                ? Paths.get(xdgData, appName)
                : Paths.get(userHome, ".local", "share", appName);
    }

    /** Returns {@code logs} below the given data directory. */
    public static Path getLogsDir(Path appDataDir) {
        return appDataDir.resolve("logs");
    }
}
