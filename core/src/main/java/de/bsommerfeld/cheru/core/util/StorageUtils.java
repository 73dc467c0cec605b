package de.bsommerfeld.cheru.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves OS-specific application data directories following each platform's
 * native conventions. All paths are returned as absolute {@link Path} instances
 * but are <strong>not</strong> created. The caller is responsible for ensuring
 * the directory exists.
 *
 * <p>
 * Resolution order per platform:
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 */
public final class StorageUtils {

    private StorageUtils() {
    }

    /**
     * Returns the platform-specific application data directory for the given app
     * name.
     * The directory is not guaranteed to exist.
     *
     * @param appName application identifier used as the directory name
     * @return absolute path to the application's data directory
     */
    public static Path getAppDataDir(String appName) {
        Path path;
        switch (Platform.current()) {
            case MACOS:
                path = Paths.get(userHome().toString(), "Library", "Application Support", appName);
                break;
            case WINDOWS:
                String appData = System.getenv("APPDATA");
                if (appData != null) {
                    path = Paths.get(appData, appName);
                } else {
                    path = Paths.get(userHome().toString(), "AppData", "Roaming", appName);
                }
                break;
            default:
                String xdgData = System.getenv("XDG_DATA_HOME");
                if (xdgData != null && !xdgData.isEmpty()) {
                    path = Paths.get(xdgData, appName);
                } else {
                    path = Paths.get(userHome().toString(), ".local", "share", appName);
                }
        }
        return path.toAbsolutePath();
    }

    /**
     * Returns the log directory inside the application data directory.
     *
     * @param appName application identifier
     * @return absolute path to {@code {appDataDir}/logs}
     */
    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }

    /**
     * Returns the cache directory for rasterized application icons.
     *
     * @param appName application identifier
     * @return absolute path to {@code {appDataDir}/icons}
     */
    public static Path getIconCacheDir(String appName) {
        return getAppDataDir(appName).resolve("icons");
    }

    /** The invoking user's home directory as an absolute path. */
    public static Path userHome() {
        return Paths.get(System.getProperty("user.home")).toAbsolutePath();
    }
}
