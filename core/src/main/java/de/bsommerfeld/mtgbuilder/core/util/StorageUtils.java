package de.bsommerfeld.mtgbuilder.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Locations of the ingester's files: the SQLite database and the optional
 * {@code config.yaml}, both in the per-user application data directory.
 * Nothing here creates directories.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/mtg-builder}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\mtg-builder}, else
 * {@code ~/AppData/Roaming/mtg-builder}</li>
 * <li><strong>other</strong>: {@code $XDG_DATA_HOME/mtg-builder}, else
 * {@code ~/.local/share/mtg-builder}</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "mtg-builder";

    private StorageUtils() {
    }

    /** The application data directory of the current user, absolute. */
    public static Path appDataDir() {
        return appDataDir(System.getProperty("os.name", "generic"), System.getProperty("user.home"),
                System::getenv);
    }

    static Path appDataDir(String osName, String userHome, UnaryOperator<String> env) {
        String os = osName.toLowerCase(Locale.ROOT);
        Path base;
        if (os.contains("mac") || os.contains("darwin")) {
            base = Paths.get(userHome, "Library", "Application Support");
        } else if (os.contains("win")) {
            String appData = env.apply("APPDATA");
            base = appData != null ? Paths.get(appData) : Paths.get(userHome, "AppData", "Roaming");
        } else {
            String xdgData = env.apply("XDG_DATA_HOME");
            base = xdgData != null && !xdgData.isEmpty() ? Paths.get(xdgData) : Paths.get(userHome, ".local", "share");
        }
        return base.resolve(APP_NAME).toAbsolutePath();
    }

    /** SQLite file {@code mtg-builder.db} inside {@link #appDataDir()}. */
    public static String defaultDatabaseUrl() {
        return "jdbc:sqlite:" + appDataDir().resolve(APP_NAME + ".db");
    }
}
