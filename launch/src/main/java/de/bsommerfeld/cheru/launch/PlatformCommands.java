package de.bsommerfeld.cheru.launch;

import de.bsommerfeld.cheru.core.util.Platform;

import java.nio.file.Path;
import java.util.List;

/**
 * Command lines that hand a path to the desktop's default handler.
 */
public final class PlatformCommands {

    private PlatformCommands() {
    }

    /** {@code open} on macOS, {@code explorer} on Windows, {@code xdg-open} elsewhere. */
    public static List<String> openPath(Platform platform, Path path) {
        switch (platform) {
            case MACOS:
                return List.of("open", path.toString());
            case WINDOWS:
                return List.of("explorer", path.toString());
            default:
                return List.of("xdg-open", path.toString());
        }
    }
}
