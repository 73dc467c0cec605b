package de.bsommerfeld.cheru.core.util;

import java.util.Locale;

/**
 * Host operating system families the launcher distinguishes. Every
 * platform-specific component is selected from this value at wiring time
 * instead of branching on {@code os.name} at the call site.
 */
public enum Platform {

    LINUX,
    MACOS,
    WINDOWS,
    OTHER;

    /** Resolves the platform of the running JVM. */
    public static Platform current() {
        return detect(System.getProperty("os.name", "generic"));
    }

    /**
     * Maps an {@code os.name} value to a platform. Unknown names (BSDs,
     * Solaris, ...) map to {@link #OTHER}.
     */
    public static Platform detect(String osName) {
        String os = osName == null ? "" : osName.toLowerCase(Locale.ENGLISH);
        if (os.contains("mac") || os.contains("darwin")) {
            return MACOS;
        }
        if (os.contains("win")) {
            return WINDOWS;
        }
        if (os.contains("linux")) {
            return LINUX;
        }
        return OTHER;
    }

    public boolean isMac() {
        return this == MACOS;
    }

    public boolean isWindows() {
        return this == WINDOWS;
    }
}
