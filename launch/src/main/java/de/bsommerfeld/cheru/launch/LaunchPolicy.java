package de.bsommerfeld.cheru.launch;

import de.bsommerfeld.cheru.core.util.Platform;
import de.bsommerfeld.cheru.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * The directories executables may be launched from, and the home directory
 * that bounds open and browse operations.
 *
 * <p>
 * Directories are stored canonicalized where they exist, so that the
 * containment check compares canonical paths on both sides.
 */
public final class LaunchPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(LaunchPolicy.class);

    private final List<Path> applicationDirectories;
    private final List<Path> binaryDirectories;
    private final List<Path> userDirectories;
    private final Path home;

    public LaunchPolicy(List<Path> applicationDirectories, List<Path> binaryDirectories,
            List<Path> userDirectories, Path home) {
        this.applicationDirectories = canonicalAll(applicationDirectories);
        this.binaryDirectories = canonicalAll(binaryDirectories);
        this.userDirectories = canonicalAll(userDirectories);
        this.home = canonical(home);
    }

    public static LaunchPolicy forPlatform(Platform platform, Path home) {
        switch (platform) {
            case MACOS:
                return new LaunchPolicy(
                        paths("/Applications", "/System/Applications"),
                        paths("/usr/bin", "/usr/local/bin", "/opt/homebrew/bin", "/bin", "/usr/sbin", "/sbin"),
                        List.of(home.resolve("Applications")),
                        home);
            case WINDOWS:
                return new LaunchPolicy(
                        windowsProgramDirectories(),
                        windowsSystemDirectories(),
                        windowsUserDirectories(home),
                        home);
            default:
                return new LaunchPolicy(
                        paths("/opt", "/usr/lib", "/usr/libexec", "/snap/bin", "/var/lib/flatpak/exports/bin"),
                        paths("/usr/bin", "/usr/local/bin", "/bin", "/usr/sbin", "/sbin", "/usr/games"),
                        List.of(home.resolve(".local").resolve("bin"), home.resolve("Applications")),
                        home);
        }
    }

    public static LaunchPolicy current() {
        return forPlatform(Platform.current(), StorageUtils.userHome());
    }

    public List<Path> applicationDirectories() {
        return applicationDirectories;
    }

    /** Searched in order when a command is given as a bare name. */
    public List<Path> binaryDirectories() {
        return binaryDirectories;
    }

    public List<Path> userDirectories() {
        return userDirectories;
    }

    public Path home() {
        return home;
    }

    /** All launch roots: application, binary, then user directories. */
    public List<Path> allowedRoots() {
        List<Path> roots = new ArrayList<>(applicationDirectories);
        roots.addAll(binaryDirectories);
        roots.addAll(userDirectories);
        return roots;
    }

    private static List<Path> paths(String... paths) {
        List<Path> list = new ArrayList<>(paths.length);
        for (String p : paths) {
            list.add(Paths.get(p));
        }
        return list;
    }

    private static List<Path> windowsProgramDirectories() {
        List<Path> dirs = new ArrayList<>();
        addEnv(dirs, "ProgramFiles", null);
        addEnv(dirs, "ProgramFiles(x86)", null);
        return dirs;
    }

    private static List<Path> windowsSystemDirectories() {
        List<Path> dirs = new ArrayList<>();
        addEnv(dirs, "SystemRoot", "System32");
        return dirs;
    }

    private static List<Path> windowsUserDirectories(Path home) {
        List<Path> dirs = new ArrayList<>();
        addEnv(dirs, "LOCALAPPDATA", "Programs");
        if (dirs.isEmpty()) {
            dirs.add(home.resolve("AppData").resolve("Local").resolve("Programs"));
        }
        return dirs;
    }

    private static void addEnv(List<Path> dirs, String variable, String child) {
        String value = System.getenv(variable);
        if (value != null && !value.isBlank()) {
            Path base = Paths.get(value);
            dirs.add(child != null ? base.resolve(child) : base);
        }
    }

    private static List<Path> canonicalAll(List<Path> paths) {
        List<Path> result = new ArrayList<>(paths.size());
        for (Path p : paths) {
            result.add(canonical(p));
        }
        return List.copyOf(result);
    }

    private static Path canonical(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        if (!Files.exists(absolute))
            return absolute;
        try {
            return absolute.toRealPath();
        } catch (IOException e) {
            LOG.debug("Cannot canonicalize allow-list directory {}: {}", absolute, e.getMessage());
            return absolute;
        }
    }
}
