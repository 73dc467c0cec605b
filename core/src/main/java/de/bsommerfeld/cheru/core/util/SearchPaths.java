package de.bsommerfeld.cheru.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Locates helper executables (ripgrep, plutil, sips) the launcher shells out
 * to.
 *
 * <p>
 * When the launcher is started from a desktop session or a packaged native
 * launcher, it often inherits a minimal {@code PATH} ({@code /usr/bin:/bin}).
 * User-installed tools in {@code /usr/local/bin}, {@code /opt/homebrew/bin}
 * or {@code ~/.local/bin} would be invisible, so these locations are always
 * searched after the inherited {@code PATH}.
 */
public final class SearchPaths {

    private static final Logger LOG = LoggerFactory.getLogger(SearchPaths.class);

    private static final String[] EXTRA_PATHS = {
            "/usr/local/bin",
            "/opt/homebrew/bin",
            "/opt/homebrew/sbin"
    };

    private SearchPaths() {
    }

    /**
     * Returns the ordered, duplicate-free list of directories searched for
     * helper executables: the entries of {@code pathVariable} followed by the
     * common Unix install locations and {@code ~/.local/bin}. On Windows only
     * {@code pathVariable} is used.
     */
    public static List<Path> directories(String pathVariable, Platform platform, Path home) {
        Set<Path> dirs = new LinkedHashSet<>();
        if (pathVariable != null) {
            for (String part : pathVariable.split(File.pathSeparator)) {
                if (part.isBlank())
                    continue;
                try {
                    dirs.add(Paths.get(part));
                } catch (InvalidPathException e) {
                    LOG.debug("Ignoring malformed PATH element '{}'", part);
                }
            }
        }
        if (!platform.isWindows()) {
            for (String extra : EXTRA_PATHS) {
                dirs.add(Paths.get(extra));
            }
            dirs.add(home.resolve(".local").resolve("bin"));
        }
        return new ArrayList<>(dirs);
    }

    /** {@link #directories} for the running process. */
    public static List<Path> directories() {
        return directories(System.getenv("PATH"), Platform.current(), StorageUtils.userHome());
    }

    /**
     * Finds the first executable regular file named {@code name} in the given
     * directories.
     */
    public static Optional<Path> find(String name, List<Path> directories) {
        for (Path dir : directories) {
            Path candidate = dir.resolve(name);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
            if (Platform.current().isWindows()) {
                Path exe = dir.resolve(name + ".exe");
                if (Files.isRegularFile(exe)) {
                    return Optional.of(exe);
                }
            }
        }
        return Optional.empty();
    }

    /** {@link #find(String, List)} over {@link #directories()}. */
    public static Optional<Path> find(String name) {
        return find(name, directories());
    }
}
