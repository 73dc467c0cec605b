package de.bsommerfeld.cheru.launch;

import de.bsommerfeld.cheru.core.util.SearchPaths;
import de.bsommerfeld.cheru.launch.LaunchRejectedException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

/**
 * Validates launch and open targets before anything is spawned.
 *
 * <h3>Launch</h3>
 * <ol>
 * <li>Field codes are stripped; an empty remainder is rejected.</li>
 * <li>A command ending in {@code .app} is a bundle and is validated as one
 * path, spaces included. A first token pointing into a bundle
 * ({@code .app/}) is validated as a bundle as well. Otherwise the first
 * whitespace-separated token is the executable and the rest are passed
 * through verbatim.</li>
 * <li>A bare command name is looked up in the policy's binary directories.
 * Any other relative path is rejected.</li>
 * <li>The path is canonicalized, resolving {@code ..} and symlinks.</li>
 * <li>The canonical path must lie inside an application, binary or user
 * directory of the {@link LaunchPolicy}. Containment is checked per path
 * segment, so {@code /usr/binfoo} is not inside {@code /usr/bin}.</li>
 * <li>The executable is spawned under the path it was given or looked up
 * as, not the canonical one, so programs that dispatch on their invocation
 * name keep working.</li>
 * </ol>
 *
 * <h3>Open and browse</h3>
 * The target must be absolute, exist, canonicalize, and lie inside the
 * canonical home directory. There is no exception for system paths.
 */
public class LaunchGate {

    private static final Logger LOG = LoggerFactory.getLogger(LaunchGate.class);

    private final LaunchPolicy policy;

    public LaunchGate(LaunchPolicy policy) {
        this.policy = policy;
    }

    public LaunchRequest validateLaunch(String target) throws LaunchRejectedException {
        String command = FieldCodes.strip(target);
        if (command.isEmpty()) {
            throw new LaunchRejectedException(Reason.EMPTY_COMMAND, null, "Launch rejected: empty command");
        }

        String bundlePath = bundlePath(command);
        if (bundlePath != null) {
            Path bundle = canonicalize(absolute(bundlePath));
            requireAllowed(bundle);
            LOG.debug("Launch of bundle {} accepted", bundle);
            return LaunchRequest.forBundle(bundle);
        }

        List<String> tokens = Arrays.asList(command.split(" "));
        String executable = tokens.get(0);
        Path resolved = isBareName(executable) ? lookUp(executable) : absolute(executable);
        Path canonical = canonicalize(resolved);
        requireAllowed(canonical);

        if (!Files.isRegularFile(canonical)) {
            throw new LaunchRejectedException(Reason.NOT_FOUND, canonical.toString(),
                    "Launch rejected: " + canonical + " is not an executable file");
        }

        LOG.debug("Launch of {} ({}) accepted", resolved, canonical);
        return LaunchRequest.forCommand(resolved, canonical, tokens.subList(1, tokens.size()));
    }

    /** Validates a file or directory the user wants to open. */
    public Path validateOpen(String path) throws LaunchRejectedException {
        if (path == null || path.isBlank()) {
            throw new LaunchRejectedException(Reason.EMPTY_COMMAND, null, "Open rejected: empty path");
        }
        Path canonical = canonicalize(absolute(path.strip()));
        if (!canonical.startsWith(policy.home())) {
            throw new LaunchRejectedException(Reason.OUTSIDE_HOME, canonical.toString(),
                    "Rejected: " + canonical + " is outside the home directory " + policy.home());
        }
        return canonical;
    }

    /** Like {@link #validateOpen}, additionally requiring a directory. */
    public Path validateDirectory(String path) throws LaunchRejectedException {
        Path canonical = validateOpen(path);
        if (!Files.isDirectory(canonical)) {
            throw new LaunchRejectedException(Reason.NOT_DIRECTORY, canonical.toString(),
                    "Rejected: " + canonical + " is not a directory");
        }
        return canonical;
    }

    public LaunchPolicy policy() {
        return policy;
    }

    static boolean isBundleTarget(String command) {
        return bundlePath(command) != null;
    }

    /** The bundle path of {@code command}, or {@code null} if it does not name a bundle. */
    private static String bundlePath(String command) {
        if (command.endsWith(".app") || command.endsWith(".app/"))
            return command;
        int space = command.indexOf(' ');
        String executable = space < 0 ? command : command.substring(0, space);
        return executable.contains(".app/") ? executable : null;
    }

    private static boolean isBareName(String executable) {
        return executable.indexOf('/') < 0 && executable.indexOf('\\') < 0;
    }

    private Path lookUp(String name) throws LaunchRejectedException {
        return SearchPaths.find(name, policy.binaryDirectories())
                .orElseThrow(() -> new LaunchRejectedException(Reason.NOT_FOUND, name,
                        "Launch rejected: command '" + name + "' not found in " + policy.binaryDirectories()));
    }

    private static Path absolute(String raw) throws LaunchRejectedException {
        Path path;
        try {
            path = Paths.get(raw);
        } catch (InvalidPathException e) {
            throw new LaunchRejectedException(Reason.NOT_ABSOLUTE, raw, "Rejected: '" + raw + "' is not a valid path", e);
        }
        if (!path.isAbsolute()) {
            throw new LaunchRejectedException(Reason.NOT_ABSOLUTE, raw, "Rejected: '" + raw + "' is not an absolute path");
        }
        return path;
    }

    private static Path canonicalize(Path path) throws LaunchRejectedException {
        if (!Files.exists(path)) {
            throw new LaunchRejectedException(Reason.NOT_FOUND, path.toString(), "Rejected: " + path + " does not exist");
        }
        try {
            return path.toRealPath();
        } catch (IOException e) {
            throw new LaunchRejectedException(Reason.NOT_CANONICAL, path.toString(),
                    "Rejected: " + path + " cannot be canonicalized: " + e.getMessage(), e);
        }
    }

    private void requireAllowed(Path canonical) throws LaunchRejectedException {
        for (Path root : policy.allowedRoots()) {
            if (canonical.startsWith(root)) {
                return;
            }
        }
        LOG.warn("Launch of {} rejected: outside allowed directories", canonical);
        throw new LaunchRejectedException(Reason.OUTSIDE_ALLOW_LIST, canonical.toString(),
                "Launch rejected: " + canonical + " is not inside an allowed application or binary directory");
    }
}
