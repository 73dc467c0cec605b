package de.bsommerfeld.cheru.indexer.app;

import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.domain.EntryKind;
import de.bsommerfeld.cheru.core.domain.Index;
import de.bsommerfeld.cheru.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link ApplicationIndexer} over freedesktop {@code .desktop} manifests.
 *
 * <h3>Search order</h3>
 * Directories are scanned in XDG precedence order:
 * <ol>
 * <li>{@code $XDG_DATA_HOME/applications} (default
 * {@code ~/.local/share/applications})</li>
 * <li>{@code <dir>/applications} for every {@code dir} in
 * {@code $XDG_DATA_DIRS} (default {@code /usr/local/share:/usr/share})</li>
 * <li>the user and system flatpak export directories</li>
 * </ol>
 * A manifest's desktop-file ID is its path relative to the scanned directory
 * with {@code /} replaced by {@code -}. When two directories contain the same
 * ID, the earlier directory wins, so a user override shadows the system
 * manifest even if the override hides the application.
 *
 * <h3>Filtering</h3>
 * Manifests whose {@code Type} is not {@code Application}, or that are marked
 * {@code NoDisplay}/{@code Hidden}, or that lack a name or command, are
 * skipped. Unreadable files are skipped individually. The resulting index is
 * deduplicated by display name.
 */
public final class DesktopEntryIndexer implements ApplicationIndexer {

    private static final Logger LOG = LoggerFactory.getLogger(DesktopEntryIndexer.class);

    private static final int MAX_SCAN_DEPTH = 4;
    private static final String SUFFIX = ".desktop";

    private final List<Path> directories;
    private final DesktopEntryParser parser;

    public DesktopEntryIndexer(List<Path> directories, DesktopEntryParser parser) {
        this.directories = List.copyOf(directories);
        this.parser = parser;
    }

    /** Indexer over the XDG directories of the invoking user. */
    public static DesktopEntryIndexer forCurrentUser() {
        return new DesktopEntryIndexer(
                defaultDirectories(System.getenv("XDG_DATA_HOME"), System.getenv("XDG_DATA_DIRS"),
                        StorageUtils.userHome()),
                new DesktopEntryParser());
    }

    /**
     * Resolves the manifest directories from the XDG variables, applying the
     * XDG Base Directory defaults for unset or empty values.
     */
    static List<Path> defaultDirectories(String xdgDataHome, String xdgDataDirs, Path home) {
        Set<Path> dirs = new LinkedHashSet<>();

        Path dataHome = xdgDataHome == null || xdgDataHome.isBlank()
                ? home.resolve(".local").resolve("share")
                : Paths.get(xdgDataHome);
        dirs.add(dataHome.resolve("applications"));

        String dataDirs = xdgDataDirs == null || xdgDataDirs.isBlank()
                ? "/usr/local/share:/usr/share"
                : xdgDataDirs;
        for (String dir : dataDirs.split(":")) {
            if (!dir.isBlank()) {
                dirs.add(Paths.get(dir).resolve("applications"));
            }
        }

        dirs.add(dataHome.resolve("flatpak/exports/share/applications"));
        dirs.add(Paths.get("/var/lib/flatpak/exports/share/applications"));
        return new ArrayList<>(dirs);
    }

    @Override
    public Index buildIndex() {
        Index.Builder builder = Index.builder(EntryKind.APPLICATION);
        Set<String> seenIds = new HashSet<>();
        int scanned = 0;

        for (Path dir : directories) {
            if (!Files.isDirectory(dir))
                continue;

            for (Path file : listManifests(dir)) {
                String id = desktopFileId(dir, file);
                if (!seenIds.add(id))
                    continue;

                scanned++;
                Entry entry = readEntry(file);
                if (entry != null) {
                    builder.add(entry.name(), entry);
                }
            }
        }

        Index index = builder.build();
        LOG.debug("Scanned {} desktop manifests, {} applications", scanned, index.size());
        return index;
    }

    /**
     * Manifests below {@code dir}, sorted. Subdirectories that cannot be
     * opened are skipped on their own; the rest of the tree is still listed.
     */
    static List<Path> listManifests(Path dir) {
        List<Path> manifests = new ArrayList<>();
        try {
            Files.walkFileTree(dir, EnumSet.noneOf(FileVisitOption.class), MAX_SCAN_DEPTH,
                    new SimpleFileVisitor<>() {
                        @Override
                        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                            if (attrs.isRegularFile() && file.getFileName().toString().endsWith(SUFFIX)) {
                                manifests.add(file);
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFileFailed(Path file, IOException e) {
                            LOG.debug("Skipping unreadable {}: {}", file, e.getMessage());
                            return FileVisitResult.CONTINUE;
                        }
                    });
        } catch (IOException e) {
            LOG.debug("Cannot scan {}: {}", dir, e.getMessage());
        }
        Collections.sort(manifests);
        return manifests;
    }

    private Entry readEntry(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            DesktopEntry manifest = parser.parse(content);
            if (!manifest.isLaunchable())
                return null;

            return new Entry(manifest.name().strip(), manifest.exec(), manifest.icon(), manifest.comment(),
                    EntryKind.APPLICATION);
        } catch (IOException | UncheckedIOException e) {
            LOG.debug("Skipping unreadable manifest {}: {}", file, e.getMessage());
            return null;
        }
    }

    static String desktopFileId(Path dir, Path file) {
        return dir.relativize(file).toString().replace('/', '-').replace('\\', '-');
    }
}
