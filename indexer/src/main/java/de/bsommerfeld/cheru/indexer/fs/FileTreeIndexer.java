package de.bsommerfeld.cheru.indexer.fs;

import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.domain.Index;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Bounded, exclusion-aware recursive walk that turns a
 * {@link FileTreeProfile} into an {@link Index}.
 *
 * <h3>Traversal rules</h3>
 * <ul>
 * <li>Hidden entries (name starting with {@code .}) are skipped.</li>
 * <li>Noise directories ({@link #NOISE_DIRECTORIES}) are pruned without
 * descending into them.</li>
 * <li>Application bundles ({@code *.app}) are neither indexed nor entered.</li>
 * <li>Every directory is visited at most once by canonical path, so
 * overlapping roots and symlink loops do not produce duplicates.</li>
 * <li>The walk stops as soon as the profile's cap is reached.</li>
 * <li>Unreadable directories are skipped.</li>
 * </ul>
 * Siblings are visited in name order so that capped results do not depend on
 * the order the filesystem happens to return.
 */
public final class FileTreeIndexer {

    private static final Logger LOG = LoggerFactory.getLogger(FileTreeIndexer.class);

    static final Set<String> NOISE_DIRECTORIES = Set.of(
            "node_modules", "target", "build", "dist", "out", ".git", "__pycache__",
            "venv", ".venv", ".cache", ".npm", ".gradle", ".m2", ".cargo", ".idea",
            "Library", "Applications", "AppData", "$RECYCLE.BIN", "System Volume Information",
            "vendor", "bower_components", "DerivedData", "Pods");

    private final FileTreeProfile profile;

    public FileTreeIndexer(FileTreeProfile profile) {
        this.profile = profile;
    }

    public Index buildIndex() {
        Index.Builder builder = Index.builder(profile.kind(), profile.maxResults());
        Set<Path> visited = new HashSet<>();

        for (Path root : profile.roots()) {
            if (builder.isFull())
                break;
            if (!Files.isDirectory(root))
                continue;

            Path canonical = canonicalize(root);
            if (canonical == null || !visited.add(canonical))
                continue;

            if (profile.includeRoots()) {
                offer(builder, canonical, true);
            }
            walk(canonical, 1, builder, visited);
        }

        Index index = builder.build();
        LOG.debug("Indexed {} {} entries", index.size(), profile.kind());
        return index;
    }

    private void walk(Path dir, int depth, Index.Builder builder, Set<Path> visited) {
        if (depth > profile.maxDepth())
            return;

        for (Path child : listSorted(dir)) {
            if (builder.isFull())
                return;

            String name = child.getFileName().toString();
            if (name.startsWith(".") || name.endsWith(".app"))
                continue;

            boolean directory = Files.isDirectory(child);
            if (directory) {
                if (NOISE_DIRECTORIES.contains(name))
                    continue;

                Path canonical = canonicalize(child);
                if (canonical == null || !visited.add(canonical))
                    continue;

                offer(builder, canonical, true);
                walk(canonical, depth + 1, builder, visited);
            } else if (profile.filter().accept(child, false)) {
                Path canonical = canonicalize(child);
                if (canonical != null) {
                    builder.add(canonical.toString(), toEntry(canonical));
                }
            }
        }
    }

    private void offer(Index.Builder builder, Path canonicalDir, boolean directory) {
        if (profile.filter().accept(canonicalDir, directory)) {
            builder.add(canonicalDir.toString(), toEntry(canonicalDir));
        }
    }

    private Entry toEntry(Path canonical) {
        Path fileName = canonical.getFileName();
        String name = fileName != null ? fileName.toString() : canonical.toString();
        Path parent = canonical.getParent();
        return new Entry(name, canonical.toString(), null,
                parent != null ? parent.toString() : null, profile.kind());
    }

    private static List<Path> listSorted(Path dir) {
        try (Stream<Path> children = Files.list(dir)) {
            return children.sorted().collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            LOG.debug("Skipping unreadable directory {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    private static Path canonicalize(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            LOG.debug("Cannot canonicalize {}: {}", path, e.getMessage());
            return null;
        }
    }
}
