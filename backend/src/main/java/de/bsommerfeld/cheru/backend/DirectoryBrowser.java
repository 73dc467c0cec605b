package de.bsommerfeld.cheru.backend;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.cheru.catalog.Catalog;
import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.domain.EntryKind;
import de.bsommerfeld.cheru.indexer.fs.FileTreeProfile;
import de.bsommerfeld.cheru.launch.LaunchGate;
import de.bsommerfeld.cheru.launch.LaunchRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Lists the folders and images directly inside a home-contained directory,
 * and resolves the first segment of a browse query ({@code downloads/...}) to
 * a folder.
 */
@Singleton
public class DirectoryBrowser {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryBrowser.class);

    static final int MAX_CHILDREN = 500;

    private static final Comparator<Entry> FOLDERS_FIRST = Comparator
            .comparing((Entry e) -> e.kind() != EntryKind.FOLDER)
            .thenComparing(e -> e.name().toLowerCase(Locale.ROOT));

    private final LaunchGate gate;
    private final Catalog catalog;
    private final Cache<String, Path> resolvedBases = CacheBuilder.newBuilder()
            .maximumSize(256)
            .build();

    @Inject
    public DirectoryBrowser(LaunchGate gate, Catalog catalog) {
        this.gate = gate;
        this.catalog = catalog;
    }

    /**
     * Immediate children of {@code path}. Hidden entries and files that are not
     * images are left out. With a non-blank filter the children are ranked
     * against it; otherwise folders come first, then files, each by name.
     *
     * @throws LaunchRejectedException if {@code path} is not a directory inside
     *                                  the home directory
     */
    public List<Entry> browse(String path, String filter) throws LaunchRejectedException {
        Path dir = gate.validateDirectory(path);
        List<Entry> children = listChildren(dir);

        if (filter != null && !filter.isBlank()) {
            return catalog.rank(filter, children, MAX_CHILDREN);
        }
        return children;
    }

    /**
     * Browses a query of the form {@code base/sub/dir/filter}: the first
     * segment is resolved to a folder, the segments up to the last slash are
     * the directory below it, and the rest is the filter.
     *
     * @return the listing, or an empty list if the base does not resolve
     */
    public List<Entry> browseQuery(String query) throws LaunchRejectedException {
        int slash = query == null ? -1 : query.indexOf('/');
        if (slash <= 0)
            return List.of();

        Optional<Path> base = resolveBase(query.substring(0, slash));
        if (base.isEmpty())
            return List.of();

        String rest = query.substring(slash + 1);
        int lastSlash = rest.lastIndexOf('/');
        Path dir = lastSlash < 0 ? base.get() : base.get().resolve(rest.substring(0, lastSlash));
        String filter = lastSlash < 0 ? rest : rest.substring(lastSlash + 1);
        return browse(dir.toString(), filter);
    }

    /**
     * Best folder match for the first segment of a browse query. Successful
     * resolutions are cached per lowercase segment; misses are retried.
     */
    public Optional<Path> resolveBase(String segment) {
        if (segment == null || segment.isBlank())
            return Optional.empty();

        String key = segment.strip().toLowerCase(Locale.ROOT);
        Path cached = resolvedBases.getIfPresent(key);
        if (cached != null)
            return Optional.of(cached);

        List<Entry> folders = catalog.searchFolders(key);
        if (folders.isEmpty())
            return Optional.empty();

        Path resolved = Path.of(folders.get(0).launchTarget());
        resolvedBases.put(key, resolved);
        LOG.debug("Browse base '{}' resolved to {}", key, resolved);
        return Optional.of(resolved);
    }

    /** Folder and image children, folders first then by name, at most {@link #MAX_CHILDREN}. */
    static List<Entry> listChildren(Path dir) {
        List<Entry> children = new ArrayList<>();
        try (Stream<Path> stream = Files.list(dir)) {
            stream.forEach(child -> {
                String name = child.getFileName().toString();
                if (name.startsWith("."))
                    return;

                if (Files.isDirectory(child)) {
                    children.add(new Entry(name, child.toString(), null, dir.toString(), EntryKind.FOLDER));
                } else if (FileTreeProfile.isImage(child)) {
                    children.add(new Entry(name, child.toString(), null, dir.toString(), EntryKind.IMAGE));
                }
            });
        } catch (IOException | UncheckedIOException e) {
            LOG.debug("Cannot list {}: {}", dir, e.getMessage());
        }
        children.sort(FOLDERS_FIRST);
        if (children.size() > MAX_CHILDREN) {
            LOG.debug("{} has {} children, keeping the first {}", dir, children.size(), MAX_CHILDREN);
            return new ArrayList<>(children.subList(0, MAX_CHILDREN));
        }
        return children;
    }
}
