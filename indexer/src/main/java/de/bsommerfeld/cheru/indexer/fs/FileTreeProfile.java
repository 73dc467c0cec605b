package de.bsommerfeld.cheru.indexer.fs;

import de.bsommerfeld.cheru.core.domain.EntryKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parameters of one bounded filesystem walk.
 *
 * @param kind          entry kind produced, {@link EntryKind#FOLDER} or
 *                      {@link EntryKind#IMAGE}
 * @param roots         directories to walk, in priority order; missing roots
 *                      are skipped
 * @param maxDepth      deepest level below a root that is still visited
 * @param maxResults    cap on the number of entries
 * @param includeRoots  whether the roots themselves become entries
 * @param filter        decides which visited paths become entries
 */
public record FileTreeProfile(EntryKind kind, List<Path> roots, int maxDepth, int maxResults,
        boolean includeRoots, EntryFilter filter) {

    static final List<String> FOLDER_ROOTS = List.of(
            "Desktop", "Documents", "Downloads", "Pictures",
            "Projects", "dev", "code", "repos", "source");

    static final List<String> IMAGE_ROOTS = List.of("Desktop", "Documents", "Downloads", "Pictures");

    static final Set<String> IMAGE_EXTENSIONS = Set.of(
            "png", "jpg", "jpeg", "gif", "webp", "svg", "bmp", "tiff", "heic", "ico");

    /**
     * Decides whether a visited path becomes an entry. Traversal into
     * directories happens regardless of the verdict.
     */
    @FunctionalInterface
    public interface EntryFilter {
        boolean accept(Path path, boolean directory);
    }

    public FileTreeProfile {
        roots = List.copyOf(roots);
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        if (maxResults < 0) {
            throw new IllegalArgumentException("maxResults must not be negative: " + maxResults);
        }
    }

    /** Directories under the user's common working folders. */
    public static FileTreeProfile folders(Path home, int maxDepth, int maxResults) {
        return new FileTreeProfile(EntryKind.FOLDER, resolveAll(home, FOLDER_ROOTS), maxDepth, maxResults,
                true, (path, directory) -> directory);
    }

    public static FileTreeProfile folders(Path home) {
        return folders(home, 3, 500);
    }

    /** Image files under the user's desktop, documents, downloads and pictures. */
    public static FileTreeProfile images(Path home, int maxDepth, int maxResults) {
        return new FileTreeProfile(EntryKind.IMAGE, resolveAll(home, IMAGE_ROOTS), maxDepth, maxResults,
                false, (path, directory) -> !directory && isImage(path));
    }

    public static FileTreeProfile images(Path home) {
        return images(home, 3, 2000);
    }

    public static boolean isImage(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1)
            return false;
        return IMAGE_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static List<Path> resolveAll(Path home, List<String> names) {
        List<Path> paths = new ArrayList<>(names.size());
        for (String name : names) {
            paths.add(home.resolve(name));
        }
        return paths;
    }
}
