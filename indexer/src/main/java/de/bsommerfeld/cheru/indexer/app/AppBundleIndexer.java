package de.bsommerfeld.cheru.indexer.app;

import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.domain.EntryKind;
import de.bsommerfeld.cheru.core.domain.Index;
import de.bsommerfeld.cheru.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link ApplicationIndexer} over macOS {@code .app} bundles.
 *
 * <p>
 * Scans the system application folders and the user's {@code ~/Applications}
 * (non-recursively) for bundle directories and reads each bundle's
 * {@code Contents/Info.plist}:
 * <ul>
 * <li><strong>name</strong>: {@code CFBundleDisplayName}, then
 * {@code CFBundleName}, then the bundle's file name without {@code .app}</li>
 * <li><strong>launch target</strong>: the bundle path itself, handed to
 * {@code open -a} on launch</li>
 * <li><strong>icon</strong>: {@code Contents/Resources/<CFBundleIconFile>},
 * with {@code .icns} appended when the value has no extension. These are
 * rasterized later by the icon normalization pass.</li>
 * <li><strong>description</strong>: {@code CFBundleGetInfoString}</li>
 * </ul>
 * Bundles without a readable {@code Info.plist} are skipped.
 */
public final class AppBundleIndexer implements ApplicationIndexer {

    private static final Logger LOG = LoggerFactory.getLogger(AppBundleIndexer.class);

    static final String BUNDLE_SUFFIX = ".app";

    private final List<Path> roots;
    private final InfoPlistReader plistReader;

    public AppBundleIndexer(List<Path> roots, InfoPlistReader plistReader) {
        this.roots = List.copyOf(roots);
        this.plistReader = plistReader;
    }

    /** Indexer over the standard bundle roots of the invoking user. */
    public static AppBundleIndexer forCurrentUser() {
        return new AppBundleIndexer(defaultRoots(StorageUtils.userHome()), new InfoPlistReader());
    }

    static List<Path> defaultRoots(Path home) {
        return List.of(
                Paths.get("/Applications"),
                Paths.get("/System/Applications"),
                Paths.get("/System/Applications/Utilities"),
                home.resolve("Applications"));
    }

    @Override
    public Index buildIndex() {
        Index.Builder builder = Index.builder(EntryKind.APPLICATION);

        for (Path root : roots) {
            if (!Files.isDirectory(root))
                continue;

            for (Path bundle : listBundles(root)) {
                Entry entry = readBundle(bundle);
                if (entry != null) {
                    builder.add(entry.name(), entry);
                }
            }
        }
        return builder.build();
    }

    private List<Path> listBundles(Path root) {
        try (Stream<Path> children = Files.list(root)) {
            return children
                    .filter(p -> p.getFileName().toString().endsWith(BUNDLE_SUFFIX))
                    .filter(Files::isDirectory)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            LOG.debug("Cannot list bundle root {}: {}", root, e.getMessage());
            return List.of();
        }
    }

    private Entry readBundle(Path bundle) {
        Map<String, String> info;
        try {
            info = plistReader.readStrings(bundle.resolve("Contents").resolve("Info.plist"));
        } catch (IOException e) {
            LOG.debug("Skipping bundle {}: {}", bundle, e.getMessage());
            return null;
        }

        String name = firstNonBlank(info.get("CFBundleDisplayName"), info.get("CFBundleName"));
        if (name == null) {
            name = bundleStem(bundle);
        }

        return new Entry(
                name,
                bundle.toAbsolutePath().toString(),
                iconPath(bundle, info.get("CFBundleIconFile")),
                info.get("CFBundleGetInfoString"),
                EntryKind.APPLICATION);
    }

    private static String iconPath(Path bundle, String iconFile) {
        if (iconFile == null || iconFile.isBlank())
            return null;

        String file = iconFile.contains(".") ? iconFile : iconFile + ".icns";
        return bundle.resolve("Contents").resolve("Resources").resolve(file).toAbsolutePath().toString();
    }

    static String bundleStem(Path bundle) {
        String fileName = bundle.getFileName().toString();
        return fileName.endsWith(BUNDLE_SUFFIX)
                ? fileName.substring(0, fileName.length() - BUNDLE_SUFFIX.length())
                : fileName;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank())
            return a;
        if (b != null && !b.isBlank())
            return b;
        return null;
    }
}
