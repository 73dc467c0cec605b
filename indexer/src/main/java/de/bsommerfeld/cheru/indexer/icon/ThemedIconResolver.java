package de.bsommerfeld.cheru.indexer.icon;

import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves freedesktop themed icon names ({@code Icon=firefox}) to files.
 *
 * <p>
 * Looks in each base directory's {@code icons/hicolor/<size>/apps} for the
 * preferred sizes, then in the scalable directory, then in
 * {@code pixmaps}. Absolute icon paths and names that resolve nowhere are
 * left alone; the UI may still find them through its own theme lookup.
 */
public final class ThemedIconResolver implements IconNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(ThemedIconResolver.class);

    private static final String[] SIZES = { "64x64", "48x48", "128x128", "256x256", "32x32" };
    private static final String[] EXTENSIONS = { ".png", ".svg", ".xpm" };

    private final List<Path> baseDirs;

    public ThemedIconResolver(List<Path> baseDirs) {
        this.baseDirs = List.copyOf(baseDirs);
    }

    /** Resolver over {@code ~/.local/share}, {@code /usr/local/share} and {@code /usr/share}. */
    public static ThemedIconResolver forCurrentUser() {
        List<Path> dirs = new ArrayList<>();
        dirs.add(StorageUtils.userHome().resolve(".local").resolve("share"));
        dirs.add(Paths.get("/usr/local/share"));
        dirs.add(Paths.get("/usr/share"));
        return new ThemedIconResolver(dirs);
    }

    @Override
    public IconNormalization normalize(List<Entry> entries) {
        Map<Integer, String> icons = new HashMap<>();
        int failed = 0;

        for (int i = 0; i < entries.size(); i++) {
            String icon = entries.get(i).icon();
            if (icon == null || icon.isBlank() || icon.contains("/"))
                continue;

            Path resolved = resolve(icon);
            if (resolved != null) {
                icons.put(i, resolved.toString());
            } else {
                failed++;
            }
        }

        LOG.debug("Resolved {} themed icons, {} unresolved", icons.size(), failed);
        return new IconNormalization(icons, 0, icons.size(), failed);
    }

    Path resolve(String iconName) {
        for (Path base : baseDirs) {
            Path hicolor = base.resolve("icons").resolve("hicolor");
            for (String size : SIZES) {
                Path found = withExtension(hicolor.resolve(size).resolve("apps"), iconName);
                if (found != null)
                    return found;
            }
            Path scalable = withExtension(hicolor.resolve("scalable").resolve("apps"), iconName);
            if (scalable != null)
                return scalable;
        }
        for (Path base : baseDirs) {
            Path pixmap = withExtension(base.resolve("pixmaps"), iconName);
            if (pixmap != null)
                return pixmap;
        }
        return null;
    }

    private static Path withExtension(Path dir, String iconName) {
        for (String ext : EXTENSIONS) {
            Path candidate = dir.resolve(iconName + ext);
            if (Files.isRegularFile(candidate))
                return candidate.toAbsolutePath();
        }
        return null;
    }
}
