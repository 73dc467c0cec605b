package de.bsommerfeld.cheru.indexer.icon;

import de.bsommerfeld.cheru.core.domain.Entry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rasterizes application bundle icons ({@code .icns}) into a PNG cache.
 *
 * <p>
 * Each icon is written to {@code <cacheDir>/<sanitized name>.png}, where every
 * character of the entry name outside {@code [A-Za-z0-9._-]} becomes
 * {@code _}. If that file already exists it is reused without conversion,
 * so repeated passes over the same catalog convert nothing. Entries whose icon
 * is missing, already a PNG, or fails to convert keep their current icon.
 */
public final class BundleIconNormalizer implements IconNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(BundleIconNormalizer.class);

    private final Path cacheDir;
    private final IconConverter converter;
    private final int size;

    public BundleIconNormalizer(Path cacheDir, IconConverter converter, int size) {
        this.cacheDir = cacheDir;
        this.converter = converter;
        this.size = size;
    }

    @Override
    public IconNormalization normalize(List<Entry> entries) {
        try {
            Files.createDirectories(cacheDir);
        } catch (IOException e) {
            LOG.warn("Icon cache directory {} unavailable, skipping icon normalization", cacheDir, e);
            return IconNormalization.none();
        }

        Map<Integer, String> icons = new HashMap<>();
        int converted = 0;
        int reused = 0;
        int failed = 0;

        for (int i = 0; i < entries.size(); i++) {
            Entry entry = entries.get(i);
            String icon = entry.icon();
            if (icon == null || icon.toLowerCase(Locale.ROOT).endsWith(".png"))
                continue;

            Path target = cachePath(entry.name());
            if (Files.isRegularFile(target)) {
                icons.put(i, target.toString());
                reused++;
                continue;
            }

            Path source = Path.of(icon);
            if (!Files.isRegularFile(source)) {
                LOG.debug("Icon {} of '{}' does not exist", source, entry.name());
                failed++;
                continue;
            }

            try {
                converter.convert(source, target, size);
                icons.put(i, target.toString());
                converted++;
            } catch (IOException e) {
                LOG.debug("Icon conversion failed for '{}': {}", entry.name(), e.getMessage());
                failed++;
            }
        }

        LOG.info("Icon normalization: {} converted, {} reused, {} failed", converted, reused, failed);
        return new IconNormalization(icons, converted, reused, failed);
    }

    Path cachePath(String name) {
        return cacheDir.resolve(sanitize(name) + ".png");
    }

    static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
