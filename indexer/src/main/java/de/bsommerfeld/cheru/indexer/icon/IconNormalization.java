package de.bsommerfeld.cheru.indexer.icon;

import java.util.Map;

/**
 * Result of one icon normalization pass.
 *
 * @param icons     new icon reference per position in the list that was
 *                  normalized; positions without a change are absent
 * @param converted icons newly rasterized during this pass
 * @param reused    icons served from an existing cache file
 * @param failed    icons that could not be converted or resolved
 */
public record IconNormalization(Map<Integer, String> icons, int converted, int reused, int failed) {

    public IconNormalization {
        icons = Map.copyOf(icons);
    }

    public static IconNormalization none() {
        return new IconNormalization(Map.of(), 0, 0, 0);
    }

    public boolean isEmpty() {
        return icons.isEmpty();
    }
}
