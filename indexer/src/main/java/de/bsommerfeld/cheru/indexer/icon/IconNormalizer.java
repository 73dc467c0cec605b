package de.bsommerfeld.cheru.indexer.icon;

import de.bsommerfeld.cheru.core.domain.Entry;

import java.util.List;

/**
 * Turns the raw icon references discovered by an application indexer into
 * files the UI can display.
 *
 * <p>
 * Implementations only compute the new references; they never touch the
 * entries. The caller publishes the result under the application index write
 * lock, so the slow part (process spawns, file probes) runs without holding
 * any lock.
 */
public interface IconNormalizer {

    /** Normalizer for platforms whose icons are usable as discovered. */
    IconNormalizer NONE = entries -> IconNormalization.none();

    /**
     * @param entries application entries in index order
     * @return the icon updates keyed by position in {@code entries}
     */
    IconNormalization normalize(List<Entry> entries);
}
