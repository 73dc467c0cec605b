package de.bsommerfeld.cheru.core.event;

import de.bsommerfeld.cheru.core.domain.EntryKind;

/**
 * Lifecycle events of the catalog's indices.
 */
public class IndexEvents {

    public record ApplicationsIndexedEvent(int count, long elapsedMillis) {
    }

    /**
     * Fired once the background icon pass has published its results. Entries
     * returned by earlier queries still carry their previous icon, so the UI
     * re-runs the current query.
     */
    public record IconsNormalizedEvent(int converted, int reused, int failed) {
    }

    /**
     * Fired when a lazily built index (folders, images) finished its single
     * build.
     */
    public record LazyIndexBuiltEvent(EntryKind kind, int size, long elapsedMillis) {
    }
}
