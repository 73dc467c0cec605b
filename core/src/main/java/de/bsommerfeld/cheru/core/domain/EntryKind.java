package de.bsommerfeld.cheru.core.domain;

/**
 * The source an {@link Entry} was produced by. Determines how the entry is
 * deduplicated inside its {@link Index} and how the UI layer acts on it when
 * selected (launch vs. open).
 */
public enum EntryKind {

    /** An installed application, keyed by display name. */
    APPLICATION,

    /** A directory below one of the well-known personal roots, keyed by canonical path. */
    FOLDER,

    /** An image file below one of the well-known personal roots, keyed by canonical path. */
    IMAGE,

    /** A power or utility action from the static system action table. */
    SYSTEM_ACTION,

    /** A per-query hit of the external content search. Never pre-indexed. */
    FILE_MATCH;

    /**
     * Returns {@code true} if entries of this kind are opened with the
     * platform's file handler rather than executed.
     */
    public boolean isOpenable() {
        return this == FOLDER || this == IMAGE || this == FILE_MATCH;
    }
}
