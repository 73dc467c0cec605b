package de.bsommerfeld.cheru.core.domain;

import java.util.Objects;

/**
 * One launchable or openable item surfaced by search.
 *
 * <p>
 * {@code name}, {@code launchTarget}, {@code description} and {@code kind}
 * are fixed at construction. Only the icon reference may change afterwards,
 * and only through {@link Index#replaceIcon(int, String)} while the owning
 * index is held exclusively. The field is volatile so a reader always sees
 * either the old or the new reference.
 *
 * <p>
 * Equality ignores the icon: an entry before and after icon normalization is
 * the same entry.
 */
public final class Entry {

    private final String name;
    private final String launchTarget;
    private final String description;
    private final EntryKind kind;
    private volatile String icon;

    /**
     * @param name         display string, must not be blank
     * @param launchTarget executable command line, directory path, action id or
     *                     absolute file path
     * @param icon         icon reference, {@code null} if not (yet) known
     * @param description  optional subtitle, may be {@code null}
     * @param kind         the source kind
     */
    public Entry(String name, String launchTarget, String icon, String description, EntryKind kind) {
        this.name = Objects.requireNonNull(name, "name");
        this.launchTarget = Objects.requireNonNull(launchTarget, "launchTarget");
        this.kind = Objects.requireNonNull(kind, "kind");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Entry name must not be blank");
        }
        this.icon = icon;
        this.description = description;
    }

    public String name() {
        return name;
    }

    public String launchTarget() {
        return launchTarget;
    }

    /** Icon reference (file path or themed icon name), {@code null} if absent. */
    public String icon() {
        return icon;
    }

    /** Subtitle shown beneath the name, {@code null} if absent. */
    public String description() {
        return description;
    }

    public EntryKind kind() {
        return kind;
    }

    /**
     * Returns a detached copy carrying the icon as currently published. Query
     * results are handed out as copies so that a later icon update never
     * changes a result list the caller already holds.
     */
    public Entry copy() {
        return new Entry(name, launchTarget, icon, description, kind);
    }

    void updateIcon(String icon) {
        this.icon = icon;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Entry))
            return false;
        Entry other = (Entry) o;
        return name.equals(other.name)
                && launchTarget.equals(other.launchTarget)
                && Objects.equals(description, other.description)
                && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, launchTarget, description, kind);
    }

    @Override
    public String toString() {
        return "Entry[" + kind + " '" + name + "' -> " + launchTarget + "]";
    }
}
