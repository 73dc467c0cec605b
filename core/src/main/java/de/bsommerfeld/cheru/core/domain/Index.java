package de.bsommerfeld.cheru.core.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sorted, deduplicated collection of {@link Entry entries} of a single
 * {@link EntryKind}.
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>Entries are ordered case-insensitively by name. Entries with names that
 * differ only in case are ordered by their identity key, so the order never
 * depends on discovery order.</li>
 * <li>No two entries share an identity key. The key is chosen by the indexer
 * when offering an entry to the {@link Builder}: the display name for
 * applications and system actions, the canonical absolute path for folders and
 * images. The first offer of a key wins.</li>
 * <li>If the builder was created with a cap, no more than {@code cap} entries
 * are accepted.</li>
 * </ul>
 *
 * <p>
 * Membership and order are frozen by {@link Builder#build()}. The only
 * mutation afterwards is {@link #replaceIcon(int, String)}, which callers must
 * perform while holding the index exclusively.
 */
public final class Index implements Iterable<Entry> {

    private static final Comparator<Keyed> ORDER = Comparator
            .comparing((Keyed k) -> k.entry.name().toLowerCase(Locale.ROOT))
            .thenComparing(k -> k.key);

    private final EntryKind kind;
    private final List<Entry> entries;

    private Index(EntryKind kind, List<Entry> entries) {
        this.kind = kind;
        this.entries = Collections.unmodifiableList(entries);
    }

    public static Index empty(EntryKind kind) {
        return new Index(kind, new ArrayList<>());
    }

    /** Starts an uncapped index. */
    public static Builder builder(EntryKind kind) {
        return new Builder(kind, Integer.MAX_VALUE);
    }

    /** Starts an index that accepts at most {@code cap} entries. */
    public static Builder builder(EntryKind kind, int cap) {
        if (cap < 0) {
            throw new IllegalArgumentException("cap must not be negative: " + cap);
        }
        return new Builder(kind, cap);
    }

    public EntryKind kind() {
        return kind;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Entry get(int position) {
        return entries.get(position);
    }

    /** Unmodifiable view in index order. */
    public List<Entry> entries() {
        return entries;
    }

    /**
     * Replaces the icon of the entry at {@code position}. Identity and order are
     * unaffected.
     */
    public void replaceIcon(int position, String icon) {
        entries.get(position).updateIcon(icon);
    }

    @Override
    public Iterator<Entry> iterator() {
        return entries.iterator();
    }

    @Override
    public String toString() {
        return "Index[" + kind + ", " + entries.size() + " entries]";
    }

    /**
     * Collects entries for one index. Not thread-safe; every indexer builds its
     * index on a single thread.
     */
    public static final class Builder {

        private final EntryKind kind;
        private final int cap;
        private final Map<String, Entry> byKey = new LinkedHashMap<>();

        private Builder(EntryKind kind, int cap) {
            this.kind = kind;
            this.cap = cap;
        }

        /**
         * Offers an entry under the given identity key.
         *
         * @return {@code true} if the entry was accepted, {@code false} if the
         *         key was already present or the cap is reached
         * @throws IllegalArgumentException if the entry's kind does not match
         *                                  this index
         */
        public boolean add(String key, Entry entry) {
            if (entry.kind() != kind) {
                throw new IllegalArgumentException(
                        "Cannot add " + entry.kind() + " entry to " + kind + " index");
            }
            if (isFull() || byKey.containsKey(key)) {
                return false;
            }
            byKey.put(key, entry);
            return true;
        }

        public boolean contains(String key) {
            return byKey.containsKey(key);
        }

        public boolean isFull() {
            return byKey.size() >= cap;
        }

        public int size() {
            return byKey.size();
        }

        public Index build() {
            List<Keyed> keyed = new ArrayList<>(byKey.size());
            for (Map.Entry<String, Entry> e : byKey.entrySet()) {
                keyed.add(new Keyed(e.getKey(), e.getValue()));
            }
            keyed.sort(ORDER);

            List<Entry> sorted = new ArrayList<>(keyed.size());
            for (Keyed k : keyed) {
                sorted.add(k.entry);
            }
            return new Index(kind, sorted);
        }
    }

    private static final class Keyed {
        final String key;
        final Entry entry;

        Keyed(String key, Entry entry) {
            this.key = key;
            this.entry = entry;
        }
    }
}
