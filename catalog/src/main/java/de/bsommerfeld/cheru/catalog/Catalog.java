package de.bsommerfeld.cheru.catalog;

import de.bsommerfeld.cheru.core.config.SearchConfig;
import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.domain.EntryKind;
import de.bsommerfeld.cheru.core.domain.Index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Holds every index of the launcher and answers queries against them.
 *
 * <h3>Concurrency</h3>
 * <ul>
 * <li>The application index sits behind a read/write lock. Queries share the
 * read lock; the icon enrichment pass takes the write lock once to publish its
 * results, so a query sees either all old or all new icons.</li>
 * <li>Folder and image indices are {@link LazyIndex lazy}: built on the first
 * query that needs them, exactly once.</li>
 * <li>The system action index never changes and needs no lock.</li>
 * <li>The single {@link FuzzyMatcher} is guarded by its own lock, held only
 * while scoring. Lock order is always index lock before matcher lock.</li>
 * </ul>
 * Results are copies of the indexed entries; callers never get a reference
 * into an index.
 */
public class Catalog {

    private final ReentrantReadWriteLock applicationLock = new ReentrantReadWriteLock();
    private final Index applications;
    private final Index systemActions;
    private final LazyIndex folders;
    private final LazyIndex images;

    private final Lock matcherLock = new ReentrantLock();
    private final FuzzyMatcher matcher;

    private final SearchConfig config;

    public Catalog(Index applications, Index systemActions, LazyIndex folders, LazyIndex images,
            FuzzyMatcher matcher, SearchConfig config) {
        requireKind(applications.kind(), EntryKind.APPLICATION);
        requireKind(systemActions.kind(), EntryKind.SYSTEM_ACTION);
        requireKind(folders.kind(), EntryKind.FOLDER);
        requireKind(images.kind(), EntryKind.IMAGE);

        this.applications = applications;
        this.systemActions = systemActions;
        this.folders = folders;
        this.images = images;
        this.matcher = matcher;
        this.config = config;
    }

    /**
     * Ranked applications, followed by matching system actions for non-blank
     * queries. A blank query lists applications alphabetically. The combined
     * list never exceeds the application result cap.
     */
    public List<Entry> searchApplications(String query) {
        List<Entry> results;
        applicationLock.readLock().lock();
        try {
            results = rankLocked(query, applications.entries(), config.getMaxApplicationResults());
        } finally {
            applicationLock.readLock().unlock();
        }

        if (query != null && !query.isBlank()) {
            List<Entry> actions = searchSystemActions(query);
            int room = config.getMaxApplicationResults() - results.size();
            if (!actions.isEmpty() && room > 0) {
                results = new ArrayList<>(results);
                results.addAll(actions.subList(0, Math.min(room, actions.size())));
                results = Collections.unmodifiableList(results);
            }
        }
        return results;
    }

    public List<Entry> searchFolders(String query) {
        if (!meetsMinimumLength(query))
            return List.of();
        return rank(query, folders.get().entries(), config.getMaxFolderResults());
    }

    public List<Entry> searchImages(String query) {
        if (!meetsMinimumLength(query))
            return List.of();
        return rank(query, images.get().entries(), config.getMaxImageResults());
    }

    public List<Entry> searchSystemActions(String query) {
        if (query == null || query.isBlank())
            return List.of();
        return rank(query, systemActions.entries(), config.getMaxSystemActionResults());
    }

    /**
     * Ranks arbitrary entries with the shared matcher, for result sets that are
     * not indexed (directory listings).
     */
    public List<Entry> rank(String query, List<Entry> entries, int cap) {
        return rankLocked(query, entries, cap);
    }

    private List<Entry> rankLocked(String query, List<Entry> entries, int cap) {
        int[] positions;
        matcherLock.lock();
        try {
            positions = matcher.search(query, entries);
        } finally {
            matcherLock.unlock();
        }

        int limit = Math.min(cap, positions.length);
        List<Entry> results = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            results.add(entries.get(positions[i]).copy());
        }
        return Collections.unmodifiableList(results);
    }

    /** Copies of all applications in index order, taken under the read lock. */
    public List<Entry> applicationSnapshot() {
        applicationLock.readLock().lock();
        try {
            List<Entry> copies = new ArrayList<>(applications.size());
            for (Entry entry : applications) {
                copies.add(entry.copy());
            }
            return copies;
        } finally {
            applicationLock.readLock().unlock();
        }
    }

    /**
     * Runs {@code mutation} on the application index while holding the write
     * lock. The mutation may only replace icons.
     */
    public void enrichApplications(Consumer<Index> mutation) {
        applicationLock.writeLock().lock();
        try {
            mutation.accept(applications);
        } finally {
            applicationLock.writeLock().unlock();
        }
    }

    /**
     * Publishes new icons by position, as computed from an
     * {@link #applicationSnapshot()}. Positions outside the index are ignored.
     */
    public void applyApplicationIcons(Map<Integer, String> icons) {
        if (icons.isEmpty())
            return;
        enrichApplications(index -> {
            for (Map.Entry<Integer, String> icon : icons.entrySet()) {
                int position = icon.getKey();
                if (position >= 0 && position < index.size()) {
                    index.replaceIcon(position, icon.getValue());
                }
            }
        });
    }

    public int applicationCount() {
        applicationLock.readLock().lock();
        try {
            return applications.size();
        } finally {
            applicationLock.readLock().unlock();
        }
    }

    public boolean isFolderIndexBuilt() {
        return folders.isBuilt();
    }

    public boolean isImageIndexBuilt() {
        return images.isBuilt();
    }

    /** Builds the folder index now instead of on the first folder query. */
    public void warmUpFolders() {
        folders.get();
    }

    private boolean meetsMinimumLength(String query) {
        return query != null && query.strip().length() >= config.getMinQueryLength();
    }

    private static void requireKind(EntryKind actual, EntryKind expected) {
        if (actual != expected) {
            throw new IllegalArgumentException("Expected " + expected + " index but got " + actual);
        }
    }
}
