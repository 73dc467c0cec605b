package de.bsommerfeld.cheru.catalog;

import com.google.common.base.Suppliers;
import de.bsommerfeld.cheru.core.domain.EntryKind;
import de.bsommerfeld.cheru.core.domain.Index;
import de.bsommerfeld.cheru.core.event.ApplicationEventBus;
import de.bsommerfeld.cheru.core.event.IndexEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * An index that is built on first access and then shared.
 *
 * <p>
 * The first caller of {@link #get()} runs the build; callers arriving while
 * it runs block until it finishes and receive the same instance. If the build
 * throws, the exception reaches the caller that triggered it and the next
 * call tries again.
 */
public final class LazyIndex {

    private static final Logger LOG = LoggerFactory.getLogger(LazyIndex.class);

    private final EntryKind kind;
    private final Supplier<Index> memoized;
    private final ApplicationEventBus eventBus;
    private final AtomicInteger builds = new AtomicInteger();
    private final AtomicBoolean announced = new AtomicBoolean();
    private volatile boolean built;
    private volatile long buildMillis;

    public LazyIndex(EntryKind kind, Supplier<Index> builder, ApplicationEventBus eventBus) {
        this.kind = kind;
        this.eventBus = eventBus;
        this.memoized = Suppliers.memoize(() -> {
            builds.incrementAndGet();
            long start = System.currentTimeMillis();
            Index index = builder.get();
            long elapsed = System.currentTimeMillis() - start;

            if (index.kind() != kind) {
                throw new IllegalStateException("Builder for " + kind + " produced a " + index.kind() + " index");
            }
            buildMillis = elapsed;
            built = true;
            LOG.info("Built {} index with {} entries in {} ms", kind, index.size(), elapsed);
            return index;
        });
    }

    /**
     * Returns the index, building it if this is the first access. The built
     * event is posted once, after the build has completed, so subscribers may
     * call back into this index.
     */
    public Index get() {
        Index index = memoized.get();
        if (announced.compareAndSet(false, true)) {
            eventBus.post(new IndexEvents.LazyIndexBuiltEvent(kind, index.size(), buildMillis));
        }
        return index;
    }

    public EntryKind kind() {
        return kind;
    }

    public boolean isBuilt() {
        return built;
    }

    /** Number of builds started so far; at most one succeeds. */
    int buildCount() {
        return builds.get();
    }
}
