package de.bsommerfeld.cheru.backend;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.cheru.catalog.Catalog;
import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.event.ApplicationEventBus;
import de.bsommerfeld.cheru.core.event.IndexEvents;
import de.bsommerfeld.cheru.indexer.icon.IconNormalization;
import de.bsommerfeld.cheru.indexer.icon.IconNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Best-effort background pass that normalizes application icons once after
 * startup.
 *
 * <p>
 * Runs on a single daemon thread. The icons are computed from a snapshot
 * without holding any lock and published in one write-locked step, then an
 * {@link IndexEvents.IconsNormalizedEvent} is posted. The task starts at most
 * once and is never restarted.
 */
@Singleton
public class IconEnrichmentTask {

    private static final Logger LOG = LoggerFactory.getLogger(IconEnrichmentTask.class);

    private final Catalog catalog;
    private final IconNormalizer normalizer;
    private final ApplicationEventBus eventBus;
    private final AtomicBoolean started = new AtomicBoolean();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "cheru-icon-enrichment");
        t.setDaemon(true);
        return t;
    });

    @Inject
    public IconEnrichmentTask(Catalog catalog, IconNormalizer normalizer, ApplicationEventBus eventBus) {
        this.catalog = catalog;
        this.normalizer = normalizer;
        this.eventBus = eventBus;
    }

    /**
     * Starts the pass. Later calls return {@code null} and do nothing.
     *
     * @return the running pass, for callers that want to wait for it
     */
    public Future<?> start() {
        if (!started.compareAndSet(false, true)) {
            LOG.debug("Icon enrichment already started");
            return null;
        }
        Future<?> future = executor.submit(this::run);
        executor.shutdown();
        return future;
    }

    public boolean isStarted() {
        return started.get();
    }

    void run() {
        try {
            List<Entry> snapshot = catalog.applicationSnapshot();
            IconNormalization result = normalizer.normalize(snapshot);
            catalog.applyApplicationIcons(result.icons());
            eventBus.post(new IndexEvents.IconsNormalizedEvent(result.converted(), result.reused(), result.failed()));
        } catch (RuntimeException e) {
            LOG.warn("Icon enrichment aborted, icons stay as discovered", e);
        }
    }
}
