package de.bsommerfeld.cheru.backend;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.cheru.catalog.Catalog;
import de.bsommerfeld.cheru.catalog.FuzzyMatcher;
import de.bsommerfeld.cheru.catalog.LazyIndex;
import de.bsommerfeld.cheru.core.config.SearchConfig;
import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.domain.EntryKind;
import de.bsommerfeld.cheru.core.domain.Index;
import de.bsommerfeld.cheru.core.event.ApplicationEventBus;
import de.bsommerfeld.cheru.core.event.IndexEvents;
import de.bsommerfeld.cheru.indexer.icon.IconNormalization;
import de.bsommerfeld.cheru.indexer.icon.IconNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class IconEnrichmentTaskTest {

    private ApplicationEventBus eventBus;
    private Catalog catalog;
    private final List<IndexEvents.IconsNormalizedEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        eventBus = new ApplicationEventBus();
        eventBus.register(new Object() {
            @Subscribe
            public void onIcons(IndexEvents.IconsNormalizedEvent event) {
                events.add(event);
            }
        });

        Index.Builder apps = Index.builder(EntryKind.APPLICATION);
        apps.add("Safari", new Entry("Safari", "/Applications/Safari.app", "/Applications/Safari.app/Contents/Resources/AppIcon.icns", null, EntryKind.APPLICATION));
        apps.add("Notes", new Entry("Notes", "/Applications/Notes.app", null, null, EntryKind.APPLICATION));

        catalog = new Catalog(apps.build(), Index.empty(EntryKind.SYSTEM_ACTION),
                new LazyIndex(EntryKind.FOLDER, () -> Index.empty(EntryKind.FOLDER), eventBus),
                new LazyIndex(EntryKind.IMAGE, () -> Index.empty(EntryKind.IMAGE), eventBus),
                new FuzzyMatcher(), new SearchConfig());
    }

    @Test
    void start_shouldPublishIconsAndPostEvent() throws Exception {
        IconNormalizer normalizer = entries -> {
            int safari = entries.indexOf(new Entry("Safari", "/Applications/Safari.app", null, null, EntryKind.APPLICATION));
            return new IconNormalization(Map.of(safari, "/cache/Safari.png"), 1, 0, 0);
        };
        IconEnrichmentTask task = new IconEnrichmentTask(catalog, normalizer, eventBus);

        Future<?> future = task.start();
        future.get(5, TimeUnit.SECONDS);

        assertEquals("/cache/Safari.png", catalog.searchApplications("safari").get(0).icon());
        assertEquals(List.of(new IndexEvents.IconsNormalizedEvent(1, 0, 0)), events);
    }

    @Test
    void start_shouldRunOnlyOnce() throws Exception {
        IconNormalizer normalizer = mock(IconNormalizer.class);
        when(normalizer.normalize(anyList())).thenReturn(IconNormalization.none());
        IconEnrichmentTask task = new IconEnrichmentTask(catalog, normalizer, eventBus);

        Future<?> first = task.start();
        Future<?> second = task.start();
        first.get(5, TimeUnit.SECONDS);

        assertNotNull(first);
        assertNull(second);
        assertTrue(task.isStarted());
        verify(normalizer, times(1)).normalize(anyList());
    }

    @Test
    void run_shouldKeepDiscoveredIconsWhenNormalizerFails() {
        IconNormalizer failing = entries -> {
            throw new IllegalStateException("sips crashed");
        };
        IconEnrichmentTask task = new IconEnrichmentTask(catalog, failing, eventBus);

        assertDoesNotThrow(task::run);

        assertEquals("/Applications/Safari.app/Contents/Resources/AppIcon.icns",
                catalog.searchApplications("safari").get(0).icon());
        assertTrue(events.isEmpty());
    }
}
