package de.bsommerfeld.cheru.catalog;

import de.bsommerfeld.cheru.core.config.SearchConfig;
import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.domain.EntryKind;
import de.bsommerfeld.cheru.core.domain.Index;
import de.bsommerfeld.cheru.core.event.ApplicationEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CatalogTest {

    private AtomicInteger folderBuilds;
    private SearchConfig config;
    private Catalog catalog;

    @BeforeEach
    void setUp() {
        folderBuilds = new AtomicInteger();
        config = new SearchConfig();
        ApplicationEventBus eventBus = new ApplicationEventBus();

        LazyIndex folders = new LazyIndex(EntryKind.FOLDER, () -> {
            folderBuilds.incrementAndGet();
            return LazyIndexTest.folders("Documents", "Downloads", "Projects");
        }, eventBus);
        LazyIndex images = new LazyIndex(EntryKind.IMAGE, () -> Index.empty(EntryKind.IMAGE), eventBus);

        catalog = new Catalog(
                applications("Firefox", "Files", "Calculator", "Slack"),
                systemActions("Lock Screen", "Sleep"),
                folders, images, new FuzzyMatcher(), config);
    }

    @Test
    void searchApplications_shouldListAllAlphabeticallyForEmptyQuery() {
        assertEquals(List.of("Calculator", "Files", "Firefox", "Slack"), names(catalog.searchApplications("")));
    }

    @Test
    void searchApplications_shouldAppendMatchingSystemActions() {
        List<Entry> results = catalog.searchApplications("sl");

        assertEquals(EntryKind.APPLICATION, results.get(0).kind());
        assertEquals("Slack", results.get(0).name());
        assertEquals("Sleep", results.get(results.size() - 1).name());
        assertEquals(EntryKind.SYSTEM_ACTION, results.get(results.size() - 1).kind());
    }

    @Test
    void searchApplications_shouldRespectCap() {
        config.setMaxApplicationResults(2);

        assertEquals(2, catalog.searchApplications("").size());
    }

    @Test
    void searchApplications_shouldCapAppsAndSystemActionsTogether() {
        config.setMaxApplicationResults(3);

        List<Entry> results = catalog.searchApplications("s");

        assertEquals(3, results.size());
        assertEquals(EntryKind.APPLICATION, results.get(0).kind());
        assertEquals(EntryKind.APPLICATION, results.get(1).kind());
        assertEquals(EntryKind.SYSTEM_ACTION, results.get(2).kind());

        config.setMaxApplicationResults(2);
        assertEquals(List.of(EntryKind.APPLICATION, EntryKind.APPLICATION),
                catalog.searchApplications("s").stream().map(Entry::kind).collect(Collectors.toList()));
    }

    @Test
    void searchFolders_shouldNotBuildIndexForShortQueries() {
        assertTrue(catalog.searchFolders("d").isEmpty());
        assertFalse(catalog.isFolderIndexBuilt());
        assertEquals(0, folderBuilds.get());
    }

    @Test
    void searchFolders_shouldBuildOnceAndRank() {
        assertEquals("Downloads", catalog.searchFolders("down").get(0).name());
        assertEquals("Documents", catalog.searchFolders("docu").get(0).name());

        assertEquals(1, folderBuilds.get());
        assertTrue(catalog.isFolderIndexBuilt());
    }

    @Test
    void searchFolders_shouldBuildOnceForConcurrentFirstQueries() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<List<Entry>>> futures = List.of(
                CompletableFuture.supplyAsync(() -> awaitThen(start, () -> catalog.searchFolders("proj"))),
                CompletableFuture.supplyAsync(() -> awaitThen(start, () -> catalog.searchFolders("proj"))),
                CompletableFuture.supplyAsync(() -> awaitThen(start, () -> catalog.searchFolders("proj"))));
        start.countDown();

        for (CompletableFuture<List<Entry>> future : futures) {
            assertEquals(List.of("Projects"), names(future.get(5, TimeUnit.SECONDS)));
        }
        assertEquals(1, folderBuilds.get());
    }

    @Test
    void searchImages_shouldReturnEmptyForEmptyIndex() {
        assertTrue(catalog.searchImages("cat").isEmpty());
    }

    @Test
    void searchSystemActions_shouldBeEmptyForBlankQuery() {
        assertTrue(catalog.searchSystemActions(" ").isEmpty());
        assertEquals(List.of("Lock Screen"), names(catalog.searchSystemActions("lock")));
    }

    @Test
    void applyApplicationIcons_shouldNotChangeEarlierResults() {
        Entry before = catalog.searchApplications("firefox").get(0);
        int position = positionOf("Firefox");

        catalog.applyApplicationIcons(Map.of(position, "/cache/Firefox.png", 99, "/ignored.png"));

        assertNull(before.icon());
        assertEquals("/cache/Firefox.png", catalog.searchApplications("firefox").get(0).icon());
        assertEquals(4, catalog.applicationCount());
    }

    @Test
    void applicationSnapshot_shouldBeDetachedCopies() {
        List<Entry> snapshot = catalog.applicationSnapshot();
        catalog.applyApplicationIcons(Map.of(0, "/cache/Calculator.png"));

        assertNull(snapshot.get(0).icon());
        assertEquals("Calculator", snapshot.get(0).name());
    }

    @Test
    void enrichApplications_shouldBlockQueriesUntilDone() throws Exception {
        CountDownLatch mutating = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<Void> writer = CompletableFuture.runAsync(() -> catalog.enrichApplications(index -> {
            mutating.countDown();
            awaitQuietly(release);
            index.replaceIcon(0, "/cache/new.png");
        }));
        assertTrue(mutating.await(5, TimeUnit.SECONDS));

        CompletableFuture<List<Entry>> reader = CompletableFuture.supplyAsync(() -> catalog.searchApplications(""));
        assertThrows(TimeoutException.class, () -> reader.get(200, TimeUnit.MILLISECONDS));

        release.countDown();
        writer.get(5, TimeUnit.SECONDS);
        assertEquals("/cache/new.png", reader.get(5, TimeUnit.SECONDS).get(0).icon());
    }

    @Test
    void constructor_shouldRejectMismatchedIndexKinds() {
        ApplicationEventBus eventBus = new ApplicationEventBus();
        LazyIndex folders = new LazyIndex(EntryKind.FOLDER, () -> Index.empty(EntryKind.FOLDER), eventBus);
        LazyIndex images = new LazyIndex(EntryKind.IMAGE, () -> Index.empty(EntryKind.IMAGE), eventBus);

        assertThrows(IllegalArgumentException.class, () -> new Catalog(
                Index.empty(EntryKind.FOLDER), Index.empty(EntryKind.SYSTEM_ACTION),
                folders, images, new FuzzyMatcher(), config));
    }

    private int positionOf(String name) {
        List<Entry> snapshot = catalog.applicationSnapshot();
        for (int i = 0; i < snapshot.size(); i++) {
            if (snapshot.get(i).name().equals(name))
                return i;
        }
        throw new AssertionError(name + " not indexed");
    }

    private static Index applications(String... names) {
        Index.Builder builder = Index.builder(EntryKind.APPLICATION);
        for (String name : names) {
            builder.add(name, new Entry(name, "/usr/bin/" + name.toLowerCase(), null, null, EntryKind.APPLICATION));
        }
        return builder.build();
    }

    private static Index systemActions(String... names) {
        Index.Builder builder = Index.builder(EntryKind.SYSTEM_ACTION);
        for (String name : names) {
            String id = name.toLowerCase().replace(' ', '-');
            builder.add(name, new Entry(name, "system:" + id, null, null, EntryKind.SYSTEM_ACTION));
        }
        return builder.build();
    }

    private static <T> T awaitThen(CountDownLatch latch, java.util.function.Supplier<T> action) {
        awaitQuietly(latch);
        return action.get();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static List<String> names(List<Entry> entries) {
        return entries.stream().map(Entry::name).collect(Collectors.toList());
    }
}
