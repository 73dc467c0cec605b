package de.bsommerfeld.cheru.backend;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.cheru.catalog.Catalog;
import de.bsommerfeld.cheru.catalog.FuzzyMatcher;
import de.bsommerfeld.cheru.catalog.LazyIndex;
import de.bsommerfeld.cheru.core.config.ApplicationMode;
import de.bsommerfeld.cheru.core.config.IndexConfig;
import de.bsommerfeld.cheru.core.config.LauncherConfig;
import de.bsommerfeld.cheru.core.config.SearchConfig;
import de.bsommerfeld.cheru.core.domain.EntryKind;
import de.bsommerfeld.cheru.core.domain.Index;
import de.bsommerfeld.cheru.core.event.ApplicationEventBus;
import de.bsommerfeld.cheru.core.event.IndexEvents;
import de.bsommerfeld.cheru.core.util.Platform;
import de.bsommerfeld.cheru.core.util.StorageUtils;
import de.bsommerfeld.cheru.indexer.app.AppBundleIndexer;
import de.bsommerfeld.cheru.indexer.app.ApplicationIndexer;
import de.bsommerfeld.cheru.indexer.app.DesktopEntryIndexer;
import de.bsommerfeld.cheru.indexer.app.UnsupportedPlatformIndexer;
import de.bsommerfeld.cheru.indexer.content.ContentSearcher;
import de.bsommerfeld.cheru.indexer.fs.FileTreeIndexer;
import de.bsommerfeld.cheru.indexer.fs.FileTreeProfile;
import de.bsommerfeld.cheru.indexer.icon.BundleIconNormalizer;
import de.bsommerfeld.cheru.indexer.icon.IconNormalizer;
import de.bsommerfeld.cheru.indexer.icon.SipsIconConverter;
import de.bsommerfeld.cheru.indexer.icon.ThemedIconResolver;
import de.bsommerfeld.cheru.indexer.system.SystemActionTable;
import de.bsommerfeld.cheru.launch.DryRunProcessSpawner;
import de.bsommerfeld.cheru.launch.LaunchGate;
import de.bsommerfeld.cheru.launch.LaunchPolicy;
import de.bsommerfeld.cheru.launch.NativeProcessSpawner;
import de.bsommerfeld.cheru.launch.ProcessSpawner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module wiring the launcher backend.
 *
 * <p>
 * The application index and system actions are built eagerly when the
 * {@link Catalog} is first provided. Folders and images are registered as lazy
 * indices. The platform decides which application discovery and icon
 * strategy is bound; the application mode decides whether launches really
 * start processes.
 */
public class BackendModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(BackendModule.class);

    static final String APP_NAME = "cheru";

    private final LauncherConfig config;
    private final Path home;
    private final Platform platform;
    private final ApplicationMode mode;

    public BackendModule(LauncherConfig config, Path home, Platform platform, ApplicationMode mode) {
        this.config = config;
        this.home = home;
        this.platform = platform;
        this.mode = mode;
    }

    public BackendModule(LauncherConfig config) {
        this(config, StorageUtils.userHome(), Platform.current(), ApplicationMode.get());
    }

    public BackendModule() {
        this(new LauncherConfig());
    }

    @Override
    protected void configure() {
        bind(LauncherConfig.class).toInstance(config);
        bind(SearchConfig.class).toInstance(config.getSearch());
        bind(IndexConfig.class).toInstance(config.getIndex());
        bind(Platform.class).toInstance(platform);

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode.spawnsProcesses()) {
            bind(ProcessSpawner.class).to(NativeProcessSpawner.class).in(Singleton.class);
        } else {
            // TEST MODE: record launches instead of starting programs
            bind(ProcessSpawner.class).to(DryRunProcessSpawner.class).in(Singleton.class);
        }
    }

    @Provides
    @Singleton
    ApplicationIndexer applicationIndexer() {
        switch (platform) {
            case LINUX:
                return DesktopEntryIndexer.forCurrentUser();
            case MACOS:
                return AppBundleIndexer.forCurrentUser();
            default:
                return new UnsupportedPlatformIndexer(System.getProperty("os.name", platform.name()));
        }
    }

    @Provides
    @Singleton
    IconNormalizer iconNormalizer(IndexConfig indexConfig) {
        switch (platform) {
            case MACOS:
                return new BundleIconNormalizer(StorageUtils.getIconCacheDir(APP_NAME), new SipsIconConverter(),
                        indexConfig.getIconSize());
            case LINUX:
                return ThemedIconResolver.forCurrentUser();
            default:
                return IconNormalizer.NONE;
        }
    }

    @Provides
    @Singleton
    SystemActionTable systemActionTable() {
        return SystemActionTable.forPlatform(platform);
    }

    @Provides
    @Singleton
    LaunchGate launchGate() {
        return new LaunchGate(LaunchPolicy.forPlatform(platform, home));
    }

    @Provides
    @Singleton
    ContentSearcher contentSearcher(IndexConfig indexConfig, SearchConfig searchConfig) {
        return ContentSearcher.withRipgrep(
                FileTreeProfile.folders(home).roots(),
                indexConfig.getContentSearchMaxDepth(),
                indexConfig.getContentSearchMaxFileSize(),
                searchConfig.getMaxContentResults());
    }

    @Provides
    @Singleton
    Catalog catalog(ApplicationIndexer indexer, SystemActionTable systemActions, IndexConfig indexConfig,
            SearchConfig searchConfig, ApplicationEventBus eventBus) {
        long start = System.currentTimeMillis();
        Index applications = indexer.buildIndex();
        long elapsed = System.currentTimeMillis() - start;
        LOG.info("Indexed {} applications in {} ms", applications.size(), elapsed);
        eventBus.post(new IndexEvents.ApplicationsIndexedEvent(applications.size(), elapsed));

        LazyIndex folders = new LazyIndex(EntryKind.FOLDER, () -> new FileTreeIndexer(
                FileTreeProfile.folders(home, indexConfig.getFolderMaxDepth(), indexConfig.getFolderCap()))
                .buildIndex(), eventBus);
        LazyIndex images = new LazyIndex(EntryKind.IMAGE, () -> new FileTreeIndexer(
                FileTreeProfile.images(home, indexConfig.getImageMaxDepth(), indexConfig.getImageCap()))
                .buildIndex(), eventBus);

        Catalog catalog = new Catalog(applications, systemActions.index(), folders, images, new FuzzyMatcher(),
                searchConfig);
        if (indexConfig.isEagerFolderIndex()) {
            catalog.warmUpFolders();
        }
        return catalog;
    }
}
