package de.bsommerfeld.cheru.backend;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.cheru.catalog.Catalog;
import de.bsommerfeld.cheru.core.config.SearchConfig;
import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.util.Platform;
import de.bsommerfeld.cheru.indexer.content.ContentSearcher;
import de.bsommerfeld.cheru.indexer.system.SystemAction;
import de.bsommerfeld.cheru.indexer.system.SystemActionTable;
import de.bsommerfeld.cheru.launch.LaunchException;
import de.bsommerfeld.cheru.launch.LaunchGate;
import de.bsommerfeld.cheru.launch.LaunchRejectedException;
import de.bsommerfeld.cheru.launch.LaunchRejectedException.Reason;
import de.bsommerfeld.cheru.launch.LaunchRequest;
import de.bsommerfeld.cheru.launch.PlatformCommands;
import de.bsommerfeld.cheru.launch.ProcessSpawner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The operations the launcher UI calls: searching every source, browsing
 * directories, and launching or opening a selected entry.
 *
 * <p>
 * All methods are safe to call from several threads.
 */
@Singleton
public class LauncherBackend {

    private static final Logger LOG = LoggerFactory.getLogger(LauncherBackend.class);

    private final Catalog catalog;
    private final ContentSearcher contentSearcher;
    private final DirectoryBrowser browser;
    private final LaunchGate gate;
    private final ProcessSpawner spawner;
    private final SystemActionTable systemActions;
    private final Platform platform;
    private final SearchConfig searchConfig;

    @Inject
    public LauncherBackend(Catalog catalog, ContentSearcher contentSearcher, DirectoryBrowser browser,
            LaunchGate gate, ProcessSpawner spawner, SystemActionTable systemActions, Platform platform,
            SearchConfig searchConfig) {
        this.catalog = catalog;
        this.contentSearcher = contentSearcher;
        this.browser = browser;
        this.gate = gate;
        this.spawner = spawner;
        this.systemActions = systemActions;
        this.platform = platform;
        this.searchConfig = searchConfig;
    }

    public List<Entry> searchApplications(String query) {
        return catalog.searchApplications(query);
    }

    public List<Entry> searchFolders(String query) {
        return catalog.searchFolders(query);
    }

    public List<Entry> searchImages(String query) {
        return catalog.searchImages(query);
    }

    /** Files whose content contains {@code query}; empty without ripgrep. */
    public List<Entry> searchFileContents(String query) {
        if (query == null || query.strip().length() < searchConfig.getMinQueryLength())
            return List.of();
        return contentSearcher.search(query.strip());
    }

    public List<Entry> browseDirectory(String path, String filter) throws LaunchRejectedException {
        return browser.browse(path, filter);
    }

    /** Browses a {@code base/sub/filter} style query. */
    public List<Entry> browse(String query) throws LaunchRejectedException {
        return browser.browseQuery(query);
    }

    public Optional<Path> resolveBrowseBase(String segment) {
        return browser.resolveBase(segment);
    }

    /**
     * Validates and starts a launch target: an executable command line, an
     * application bundle, or a {@code system:<id>} action.
     */
    public void launch(String target) throws LaunchException {
        if (SystemActionTable.isActionTarget(target)) {
            SystemAction action = systemActions.find(target)
                    .orElseThrow(() -> new LaunchRejectedException(Reason.UNKNOWN_ACTION, target,
                            "Launch rejected: unknown system action '" + target + "'"));
            LOG.info("Running system action {}", action.id());
            spawner.spawn(action.command());
            return;
        }

        LaunchRequest request = gate.validateLaunch(target);
        LOG.info("Launching {}", request.target());
        spawner.spawn(request.command());
    }

    /** Opens a file or folder inside the home directory with the desktop's default handler. */
    public void openPath(String path) throws LaunchException {
        Path canonical = gate.validateOpen(path);
        LOG.info("Opening {}", canonical);
        spawner.spawn(PlatformCommands.openPath(platform, canonical));
    }

    public int indexSize() {
        return catalog.applicationCount();
    }
}
