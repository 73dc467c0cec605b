package de.bsommerfeld.cheru.backend;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.util.StorageUtils;
import de.bsommerfeld.cheru.launch.LaunchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command-line entry point for exercising the backend without the launcher
 * window.
 *
 * <pre>
 * cheru apps &lt;query&gt;         rank applications and system actions
 * cheru folders &lt;query&gt;      rank indexed folders
 * cheru images &lt;query&gt;       rank indexed images
 * cheru content &lt;query&gt;      full-text search (needs ripgrep)
 * cheru browse &lt;base/path&gt;   browse a folder query such as downloads/ani
 * cheru launch &lt;target&gt;      validate and start a launch target
 * cheru open &lt;path&gt;          open a file or folder inside home
 * cheru size                 number of indexed applications
 * </pre>
 */
public final class CheruMain {

    static {
        // Must run before the first logger is created
        Path logDir = StorageUtils.getLogsDir(BackendModule.APP_NAME);
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (IOException e) {
            System.err.println("Failed to create log directory " + logDir + ": " + e.getMessage());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(CheruMain.class);

    private CheruMain() {
    }

    public static void main(String[] args) {
        Injector injector = Guice.createInjector(new BackendModule());
        LauncherBackend backend = injector.getInstance(LauncherBackend.class);
        IconEnrichmentTask enrichment = injector.getInstance(IconEnrichmentTask.class);
        Future<?> icons = enrichment.start();

        int exitCode = run(backend, args, System.out);
        awaitQuietly(icons);
        System.exit(exitCode);
    }

    static int run(LauncherBackend backend, String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println("usage: cheru <apps|folders|images|content|browse|launch|open|size> [argument]");
            return 2;
        }

        String command = args[0];
        String argument = String.join(" ", Arrays.copyOfRange(args, 1, args.length));
        try {
            switch (command) {
                case "apps":
                    print(backend.searchApplications(argument), out);
                    return 0;
                case "folders":
                    print(backend.searchFolders(argument), out);
                    return 0;
                case "images":
                    print(backend.searchImages(argument), out);
                    return 0;
                case "content":
                    print(backend.searchFileContents(argument), out);
                    return 0;
                case "browse":
                    print(backend.browse(argument), out);
                    return 0;
                case "launch":
                    backend.launch(argument);
                    return 0;
                case "open":
                    backend.openPath(argument);
                    return 0;
                case "size":
                    out.println(backend.indexSize());
                    return 0;
                default:
                    out.println("unknown command: " + command);
                    return 2;
            }
        } catch (LaunchException e) {
            LOG.warn("{} failed: {}", command, e.getMessage());
            out.println(e.getMessage());
            return 1;
        }
    }

    private static void print(List<Entry> entries, PrintStream out) {
        for (Entry entry : entries) {
            String description = entry.description() != null ? "  (" + entry.description() + ")" : "";
            out.println(String.format("%-14s %s -> %s%s", entry.kind(), entry.name(), entry.launchTarget(),
                    description));
        }
    }

    private static void awaitQuietly(Future<?> future) {
        if (future == null)
            return;
        try {
            future.get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOG.debug("Icon enrichment did not finish: {}", e.toString());
        }
    }
}
