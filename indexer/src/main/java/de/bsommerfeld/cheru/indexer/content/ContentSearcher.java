package de.bsommerfeld.cheru.indexer.content;

import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.domain.EntryKind;
import de.bsommerfeld.cheru.core.util.SearchPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Full-text search over the user's working folders through ripgrep.
 *
 * <p>
 * Runs {@code rg --files-with-matches --fixed-strings --ignore-case} with a
 * depth and file-size limit and turns each matching path into a
 * {@link EntryKind#FILE_MATCH} entry, in the order ripgrep prints them. The
 * executable is located on every call, so installing ripgrep while the
 * launcher runs takes effect immediately. Without ripgrep the search returns
 * nothing.
 *
 * <p>
 * Output is read until the cap is reached; the process is then destroyed.
 * A ripgrep that never terminates on its own is not otherwise bounded.
 */
public final class ContentSearcher {

    private static final Logger LOG = LoggerFactory.getLogger(ContentSearcher.class);

    private final Supplier<Optional<Path>> locator;
    private final List<Path> roots;
    private final int maxDepth;
    private final String maxFileSize;
    private final int maxResults;

    public ContentSearcher(Supplier<Optional<Path>> locator, List<Path> roots, int maxDepth,
            String maxFileSize, int maxResults) {
        this.locator = locator;
        this.roots = List.copyOf(roots);
        this.maxDepth = maxDepth;
        this.maxFileSize = maxFileSize;
        this.maxResults = maxResults;
    }

    /** Searcher that looks up {@code rg} on the search path at call time. */
    public static ContentSearcher withRipgrep(List<Path> roots, int maxDepth, String maxFileSize, int maxResults) {
        return new ContentSearcher(() -> SearchPaths.find("rg"), roots, maxDepth, maxFileSize, maxResults);
    }

    /**
     * @return matching files, at most the configured cap; empty if ripgrep is
     *         not installed, no root exists, or the search failed
     */
    public List<Entry> search(String query) {
        if (query == null || query.isBlank())
            return List.of();

        Optional<Path> rg = locator.get();
        if (rg.isEmpty()) {
            LOG.debug("ripgrep not found, content search disabled");
            return List.of();
        }

        List<String> command = buildCommand(rg.get(), query);
        if (command == null)
            return List.of();

        try {
            return run(command);
        } catch (IOException e) {
            LOG.warn("Content search failed: {}", e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Content search interrupted");
            return List.of();
        }
    }

    List<String> buildCommand(Path rg, String query) {
        List<String> existingRoots = new ArrayList<>();
        for (Path root : roots) {
            if (Files.isDirectory(root)) {
                existingRoots.add(root.toString());
            }
        }
        if (existingRoots.isEmpty())
            return null;

        List<String> command = new ArrayList<>();
        command.add(rg.toString());
        command.add("--files-with-matches");
        command.add("--fixed-strings");
        command.add("--ignore-case");
        command.add("--max-depth");
        command.add(Integer.toString(maxDepth));
        command.add("--max-filesize");
        command.add(maxFileSize);
        command.add("--max-count");
        command.add("1");
        command.add("--");
        command.add(query);
        command.addAll(existingRoots);
        return command;
    }

    private List<Entry> run(List<String> command) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();

        List<Entry> hits = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (hits.size() < maxResults && (line = reader.readLine()) != null) {
                String clean = line.strip();
                if (clean.isEmpty())
                    continue;
                hits.add(toEntry(Paths.get(clean)));
            }
        } finally {
            if (process.isAlive()) {
                process.destroy();
            }
        }

        if (!process.waitFor(2, TimeUnit.SECONDS)) {
            process.destroyForcibly();
        }
        return hits;
    }

    private static Entry toEntry(Path file) {
        Path fileName = file.getFileName();
        Path parent = file.getParent();
        return new Entry(
                fileName != null ? fileName.toString() : file.toString(),
                file.toAbsolutePath().toString(),
                null,
                parent != null ? parent.toString() : null,
                EntryKind.FILE_MATCH);
    }
}
