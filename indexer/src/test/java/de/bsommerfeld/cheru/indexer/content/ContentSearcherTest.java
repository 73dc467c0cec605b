package de.bsommerfeld.cheru.indexer.content;

import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.domain.EntryKind;
import de.bsommerfeld.cheru.core.util.Platform;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class ContentSearcherTest {

    @TempDir
    Path tempDir;

    @Test
    void search_shouldReturnEmptyWithoutRipgrep() throws IOException {
        Files.createDirectories(tempDir.resolve("Documents"));
        ContentSearcher searcher = new ContentSearcher(Optional::empty,
                List.of(tempDir.resolve("Documents")), 4, "1M", 20);

        assertTrue(searcher.search("invoice").isEmpty());
    }

    @Test
    void search_shouldReturnEmptyForBlankQuery() {
        ContentSearcher searcher = new ContentSearcher(() -> fail("must not probe for ripgrep"),
                List.of(tempDir), 4, "1M", 20);

        assertTrue(searcher.search("  ").isEmpty());
    }

    @Test
    void buildCommand_shouldPassLimitsAndOnlyExistingRoots() throws IOException {
        Path docs = Files.createDirectories(tempDir.resolve("Documents"));
        ContentSearcher searcher = new ContentSearcher(Optional::empty,
                List.of(docs, tempDir.resolve("Missing")), 4, "1M", 20);

        List<String> command = searcher.buildCommand(Paths.get("/usr/bin/rg"), "-v");

        assertEquals(List.of("/usr/bin/rg", "--files-with-matches", "--fixed-strings", "--ignore-case",
                "--max-depth", "4", "--max-filesize", "1M", "--max-count", "1", "--", "-v", docs.toString()),
                command);
    }

    @Test
    void buildCommand_shouldReturnNullWithoutExistingRoots() {
        ContentSearcher searcher = new ContentSearcher(Optional::empty,
                List.of(tempDir.resolve("Missing")), 4, "1M", 20);

        assertNull(searcher.buildCommand(Paths.get("rg"), "query"));
    }

    @Test
    void search_shouldWrapHitsAsFileMatchesInOutputOrderAndCap() throws IOException {
        assumeFalse(Platform.current().isWindows(), "fake ripgrep is a shell script");
        Path docs = Files.createDirectories(tempDir.resolve("Documents"));
        Path fakeRg = tempDir.resolve("rg");
        Files.writeString(fakeRg, "#!/bin/sh\n"
                + "echo '" + docs.resolve("zeta.txt") + "'\n"
                + "echo '" + docs.resolve("alpha.md") + "'\n"
                + "echo '" + docs.resolve("notes/beta.txt") + "'\n");
        assumeFalse(!fakeRg.toFile().setExecutable(true), "cannot mark fake ripgrep executable");

        ContentSearcher searcher = new ContentSearcher(() -> Optional.of(fakeRg), List.of(docs), 4, "1M", 2);
        List<Entry> hits = searcher.search("invoice");

        assertEquals(2, hits.size());
        assertEquals("zeta.txt", hits.get(0).name());
        assertEquals("alpha.md", hits.get(1).name());
        assertEquals(EntryKind.FILE_MATCH, hits.get(0).kind());
        assertEquals(docs.resolve("zeta.txt").toString(), hits.get(0).launchTarget());
        assertEquals(docs.toString(), hits.get(0).description());
    }

    @Test
    void search_shouldReturnEmptyWhenRipgrepCannotStart() throws IOException {
        Path docs = Files.createDirectories(tempDir.resolve("Documents"));
        ContentSearcher searcher = new ContentSearcher(() -> Optional.of(tempDir.resolve("no-such-rg")),
                List.of(docs), 4, "1M", 20);

        assertTrue(searcher.search("invoice").isEmpty());
    }
}
