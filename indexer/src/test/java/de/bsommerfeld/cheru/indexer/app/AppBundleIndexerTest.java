package de.bsommerfeld.cheru.indexer.app;

import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.domain.Index;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AppBundleIndexerTest {

    @TempDir
    Path tempDir;

    @Test
    void buildIndex_shouldPreferDisplayNameThenBundleNameThenStem() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("Applications"));
        bundle(root, "Safari.app", "<key>CFBundleDisplayName</key><string>Safari</string>"
                + "<key>CFBundleName</key><string>Ignored</string>");
        bundle(root, "Notes.app", "<key>CFBundleName</key><string>Notes</string>");
        bundle(root, "Weird Tool.app", "<key>CFBundleIdentifier</key><string>com.example.tool</string>");

        Index index = indexer(root).buildIndex();

        assertEquals(List.of("Notes", "Safari", "Weird Tool"), names(index));
    }

    @Test
    void buildIndex_shouldUseBundlePathAsLaunchTarget() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("Applications"));
        Path safari = bundle(root, "Safari.app", "<key>CFBundleName</key><string>Safari</string>");

        Entry entry = indexer(root).buildIndex().get(0);

        assertEquals(safari.toAbsolutePath().toString(), entry.launchTarget());
    }

    @Test
    void buildIndex_shouldAppendIcnsExtensionToIconFile() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("Applications"));
        Path app = bundle(root, "Maps.app", "<key>CFBundleName</key><string>Maps</string>"
                + "<key>CFBundleIconFile</key><string>AppIcon</string>"
                + "<key>CFBundleGetInfoString</key><string>Maps 3.0</string>");

        Entry entry = indexer(root).buildIndex().get(0);

        assertEquals(app.resolve("Contents/Resources/AppIcon.icns").toAbsolutePath().toString(), entry.icon());
        assertEquals("Maps 3.0", entry.description());
    }

    @Test
    void buildIndex_shouldKeepExplicitIconExtension() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("Applications"));
        bundle(root, "Mail.app", "<key>CFBundleIconFile</key><string>Mail.icns</string>");

        assertTrue(indexer(root).buildIndex().get(0).icon().endsWith("Mail.icns"));
    }

    @Test
    void buildIndex_shouldSkipBundlesWithoutInfoPlist() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("Applications"));
        Files.createDirectories(root.resolve("Broken.app/Contents"));
        bundle(root, "Good.app", "<key>CFBundleName</key><string>Good</string>");

        assertEquals(List.of("Good"), names(indexer(root).buildIndex()));
    }

    @Test
    void buildIndex_shouldDedupByNameAcrossRoots() throws IOException {
        Path system = Files.createDirectories(tempDir.resolve("System"));
        Path user = Files.createDirectories(tempDir.resolve("User"));
        Path first = bundle(system, "Terminal.app", "<key>CFBundleName</key><string>Terminal</string>");
        bundle(user, "Terminal.app", "<key>CFBundleName</key><string>Terminal</string>");

        Index index = new AppBundleIndexer(List.of(system, user), new InfoPlistReader()).buildIndex();

        assertEquals(1, index.size());
        assertEquals(first.toAbsolutePath().toString(), index.get(0).launchTarget());
    }

    @Test
    void buildIndex_shouldIgnoreNonBundleDirectories() throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("Applications"));
        Files.createDirectories(root.resolve("Utilities"));
        Files.writeString(root.resolve("readme.app"), "not a directory");

        assertTrue(indexer(root).buildIndex().isEmpty());
    }

    @Test
    void defaultRoots_shouldIncludeUserApplications() {
        Path home = Paths.get("/Users/me");

        List<Path> roots = AppBundleIndexer.defaultRoots(home);

        assertTrue(roots.contains(Paths.get("/Applications")));
        assertTrue(roots.contains(Paths.get("/System/Applications/Utilities")));
        assertTrue(roots.contains(home.resolve("Applications")));
    }

    @Test
    void bundleStem_shouldStripAppSuffix() {
        assertEquals("Visual Studio Code", AppBundleIndexer.bundleStem(Paths.get("/Applications/Visual Studio Code.app")));
    }

    private static AppBundleIndexer indexer(Path root) {
        return new AppBundleIndexer(List.of(root), new InfoPlistReader());
    }

    private static Path bundle(Path root, String dirName, String dictBody) throws IOException {
        Path bundle = root.resolve(dirName);
        Path contents = Files.createDirectories(bundle.resolve("Contents"));
        Files.writeString(contents.resolve("Info.plist"),
                "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<plist version=\"1.0\"><dict>"
                        + dictBody + "</dict></plist>\n");
        return bundle;
    }

    private static List<String> names(Index index) {
        return index.entries().stream().map(Entry::name).collect(Collectors.toList());
    }
}
