package de.bsommerfeld.cheru.launch;

import de.bsommerfeld.cheru.core.util.Platform;
import de.bsommerfeld.cheru.launch.LaunchRejectedException.Reason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class LaunchGateTest {

    @TempDir
    Path tempDir;

    private Path root;
    private Path apps;
    private Path bin;
    private Path home;
    private Path outside;
    private LaunchGate gate;

    @BeforeEach
    void setUp() throws IOException {
        root = tempDir.toRealPath();
        apps = Files.createDirectories(root.resolve("apps"));
        bin = Files.createDirectories(root.resolve("usr/bin"));
        home = Files.createDirectories(root.resolve("home/me"));
        outside = Files.createDirectories(root.resolve("outside"));
        gate = new LaunchGate(new LaunchPolicy(List.of(apps), List.of(bin),
                List.of(home.resolve("Applications")), home));
    }

    @Test
    void validateLaunch_shouldStripFieldCodesAndKeepArguments() throws Exception {
        Path tool = executable(bin.resolve("gimp"));

        LaunchRequest request = gate.validateLaunch(tool + " %U --new-instance");

        assertEquals(List.of(tool.toString(), "--new-instance"), request.command());
        assertFalse(request.bundle());
    }

    @Test
    void validateLaunch_shouldResolveBareCommandNamesInBinaryDirectories() throws Exception {
        assumeFalse(Platform.current().isWindows(), "relies on POSIX executable bits");
        Path tool = executable(bin.resolve("firefox"));

        LaunchRequest request = gate.validateLaunch("firefox %u");

        assertEquals(tool, request.target());
        assertEquals(List.of(tool.toString()), request.command());
    }

    @Test
    void validateLaunch_shouldRejectUnknownBareCommand() {
        LaunchRejectedException e = assertThrows(LaunchRejectedException.class,
                () -> gate.validateLaunch("does-not-exist"));

        assertEquals(Reason.NOT_FOUND, e.getReason());
    }

    @Test
    void validateLaunch_shouldRejectEmptyCommand() {
        LaunchRejectedException e = assertThrows(LaunchRejectedException.class,
                () -> gate.validateLaunch("%u %F"));

        assertEquals(Reason.EMPTY_COMMAND, e.getReason());
    }

    @Test
    void validateLaunch_shouldRejectRelativePaths() {
        assertEquals(Reason.NOT_ABSOLUTE, assertThrows(LaunchRejectedException.class,
                () -> gate.validateLaunch("bin/firefox")).getReason());
        assertEquals(Reason.NOT_ABSOLUTE, assertThrows(LaunchRejectedException.class,
                () -> gate.validateLaunch("./firefox --safe-mode")).getReason());
    }

    @Test
    void validateLaunch_shouldRejectTraversalOutOfAllowList() throws Exception {
        Path secret = executable(outside.resolve("tool"));

        LaunchRejectedException e = assertThrows(LaunchRejectedException.class,
                () -> gate.validateLaunch(apps + "/../outside/tool"));

        assertEquals(Reason.OUTSIDE_ALLOW_LIST, e.getReason());
        assertEquals(secret.toString(), e.getPath());
        assertTrue(e.getMessage().contains(secret.toString()));
    }

    @Test
    void validateLaunch_shouldRejectSystemFileReachedThroughApplications() {
        assumeTrue(Files.exists(Paths.get("/etc/passwd")), "needs /etc/passwd");
        LaunchGate systemGate = new LaunchGate(LaunchPolicy.forPlatform(Platform.LINUX, home));

        LaunchRejectedException e = assertThrows(LaunchRejectedException.class,
                () -> systemGate.validateLaunch("/Applications/../etc/passwd"));

        assertTrue(Set.of(Reason.NOT_FOUND, Reason.OUTSIDE_ALLOW_LIST).contains(e.getReason()), e.getReason().name());
    }

    @Test
    void validateLaunch_shouldCheckContainmentPerPathSegment() throws Exception {
        Path lookalike = Files.createDirectories(root.resolve("usr/binfoo"));
        Path tool = executable(lookalike.resolve("tool"));

        LaunchRejectedException e = assertThrows(LaunchRejectedException.class,
                () -> gate.validateLaunch(tool.toString()));

        assertEquals(Reason.OUTSIDE_ALLOW_LIST, e.getReason());
    }

    @Test
    void validateLaunch_shouldRejectSymlinkEscapingAllowList() throws Exception {
        Path target = executable(outside.resolve("payload"));
        Path link = bin.resolve("innocent");
        try {
            Files.createSymbolicLink(link, target);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported");
        }

        LaunchRejectedException e = assertThrows(LaunchRejectedException.class,
                () -> gate.validateLaunch(link.toString()));

        assertEquals(Reason.OUTSIDE_ALLOW_LIST, e.getReason());
        assertEquals(target.toString(), e.getPath());
    }

    @Test
    void validateLaunch_shouldSpawnSymlinkUnderItsOwnName() throws Exception {
        Path vim = executable(bin.resolve("vim.basic"));
        Path view = bin.resolve("view");
        try {
            Files.createSymbolicLink(view, vim);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported");
        }

        LaunchRequest request = gate.validateLaunch(view + " notes.txt");

        assertEquals(List.of(view.toString(), "notes.txt"), request.command());
        assertEquals(vim, request.target());
    }

    @Test
    void validateLaunch_shouldNotTreatBundleArgumentsAsBundle() throws Exception {
        Path tool = executable(bin.resolve("foo"));
        String profile = home.resolve("x.app/cfg").toString();

        LaunchRequest request = gate.validateLaunch(tool + " --profile " + profile);

        assertFalse(request.bundle());
        assertEquals(List.of(tool.toString(), "--profile", profile), request.command());
    }

    @Test
    void validateLaunch_shouldRejectMissingExecutable() {
        LaunchRejectedException e = assertThrows(LaunchRejectedException.class,
                () -> gate.validateLaunch(bin.resolve("ghost").toString()));

        assertEquals(Reason.NOT_FOUND, e.getReason());
    }

    @Test
    void validateLaunch_shouldAcceptBundleInAllowList() throws Exception {
        Path bundle = Files.createDirectories(apps.resolve("Visual Studio Code.app/Contents"));

        LaunchRequest request = gate.validateLaunch(bundle.getParent().toString());

        assertTrue(request.bundle());
        assertEquals(List.of("open", "-a", bundle.getParent().toString()), request.command());
    }

    @Test
    void validateLaunch_shouldAcceptBundleInUserApplications() throws Exception {
        Path bundle = Files.createDirectories(home.resolve("Applications/Tool.app"));

        assertTrue(gate.validateLaunch(bundle.toString()).bundle());
    }

    @Test
    void validateLaunch_shouldRejectBundleOutsideAllowList() throws Exception {
        Path bundle = Files.createDirectories(outside.resolve("Evil.app"));

        assertEquals(Reason.OUTSIDE_ALLOW_LIST, assertThrows(LaunchRejectedException.class,
                () -> gate.validateLaunch(bundle.toString())).getReason());
    }

    @Test
    void validateOpen_shouldAcceptPathsInsideHome() throws Exception {
        Path doc = Files.writeString(Files.createDirectories(home.resolve("Documents")).resolve("cv.pdf"), "pdf");

        assertEquals(doc, gate.validateOpen(doc.toString()));
    }

    @Test
    void validateOpen_shouldRejectPathsOutsideHome() {
        LaunchRejectedException e = assertThrows(LaunchRejectedException.class,
                () -> gate.validateOpen(home + "/../../outside"));

        assertEquals(Reason.OUTSIDE_HOME, e.getReason());
        assertEquals(outside.toString(), e.getPath());
    }

    @Test
    void validateOpen_shouldRejectRelativeAndMissingPaths() {
        assertEquals(Reason.NOT_ABSOLUTE, assertThrows(LaunchRejectedException.class,
                () -> gate.validateOpen("Documents")).getReason());
        assertEquals(Reason.NOT_FOUND, assertThrows(LaunchRejectedException.class,
                () -> gate.validateOpen(home.resolve("missing").toString())).getReason());
    }

    @Test
    void validateDirectory_shouldRejectFiles() throws Exception {
        Path file = Files.writeString(home.resolve("notes.txt"), "hi");

        assertEquals(Reason.NOT_DIRECTORY, assertThrows(LaunchRejectedException.class,
                () -> gate.validateDirectory(file.toString())).getReason());
        assertEquals(home, gate.validateDirectory(home.toString()));
    }

    @Test
    void isBundleTarget_shouldRecognizeBundlePaths() {
        assertTrue(LaunchGate.isBundleTarget("/Applications/Safari.app"));
        assertTrue(LaunchGate.isBundleTarget("/Applications/Safari.app/Contents/MacOS/Safari"));
        assertTrue(LaunchGate.isBundleTarget("/Applications/Visual Studio Code.app"));
        assertFalse(LaunchGate.isBundleTarget("/usr/bin/apply"));
        assertFalse(LaunchGate.isBundleTarget("/usr/bin/foo --profile /home/me/x.app/cfg"));
    }

    private static Path executable(Path path) throws IOException {
        Files.writeString(path, "#!/bin/sh\nexit 0\n");
        path.toFile().setExecutable(true);
        return path;
    }
}
