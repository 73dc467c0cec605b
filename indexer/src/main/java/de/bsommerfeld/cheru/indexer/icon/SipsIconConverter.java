package de.bsommerfeld.cheru.indexer.icon;

import de.bsommerfeld.cheru.core.util.SearchPaths;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * {@link IconConverter} backed by macOS {@code sips}:
 * {@code sips -s format png -z <size> <size> <source> --out <target>}.
 */
public final class SipsIconConverter implements IconConverter {

    private static final long TIMEOUT_SECONDS = 10;

    private final String sips;

    public SipsIconConverter(String sips) {
        this.sips = sips;
    }

    /** Uses {@code sips} from the search path, falling back to {@code /usr/bin/sips}. */
    public SipsIconConverter() {
        this(SearchPaths.find("sips").map(Path::toString).orElse("/usr/bin/sips"));
    }

    @Override
    public void convert(Path source, Path target, int size) throws IOException {
        String dimension = Integer.toString(size);
        Process process = new ProcessBuilder(sips, "-s", "format", "png", "-z", dimension, dimension,
                source.toString(), "--out", target.toString())
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();

        try {
            if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException("sips timed out converting " + source);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while converting " + source, e);
        }

        if (process.exitValue() != 0) {
            throw new IOException("sips exited with code " + process.exitValue() + " for " + source);
        }
        if (!Files.isRegularFile(target)) {
            throw new IOException("sips produced no output for " + source);
        }
    }
}
