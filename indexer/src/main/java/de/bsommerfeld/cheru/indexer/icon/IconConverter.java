package de.bsommerfeld.cheru.indexer.icon;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Rasterizes an icon file into a square PNG.
 */
@FunctionalInterface
public interface IconConverter {

    /**
     * @throws IOException if the conversion failed or produced no output
     */
    void convert(Path source, Path target, int size) throws IOException;
}
