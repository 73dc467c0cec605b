package de.bsommerfeld.cheru.launch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * {@link ProcessSpawner} backed by {@link ProcessBuilder}. Output of the child
 * is discarded so it can never block on a full pipe.
 */
public class NativeProcessSpawner implements ProcessSpawner {

    private static final Logger LOG = LoggerFactory.getLogger(NativeProcessSpawner.class);

    @Override
    public void spawn(List<String> command) throws SpawnFailedException {
        try {
            Process process = new ProcessBuilder(command)
                    .redirectInput(ProcessBuilder.Redirect.PIPE)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            process.getOutputStream().close();
            LOG.info("Started {} (pid {})", command.get(0), process.pid());
        } catch (IOException e) {
            throw new SpawnFailedException(command, e);
        }
    }
}
