package de.bsommerfeld.cheru.launch;

import java.util.List;

/**
 * Starts a detached process. The launcher never waits for or talks to the
 * processes it starts.
 */
public interface ProcessSpawner {

    void spawn(List<String> command) throws SpawnFailedException;
}
