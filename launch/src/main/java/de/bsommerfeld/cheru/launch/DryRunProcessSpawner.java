package de.bsommerfeld.cheru.launch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records commands instead of starting them. Bound in test mode so that
 * selecting a result never starts a real program.
 */
public class DryRunProcessSpawner implements ProcessSpawner {

    private static final Logger LOG = LoggerFactory.getLogger(DryRunProcessSpawner.class);

    private final List<List<String>> spawned = new CopyOnWriteArrayList<>();

    @Override
    public void spawn(List<String> command) {
        LOG.info("[TEST MODE] Would start: {}", String.join(" ", command));
        spawned.add(List.copyOf(command));
    }

    public List<List<String>> spawned() {
        return List.copyOf(spawned);
    }
}
