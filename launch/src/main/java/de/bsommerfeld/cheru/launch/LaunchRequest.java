package de.bsommerfeld.cheru.launch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A validated launch: the exact argument vector to spawn.
 *
 * @param command argument vector, the first element is the program
 * @param target  the canonical executable or bundle that passed the gate
 * @param bundle  whether {@code target} is an application bundle
 */
public record LaunchRequest(List<String> command, Path target, boolean bundle) {

    public LaunchRequest {
        command = List.copyOf(command);
    }

    /** Bundles are handed to {@code open -a} rather than executed. */
    static LaunchRequest forBundle(Path bundle) {
        return new LaunchRequest(List.of("open", "-a", bundle.toString()), bundle, true);
    }

    /**
     * @param executable the program as invoked, which becomes {@code argv[0]}
     * @param canonical  its canonical path, as checked by the gate
     */
    static LaunchRequest forCommand(Path executable, Path canonical, List<String> arguments) {
        List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add(executable.toString());
        command.addAll(arguments);
        return new LaunchRequest(command, canonical, false);
    }
}
