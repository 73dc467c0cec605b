package de.bsommerfeld.cheru.launch;

import java.io.IOException;
import java.util.List;

/**
 * Thrown when the operating system refused to start a validated command.
 */
public class SpawnFailedException extends LaunchException {

    private final List<String> command;

    public SpawnFailedException(List<String> command, IOException cause) {
        super("Failed to start " + String.join(" ", command) + ": " + cause.getMessage(), cause);
        this.command = List.copyOf(command);
    }

    public List<String> getCommand() {
        return command;
    }
}
