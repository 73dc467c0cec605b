package de.bsommerfeld.cheru.indexer.system;

import java.util.List;

/**
 * One power or utility action offered alongside applications.
 *
 * @param id          stable identifier, launched as {@code system:<id>}
 * @param name        display name
 * @param description subtitle
 * @param command     fixed command line spawned for the action
 */
public record SystemAction(String id, String name, String description, List<String> command) {

    public static final String TARGET_PREFIX = "system:";

    public SystemAction {
        command = List.copyOf(command);
        if (command.isEmpty()) {
            throw new IllegalArgumentException("System action '" + id + "' has no command");
        }
    }

    public String launchTarget() {
        return TARGET_PREFIX + id;
    }
}
