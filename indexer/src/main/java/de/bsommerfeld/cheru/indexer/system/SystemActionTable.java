package de.bsommerfeld.cheru.indexer.system;

import de.bsommerfeld.cheru.core.domain.Entry;
import de.bsommerfeld.cheru.core.domain.EntryKind;
import de.bsommerfeld.cheru.core.domain.Index;
import de.bsommerfeld.cheru.core.util.Platform;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static, per-platform table of system actions (lock, sleep, log out,
 * restart, shut down).
 */
public final class SystemActionTable {

    private final Map<String, SystemAction> actions;
    private final Index index;

    SystemActionTable(List<SystemAction> actions) {
        Map<String, SystemAction> byId = new LinkedHashMap<>();
        Index.Builder builder = Index.builder(EntryKind.SYSTEM_ACTION);
        for (SystemAction action : actions) {
            byId.put(action.id(), action);
            builder.add(action.name(), new Entry(action.name(), action.launchTarget(), null,
                    action.description(), EntryKind.SYSTEM_ACTION));
        }
        this.actions = byId;
        this.index = builder.build();
    }

    public static SystemActionTable forPlatform(Platform platform) {
        switch (platform) {
            case LINUX:
                return new SystemActionTable(linuxActions());
            case MACOS:
                return new SystemActionTable(macActions());
            default:
                return new SystemActionTable(List.of());
        }
    }

    public static SystemActionTable current() {
        return forPlatform(Platform.current());
    }

    public Index index() {
        return index;
    }

    /** Looks up the action for a {@code system:<id>} launch target. */
    public Optional<SystemAction> find(String launchTarget) {
        if (!isActionTarget(launchTarget))
            return Optional.empty();
        return Optional.ofNullable(actions.get(launchTarget.substring(SystemAction.TARGET_PREFIX.length())));
    }

    public static boolean isActionTarget(String launchTarget) {
        return launchTarget != null && launchTarget.startsWith(SystemAction.TARGET_PREFIX);
    }

    private static List<SystemAction> linuxActions() {
        return List.of(
                new SystemAction("lock", "Lock Screen", "Lock the current session",
                        List.of("loginctl", "lock-session")),
                new SystemAction("sleep", "Sleep", "Suspend the computer",
                        List.of("systemctl", "suspend")),
                new SystemAction("logout", "Log Out", "End the current session",
                        List.of("loginctl", "terminate-user", System.getProperty("user.name", ""))),
                new SystemAction("restart", "Restart", "Reboot the computer",
                        List.of("systemctl", "reboot")),
                new SystemAction("shutdown", "Shut Down", "Power off the computer",
                        List.of("systemctl", "poweroff")));
    }

    private static List<SystemAction> macActions() {
        return List.of(
                new SystemAction("lock", "Lock Screen", "Lock the current session",
                        List.of("pmset", "displaysleepnow")),
                new SystemAction("sleep", "Sleep", "Put the computer to sleep",
                        List.of("pmset", "sleepnow")),
                new SystemAction("logout", "Log Out", "End the current session",
                        List.of("osascript", "-e", "tell application \"System Events\" to log out")),
                new SystemAction("restart", "Restart", "Restart the computer",
                        List.of("osascript", "-e", "tell application \"System Events\" to restart")),
                new SystemAction("shutdown", "Shut Down", "Shut down the computer",
                        List.of("osascript", "-e", "tell application \"System Events\" to shut down")),
                new SystemAction("empty-trash", "Empty Trash", "Permanently erase items in the Trash",
                        List.of("osascript", "-e", "tell application \"Finder\" to empty trash")));
    }
}
