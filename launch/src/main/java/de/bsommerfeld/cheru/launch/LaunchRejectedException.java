package de.bsommerfeld.cheru.launch;

/**
 * Thrown when a launch or open target fails validation. Nothing was spawned.
 * The message names the resolved path and the failed check.
 */
public class LaunchRejectedException extends LaunchException {

    public enum Reason {
        EMPTY_COMMAND,
        NOT_ABSOLUTE,
        NOT_FOUND,
        NOT_CANONICAL,
        NOT_DIRECTORY,
        OUTSIDE_ALLOW_LIST,
        OUTSIDE_HOME,
        UNKNOWN_ACTION
    }

    private final Reason reason;
    private final String path;

    public LaunchRejectedException(Reason reason, String path, String message) {
        super(message);
        this.reason = reason;
        this.path = path;
    }

    public LaunchRejectedException(Reason reason, String path, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.path = path;
    }

    public Reason getReason() {
        return reason;
    }

    /** The offending path as resolved when the check failed, may be {@code null}. */
    public String getPath() {
        return path;
    }
}
