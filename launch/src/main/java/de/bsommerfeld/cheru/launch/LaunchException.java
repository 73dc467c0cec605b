package de.bsommerfeld.cheru.launch;

/**
 * Thrown when a selected entry could not be launched or opened.
 */
public abstract class LaunchException extends Exception {

    protected LaunchException(String message) {
        super(message);
    }

    protected LaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
