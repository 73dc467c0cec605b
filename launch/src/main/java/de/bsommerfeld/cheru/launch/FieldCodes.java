package de.bsommerfeld.cheru.launch;

import java.util.StringJoiner;

/**
 * Removes freedesktop {@code Exec} field codes ({@code %u}, {@code %F},
 * {@code %i}, ...) from a command line.
 */
public final class FieldCodes {

    private FieldCodes() {
    }

    /**
     * Drops every whitespace-separated token starting with {@code %} and joins
     * the rest with single spaces: {@code "gimp %U --new-instance"} becomes
     * {@code "gimp --new-instance"}.
     */
    public static String strip(String exec) {
        if (exec == null)
            return "";

        StringJoiner joined = new StringJoiner(" ");
        for (String token : exec.strip().split("\\s+")) {
            if (!token.isEmpty() && !token.startsWith("%")) {
                joined.add(token);
            }
        }
        return joined.toString();
    }
}
