package de.bsommerfeld.cheru.indexer.app;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Minimal parser for freedesktop {@code .desktop} files.
 *
 * <p>
 * Only the {@code [Desktop Entry]} group is read; action groups
 * ({@code [Desktop Action ...]}) are ignored. Within the group, each line is a
 * {@code key=value} pair; blank lines and {@code #} comments are skipped.
 *
 * <h3>Localized keys</h3>
 * {@code Name} and {@code Comment} are looked up in the order
 * {@code Key[lang_COUNTRY]}, {@code Key[lang]}, {@code Key}, using the locale
 * passed at construction.
 *
 * <h3>Escapes</h3>
 * String values may contain {@code \s}, {@code \n}, {@code \t}, {@code \r} and
 * {@code \\}, which are decoded. The {@code Exec} value is kept raw: its field
 * codes are stripped by the launch gate, not here.
 */
public final class DesktopEntryParser {

    private static final String MAIN_GROUP = "[Desktop Entry]";

    private final String language;
    private final String languageCountry;

    public DesktopEntryParser(Locale locale) {
        this.language = locale.getLanguage();
        this.languageCountry = locale.getCountry().isEmpty()
                ? null
                : locale.getLanguage() + "_" + locale.getCountry();
    }

    public DesktopEntryParser() {
        this(Locale.getDefault());
    }

    /**
     * Parses the content of a {@code .desktop} file. Never throws for malformed
     * input: missing keys are {@code null}, unknown lines are skipped.
     */
    public DesktopEntry parse(String content) {
        Map<String, String> keys = readMainGroup(content);

        return new DesktopEntry(
                keys.get("Type"),
                localized(keys, "Name"),
                keys.get("Exec"),
                keys.get("Icon"),
                localized(keys, "Comment"),
                isTrue(keys.get("NoDisplay")),
                isTrue(keys.get("Hidden")));
    }

    private Map<String, String> readMainGroup(String content) {
        Map<String, String> keys = new HashMap<>();
        boolean inMainGroup = false;

        for (String rawLine : content.split("\\r?\\n")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#"))
                continue;

            if (line.startsWith("[")) {
                inMainGroup = line.equals(MAIN_GROUP);
                continue;
            }
            if (!inMainGroup)
                continue;

            int eq = line.indexOf('=');
            if (eq <= 0)
                continue;

            String key = line.substring(0, eq).strip();
            String value = line.substring(eq + 1).strip();
            // Duplicate keys: the first one counts
            keys.putIfAbsent(key, "Exec".equals(key) ? value : unescape(value));
        }
        return keys;
    }

    private String localized(Map<String, String> keys, String key) {
        if (languageCountry != null) {
            String value = keys.get(key + "[" + languageCountry + "]");
            if (value != null)
                return value;
        }
        if (!language.isEmpty()) {
            String value = keys.get(key + "[" + language + "]");
            if (value != null)
                return value;
        }
        return keys.get(key);
    }

    private static boolean isTrue(String value) {
        return value != null && value.equalsIgnoreCase("true");
    }

    static String unescape(String value) {
        if (value.indexOf('\\') < 0)
            return value;

        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\' || i == value.length() - 1) {
                out.append(c);
                continue;
            }
            char next = value.charAt(++i);
            switch (next) {
                case 's':
                    out.append(' ');
                    break;
                case 'n':
                    out.append('\n');
                    break;
                case 't':
                    out.append('\t');
                    break;
                case 'r':
                    out.append('\r');
                    break;
                case '\\':
                    out.append('\\');
                    break;
                default:
                    out.append('\\').append(next);
            }
        }
        return out.toString();
    }
}
