package de.bsommerfeld.cheru.indexer.app;

/**
 * The {@code [Desktop Entry]} group of a freedesktop manifest, reduced to the
 * keys the launcher uses. Localized keys are already resolved.
 *
 * @param type      value of {@code Type}, {@code null} if missing
 * @param name      localized {@code Name}, {@code null} if missing
 * @param exec      raw {@code Exec} command line including field codes
 * @param icon      value of {@code Icon}: a themed icon name or an absolute path
 * @param comment   localized {@code Comment}
 * @param noDisplay {@code NoDisplay=true}
 * @param hidden    {@code Hidden=true}
 */
public record DesktopEntry(
        String type,
        String name,
        String exec,
        String icon,
        String comment,
        boolean noDisplay,
        boolean hidden) {

    /** Application type, visible in menus, with a name and a command. */
    public boolean isLaunchable() {
        return "Application".equals(type)
                && !noDisplay
                && !hidden
                && name != null && !name.isBlank()
                && exec != null && !exec.isBlank();
    }
}
