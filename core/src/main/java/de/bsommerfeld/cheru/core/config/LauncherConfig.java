package de.bsommerfeld.cheru.core.config;

/**
 * Root of the launcher configuration as handed over by the configuration
 * loader. The backend only reads the values; parsing {@code config.toml} and
 * reacting to hotkey or theme changes happens outside of it.
 */
public class LauncherConfig {

    private String hotkey = "Alt+Space";

    private SearchConfig search = new SearchConfig();

    private IndexConfig index = new IndexConfig();

    public String getHotkey() {
        return hotkey;
    }

    public void setHotkey(String hotkey) {
        this.hotkey = hotkey;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public IndexConfig getIndex() {
        return index;
    }
}
