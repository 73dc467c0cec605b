package de.bsommerfeld.cheru.core.config;

/**
 * Result caps and query thresholds for the query surface. Caps keep the
 * result lists short enough to render on every keystroke.
 */
public class SearchConfig {

    private int maxApplicationResults = 50;

    private int maxFolderResults = 10;

    private int maxImageResults = 20;

    private int maxContentResults = 20;

    private int maxSystemActionResults = 5;

    /** Folder, image and content searches ignore queries shorter than this. */
    private int minQueryLength = 2;

    public int getMaxApplicationResults() {
        return maxApplicationResults;
    }

    public void setMaxApplicationResults(int maxApplicationResults) {
        this.maxApplicationResults = maxApplicationResults;
    }

    public int getMaxFolderResults() {
        return maxFolderResults;
    }

    public void setMaxFolderResults(int maxFolderResults) {
        this.maxFolderResults = maxFolderResults;
    }

    public int getMaxImageResults() {
        return maxImageResults;
    }

    public void setMaxImageResults(int maxImageResults) {
        this.maxImageResults = maxImageResults;
    }

    public int getMaxContentResults() {
        return maxContentResults;
    }

    public void setMaxContentResults(int maxContentResults) {
        this.maxContentResults = maxContentResults;
    }

    public int getMaxSystemActionResults() {
        return maxSystemActionResults;
    }

    public void setMaxSystemActionResults(int maxSystemActionResults) {
        this.maxSystemActionResults = maxSystemActionResults;
    }

    public int getMinQueryLength() {
        return minQueryLength;
    }

    public void setMinQueryLength(int minQueryLength) {
        this.minQueryLength = minQueryLength;
    }
}
