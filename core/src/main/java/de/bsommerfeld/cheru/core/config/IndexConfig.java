package de.bsommerfeld.cheru.core.config;

/**
 * Bounds for the index builders. Depth and caps limit the worst case of a
 * directory walk over a large home directory.
 */
public class IndexConfig {

    private int folderMaxDepth = 3;

    private int folderCap = 500;

    private int imageMaxDepth = 3;

    private int imageCap = 2000;

    /** Build the folder index at startup instead of on the first folder query. */
    private boolean eagerFolderIndex = false;

    /** Edge length in pixels of rasterized application icons. */
    private int iconSize = 64;

    private int contentSearchMaxDepth = 4;

    /** ripgrep {@code --max-filesize} argument. */
    private String contentSearchMaxFileSize = "1M";

    public int getFolderMaxDepth() {
        return folderMaxDepth;
    }

    public void setFolderMaxDepth(int folderMaxDepth) {
        this.folderMaxDepth = folderMaxDepth;
    }

    public int getFolderCap() {
        return folderCap;
    }

    public void setFolderCap(int folderCap) {
        this.folderCap = folderCap;
    }

    public int getImageMaxDepth() {
        return imageMaxDepth;
    }

    public void setImageMaxDepth(int imageMaxDepth) {
        this.imageMaxDepth = imageMaxDepth;
    }

    public int getImageCap() {
        return imageCap;
    }

    public void setImageCap(int imageCap) {
        this.imageCap = imageCap;
    }

    public boolean isEagerFolderIndex() {
        return eagerFolderIndex;
    }

    public void setEagerFolderIndex(boolean eagerFolderIndex) {
        this.eagerFolderIndex = eagerFolderIndex;
    }

    public int getIconSize() {
        return iconSize;
    }

    public void setIconSize(int iconSize) {
        this.iconSize = iconSize;
    }

    public int getContentSearchMaxDepth() {
        return contentSearchMaxDepth;
    }

    public void setContentSearchMaxDepth(int contentSearchMaxDepth) {
        this.contentSearchMaxDepth = contentSearchMaxDepth;
    }

    public String getContentSearchMaxFileSize() {
        return contentSearchMaxFileSize;
    }

    public void setContentSearchMaxFileSize(String contentSearchMaxFileSize) {
        this.contentSearchMaxFileSize = contentSearchMaxFileSize;
    }
}
