package dev.enhancequeue.api;

/**
 * Enhancement variant applied to a work item. Each mode carries the fixed tag appended to
 * output file names.
 */
public enum EnhancementMode {
    GENERAL("_general"),
    NATURAL_STRONG("_natural"),
    DETAIL("_detail"),
    ANIME("_anime");

    private final String filenameSuffix;

    EnhancementMode(String filenameSuffix) {
        this.filenameSuffix = filenameSuffix;
    }

    public String filenameSuffix() {
        return filenameSuffix;
    }
}
