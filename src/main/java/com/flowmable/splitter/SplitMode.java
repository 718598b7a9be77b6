package com.flowmable.splitter;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome classification for a single spread.
 */
public enum SplitMode {
    /** Not a spread (aspect ratio) or nothing printed on it. No pages. */
    SKIP("skip"),
    /** Single narrow cover artwork on a wide canvas. One trimmed page. */
    COVER_TRIM("cover-trim"),
    /** Gutter located with enough confidence. Two pages, right first. */
    SPLIT("split"),
    /** Gutter ambiguous; split at the horizontal center. Two pages, right first. */
    FALLBACK_CENTER("fallback-center");

    private final String wireName;

    SplitMode(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in reports and metadata. */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean producesTwoPages() {
        return this == SPLIT || this == FALLBACK_CENTER;
    }
}
