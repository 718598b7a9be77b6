package com.flowmable.splitter;

/**
 * Quick pre-scan: how many supported files are shaped like a spread.
 */
public record SplitEstimate(int total, int candidates) {
}
