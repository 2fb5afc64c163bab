package com.previewenv.sweeper;

/**
 * Outcome of one retention purge.
 */
public record PurgeReport(int environments, int allocations) {
}
