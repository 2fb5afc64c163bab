package com.previewenv.sweeper;

import java.util.List;

/**
 * Outcome of one sweep pass.
 *
 * @param expired    ACTIVE environments past expiresAt
 * @param overdue    CREATING/UPDATING environments past expiresAt plus the grace period
 * @param dispatched DESTROY actions that completed
 * @param failed     environments whose DESTROY raised
 */
public record SweepReport(
    int expired,
    int overdue,
    int dispatched,
    List<String> failed
) {
    public SweepReport {
        failed = List.copyOf(failed);
    }

    public static SweepReport empty() {
        return new SweepReport(0, 0, 0, List.of());
    }
}
