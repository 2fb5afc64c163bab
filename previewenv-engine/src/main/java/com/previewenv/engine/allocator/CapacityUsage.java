package com.previewenv.engine.allocator;

/**
 * Priority usage of one routing domain.
 */
public record CapacityUsage(
    String routingDomain,
    int used,
    int capacity
) {
    public static final int WARNING_PERCENT = 70;
    public static final int CRITICAL_PERCENT = 90;

    public int percentage() {
        return capacity == 0 ? 100 : Math.round(used * 100f / capacity);
    }

    public boolean isWarning() {
        return used * 100 >= capacity * WARNING_PERCENT;
    }

    public boolean isCritical() {
        return used * 100 >= capacity * CRITICAL_PERCENT;
    }

    public int available() {
        return Math.max(0, capacity - used);
    }
}
