package com.previewenv.core.model;

import com.previewenv.core.exception.InvalidConfigurationException;

/**
 * Closed interval of routing priorities.
 */
public record PriorityRange(int start, int end) {

    public PriorityRange {
        if (start < 1 || end < start) {
            throw new InvalidConfigurationException(
                "Invalid priority range [" + start + ", " + end + "]");
        }
    }

    public boolean contains(int priority) {
        return priority >= start && priority <= end;
    }

    public int size() {
        return end - start + 1;
    }

    public boolean overlaps(PriorityRange other) {
        return start <= other.end && other.start <= end;
    }

    /**
     * Ensure this range does not overlap any reserved range.
     *
     * @throws InvalidConfigurationException on overlap
     */
    public void requireDisjointFrom(PriorityRange... reserved) {
        for (PriorityRange range : reserved) {
            if (range != null && overlaps(range)) {
                throw new InvalidConfigurationException(
                    "Priority range " + this + " overlaps reserved range " + range);
            }
        }
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
