package com.geoledger.core.model;

import java.util.Comparator;

/**
 * How urgently a human should inspect a stored result. CRITICAL is the most urgent.
 */
public enum ReviewPriority {
    NONE(0),
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    /** Orders most urgent first, the order of a review queue. */
    public static final Comparator<ReviewPriority> MOST_URGENT_FIRST =
            Comparator.comparingInt(ReviewPriority::urgency).reversed();

    private final int urgency;

    ReviewPriority(int urgency) {
        this.urgency = urgency;
    }

    public int urgency() {
        return urgency;
    }

    public boolean isAtLeast(ReviewPriority other) {
        return urgency >= other.urgency;
    }
}
