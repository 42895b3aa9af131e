package com.geoledger.core.model;

/**
 * Trustworthiness of a stored result. The rank defines the total order used for
 * threshold comparisons: EXCELLENT is the highest, FAILED the lowest.
 */
public enum QualityTier {
    FAILED(0, "Geocoding failed, manual intervention required"),
    REVIEW_NEEDED(1, "Low confidence, human review recommended"),
    ACCEPTABLE(2, "Usable, reprocess with any improvement"),
    GOOD(3, "Reliable, reprocess only with major improvements"),
    EXCELLENT(4, "High confidence, no review needed");

    private final int rank;
    private final String description;

    QualityTier(int rank, String description) {
        this.rank = rank;
        this.description = description;
    }

    public int rank() {
        return rank;
    }

    public String description() {
        return description;
    }

    public boolean isAtLeast(QualityTier other) {
        return rank >= other.rank;
    }

    public boolean isAtMost(QualityTier other) {
        return rank <= other.rank;
    }

    public boolean isBetterThan(QualityTier other) {
        return rank > other.rank;
    }
}
