package com.geoledger.core.quality;

import com.geoledger.core.model.Approaches;
import com.geoledger.core.model.QualityTier;
import com.geoledger.core.model.ReprocessThreshold;
import com.geoledger.core.model.ReviewPriority;
import com.geoledger.core.model.TicketClass;

import java.util.List;
import java.util.function.Predicate;

/**
 * Turns a raw attempt into a quality tier and a review priority, and answers whether a stage
 * with a given threshold should reprocess a record of a given tier. Stateless.
 */
public final class QualityAssessor {
    public static final double EXCELLENT_FLOOR = 0.90;
    public static final double GOOD_FLOOR = 0.80;
    public static final double ACCEPTABLE_FLOOR = 0.65;
    public static final double REVIEW_NEEDED_FLOOR = 0.40;

    static final double FALLBACK_FACTOR = 0.90;
    static final double PENALTY_PER_FLAG = 0.03;
    static final double MAX_FLAG_PENALTY = 0.15;
    static final double ELEVATED_CONFIDENCE_FLOOR = 0.75;
    static final double LOW_CONFIDENCE_FLOOR = 0.50;

    private static final List<PriorityRule> PRIORITY_RULES = List.of(
            new PriorityRule("fallback approach", input -> Approaches.isFallback(input.approach()), ReviewPriority.HIGH),
            new PriorityRule("failed", input -> input.tier() == QualityTier.FAILED, ReviewPriority.CRITICAL),
            new PriorityRule(
                    "elevated ticket below floor",
                    input -> input.ticketClass().isElevatedPriority() && input.confidenceOrZero() < ELEVATED_CONFIDENCE_FLOOR,
                    ReviewPriority.HIGH
            ),
            new PriorityRule("low confidence", input -> input.confidenceOrZero() < LOW_CONFIDENCE_FLOOR, ReviewPriority.HIGH),
            new PriorityRule("review needed", input -> input.tier() == QualityTier.REVIEW_NEEDED, ReviewPriority.MEDIUM),
            new PriorityRule("multiple flags", input -> input.flagCount() >= 2, ReviewPriority.MEDIUM),
            new PriorityRule(
                    "acceptable with flag",
                    input -> input.tier() == QualityTier.ACCEPTABLE && input.flagCount() >= 1,
                    ReviewPriority.LOW
            )
    );

    /**
     * Confidence after the fallback and flag penalties, or null when there is nothing to adjust.
     */
    public Double adjustedConfidence(Double confidence, String approach, int flagCount) {
        if (confidence == null || confidence <= 0.0) {
            return null;
        }
        double adjusted = confidence;
        if (Approaches.isFallback(approach)) {
            adjusted *= FALLBACK_FACTOR;
        }
        adjusted *= 1.0 - Math.min(PENALTY_PER_FLAG * flagCount, MAX_FLAG_PENALTY);
        return adjusted;
    }

    public QualityTier tier(Double confidence, String approach, int flagCount) {
        Double adjusted = adjustedConfidence(confidence, approach, flagCount);
        if (adjusted == null) {
            return QualityTier.FAILED;
        }
        if (adjusted >= EXCELLENT_FLOOR) {
            return QualityTier.EXCELLENT;
        }
        if (adjusted >= GOOD_FLOOR) {
            return QualityTier.GOOD;
        }
        if (adjusted >= ACCEPTABLE_FLOOR) {
            return QualityTier.ACCEPTABLE;
        }
        if (adjusted >= REVIEW_NEEDED_FLOOR) {
            return QualityTier.REVIEW_NEEDED;
        }
        return QualityTier.FAILED;
    }

    public ReviewPriority priority(QualityTier tier, Double confidence, String approach, TicketClass ticketClass, int flagCount) {
        PriorityInput input = new PriorityInput(
                tier,
                confidence,
                approach,
                ticketClass == null ? TicketClass.unclassified() : ticketClass,
                flagCount
        );
        for (PriorityRule rule : PRIORITY_RULES) {
            if (rule.matches().test(input)) {
                return rule.priority();
            }
        }
        return ReviewPriority.NONE;
    }

    /**
     * Locked records are never reprocessed. Without a threshold the answer is no; callers that
     * need "no threshold means run" decide that themselves.
     */
    public boolean shouldReprocess(QualityTier tier, ReprocessThreshold threshold, boolean locked) {
        if (locked || threshold == null) {
            return false;
        }
        return switch (threshold) {
            case ALWAYS -> true;
            case MINOR_ENHANCEMENT -> tier.isAtMost(QualityTier.ACCEPTABLE);
            case MAJOR_ENHANCEMENT -> tier.isAtMost(QualityTier.GOOD);
        };
    }

    public String describe(QualityTier tier) {
        return tier.description();
    }

    record PriorityInput(QualityTier tier, Double confidence, String approach, TicketClass ticketClass, int flagCount) {
        double confidenceOrZero() {
            return confidence == null ? 0.0 : confidence;
        }
    }

    record PriorityRule(String name, Predicate<PriorityInput> matches, ReviewPriority priority) {
    }
}
