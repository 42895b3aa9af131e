package com.geoledger.core.validation;

import com.geoledger.core.model.Severity;
import com.geoledger.core.model.ValidationFlag;

import java.util.Locale;
import java.util.Optional;

/**
 * Elevated-priority (emergency) tickets need a higher confidence than routine ones.
 */
public final class ElevatedPriorityConfidenceRule implements ValidationRule {
    public static final String CODE = "emergency_low_confidence";
    public static final double DEFAULT_THRESHOLD = 0.75;

    private final double threshold;

    public ElevatedPriorityConfidenceRule() {
        this(DEFAULT_THRESHOLD);
    }

    public ElevatedPriorityConfidenceRule(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public Optional<ValidationFlag> evaluate(ValidationSubject subject) {
        Double confidence = subject.confidence();
        if (!subject.ticketClass().isElevatedPriority() || confidence == null || confidence >= threshold) {
            return Optional.empty();
        }
        return Optional.of(new ValidationFlag(
                CODE,
                Severity.ERROR,
                String.format(Locale.ROOT, "Emergency ticket has %.1f%% confidence (below %.1f%%)", confidence * 100, threshold * 100),
                "High priority review; emergency response location must be accurate"
        ));
    }
}
