package com.geoledger.core.validation;

import com.geoledger.core.model.Severity;
import com.geoledger.core.model.ValidationFlag;

import java.util.Locale;
import java.util.Optional;

public final class LowConfidenceRule implements ValidationRule {
    public static final String CODE = "low_confidence";
    public static final double DEFAULT_THRESHOLD = 0.65;

    private final double threshold;

    public LowConfidenceRule() {
        this(DEFAULT_THRESHOLD);
    }

    public LowConfidenceRule(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public Optional<ValidationFlag> evaluate(ValidationSubject subject) {
        Double confidence = subject.confidence();
        if (confidence == null || confidence >= threshold) {
            return Optional.empty();
        }
        return Optional.of(new ValidationFlag(
                CODE,
                Severity.WARNING,
                String.format(Locale.ROOT, "Confidence %.1f%% is below threshold %.1f%%", confidence * 100, threshold * 100),
                "Review location accuracy; consider alternative techniques"
        ));
    }
}
