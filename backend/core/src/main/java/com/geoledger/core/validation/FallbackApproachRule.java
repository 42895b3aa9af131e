package com.geoledger.core.validation;

import com.geoledger.core.model.Approaches;
import com.geoledger.core.model.Severity;
import com.geoledger.core.model.ValidationFlag;

import java.util.Optional;

public final class FallbackApproachRule implements ValidationRule {
    public static final String CODE = "fallback_used";

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public Optional<ValidationFlag> evaluate(ValidationSubject subject) {
        if (!Approaches.isFallback(subject.approach())) {
            return Optional.empty();
        }
        return Optional.of(new ValidationFlag(
                CODE,
                Severity.ERROR,
                "Neither location input resolved; city centroid approximation used",
                "Locate actual work area; the city centroid is very approximate"
        ));
    }
}
