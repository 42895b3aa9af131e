package com.geoledger.core.validation;

import com.geoledger.core.model.Approaches;
import com.geoledger.core.model.Severity;
import com.geoledger.core.model.ValidationFlag;

import java.util.Optional;

public final class PartialDataRule implements ValidationRule {
    public static final String CODE = "one_road_missing";

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public Optional<ValidationFlag> evaluate(ValidationSubject subject) {
        if (!Approaches.isPartialData(subject.approach())) {
            return Optional.empty();
        }
        return Optional.of(new ValidationFlag(
                CODE,
                Severity.WARNING,
                "One road not found; city plus the available road used",
                "Find the missing road for a more precise location"
        ));
    }
}
