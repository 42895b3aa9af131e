package com.geoledger.core.validation;

import com.geoledger.core.model.ValidationFlag;

import java.util.Optional;

public interface ValidationRule {
    String code();

    Optional<ValidationFlag> evaluate(ValidationSubject subject);
}
