package com.geoledger.core.model;

import java.util.Objects;

public record ValidationFlag(String code, Severity severity, String message, String suggestedAction) {
    public ValidationFlag {
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(severity, "severity is required");
    }
}
