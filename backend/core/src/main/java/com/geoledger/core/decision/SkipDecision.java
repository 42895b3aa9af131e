package com.geoledger.core.decision;

import java.util.Objects;

public record SkipDecision(boolean skip, SkipReason reason, String detail) {
    public SkipDecision {
        Objects.requireNonNull(reason, "reason is required");
        detail = detail == null ? "" : detail;
    }

    public static SkipDecision skip(SkipReason reason, String detail) {
        return new SkipDecision(true, reason, detail);
    }

    public static SkipDecision run(SkipReason reason, String detail) {
        return new SkipDecision(false, reason, detail);
    }
}
