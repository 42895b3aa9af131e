package com.geoledger.core.decision;

public enum SkipReason {
    NO_CURRENT_RECORD,
    LOCKED,
    QUALITY_TIER,
    CONFIDENCE,
    TECHNIQUE,
    APPROACH,
    QUALITY_THRESHOLD,
    REPROCESS_THRESHOLD,
    SAME_STAGE,
    NO_RULE_MATCHED,
    LOCKED_AT_WRITE
}
