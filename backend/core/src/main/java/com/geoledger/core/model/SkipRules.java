package com.geoledger.core.model;

import java.util.Set;

/**
 * Per-stage conditions under which an existing current record makes the stage skip a ticket.
 * A null {@code skipIfLocked} means the default, which is to skip locked records.
 */
public record SkipRules(
        Boolean skipIfLocked,
        Set<QualityTier> skipTiers,
        Double skipConfidence,
        Set<String> skipTechniques,
        Set<String> skipApproaches
) {
    public SkipRules {
        skipIfLocked = skipIfLocked == null ? Boolean.TRUE : skipIfLocked;
        skipTiers = skipTiers == null ? Set.of() : Set.copyOf(skipTiers);
        skipTechniques = skipTechniques == null ? Set.of() : Set.copyOf(skipTechniques);
        skipApproaches = skipApproaches == null ? Set.of() : Set.copyOf(skipApproaches);
        if (skipConfidence != null && (skipConfidence.isNaN() || skipConfidence < 0.0 || skipConfidence > 1.0)) {
            throw new IllegalArgumentException("skipConfidence out of range [0, 1]: " + skipConfidence);
        }
    }

    public static SkipRules defaults() {
        return new SkipRules(true, Set.of(), null, Set.of(), Set.of());
    }

    public static SkipRules skipTiers(Set<QualityTier> tiers) {
        return new SkipRules(true, tiers, null, Set.of(), Set.of());
    }

    public SkipRules withSkipIfLocked(boolean value) {
        return new SkipRules(value, skipTiers, skipConfidence, skipTechniques, skipApproaches);
    }

    public SkipRules withSkipConfidence(Double value) {
        return new SkipRules(skipIfLocked, skipTiers, value, skipTechniques, skipApproaches);
    }

    public SkipRules withSkipTechniques(Set<String> value) {
        return new SkipRules(skipIfLocked, skipTiers, skipConfidence, value, skipApproaches);
    }

    public SkipRules withSkipApproaches(Set<String> value) {
        return new SkipRules(skipIfLocked, skipTiers, skipConfidence, skipTechniques, value);
    }
}
