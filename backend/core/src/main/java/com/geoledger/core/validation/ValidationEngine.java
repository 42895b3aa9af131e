package com.geoledger.core.validation;

import com.geoledger.core.geo.CentroidRegistry;
import com.geoledger.core.model.ValidationFlag;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs an ordered list of rules. Flags come back in rule order.
 */
public final class ValidationEngine {
    private final List<ValidationRule> rules;

    public ValidationEngine(List<ValidationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static ValidationEngine defaults(CentroidRegistry centroids) {
        return new ValidationEngine(List.of(
                new LowConfidenceRule(),
                new ElevatedPriorityConfidenceRule(),
                new CentroidDistanceRule(centroids),
                new FallbackApproachRule(),
                new PartialDataRule()
        ));
    }

    public ValidationEngine withRule(ValidationRule rule) {
        List<ValidationRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new ValidationEngine(extended);
    }

    public List<ValidationFlag> validate(ValidationSubject subject) {
        List<ValidationFlag> flags = new ArrayList<>();
        for (ValidationRule rule : rules) {
            Optional<ValidationFlag> flag = rule.evaluate(subject);
            flag.ifPresent(flags::add);
        }
        return flags;
    }

    public List<String> codes(ValidationSubject subject) {
        return validate(subject).stream().map(ValidationFlag::code).toList();
    }

    public List<ValidationRule> rules() {
        return rules;
    }
}
