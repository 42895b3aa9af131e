package com.geoledger.core.validation;

import com.geoledger.core.geo.CentroidRegistry;
import com.geoledger.core.model.Approaches;
import com.geoledger.core.model.Coordinates;
import com.geoledger.core.model.LocationFields;
import com.geoledger.core.model.Severity;
import com.geoledger.core.model.TicketClass;
import com.geoledger.core.model.ValidationFlag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationEngineTest {
    private static final LocationFields KERMIT = new LocationFields("MAIN ST", "FM 1788", "KERMIT", "WINKLER");
    private static final Coordinates NEAR_KERMIT = Coordinates.of(31.86, -103.09);

    private final ValidationEngine engine = ValidationEngine.defaults(CentroidRegistry.defaults());

    @Test
    void cleanResultHasNoFlags() {
        assertEquals(List.of(), engine.codes(subject(NEAR_KERMIT, 0.9, "intersection", TicketClass.unclassified())));
    }

    @Test
    void lowConfidenceIsWarning() {
        List<ValidationFlag> flags = engine.validate(subject(NEAR_KERMIT, 0.55, "intersection", TicketClass.unclassified()));

        assertEquals(1, flags.size());
        assertEquals("low_confidence", flags.get(0).code());
        assertEquals(Severity.WARNING, flags.get(0).severity());
    }

    @Test
    void emergencyBelowFloorAddsErrorAfterLowConfidence() {
        List<String> codes = engine.codes(subject(NEAR_KERMIT, 0.60, "intersection", TicketClass.ofType("emergency")));

        assertEquals(List.of("low_confidence", "emergency_low_confidence"), codes);
        assertEquals(List.of("emergency_low_confidence"),
                engine.codes(subject(NEAR_KERMIT, 0.70, "intersection", TicketClass.ofType("Emergency"))));
    }

    @Test
    void distantResultIsFlaggedOnlyForRegisteredCities() {
        Coordinates andrews = Coordinates.of(32.3185, -102.5457);

        assertEquals(List.of("distance_from_city"), engine.codes(subject(andrews, 0.9, "intersection", TicketClass.unclassified())));

        ValidationSubject unregistered = new ValidationSubject(
                andrews, 0.9, "PROXIMITY", "intersection",
                new LocationFields("MAIN ST", null, "ODESSA", "ECTOR"), TicketClass.unclassified()
        );
        assertEquals(List.of(), engine.codes(unregistered));
    }

    @Test
    void approachRulesFlagFallbackAndPartialData() {
        assertEquals(List.of("low_confidence", "fallback_used"),
                engine.codes(subject(NEAR_KERMIT, 0.35, Approaches.CITY_CENTROID_FALLBACK, TicketClass.unclassified())));
        assertEquals(List.of("one_road_missing"),
                engine.codes(subject(NEAR_KERMIT, 0.8, Approaches.CITY_PRIMARY, TicketClass.unclassified())));
    }

    @Test
    void additionalRulesRunAfterBuiltIns() {
        ValidationRule noTechnique = new ValidationRule() {
            @Override
            public String code() {
                return "missing_technique";
            }

            @Override
            public Optional<ValidationFlag> evaluate(ValidationSubject subject) {
                return subject.technique() == null
                        ? Optional.of(new ValidationFlag(code(), Severity.INFO, "no technique", null))
                        : Optional.empty();
            }
        };
        ValidationEngine extended = engine.withRule(noTechnique);
        ValidationSubject subject = new ValidationSubject(NEAR_KERMIT, 0.5, null, null, KERMIT, null);

        assertEquals(List.of("low_confidence", "missing_technique"), extended.codes(subject));
        assertEquals(5, engine.rules().size());
        assertTrue(extended.rules().contains(noTechnique));
    }

    private static ValidationSubject subject(Coordinates coordinates, Double confidence, String approach, TicketClass ticketClass) {
        return new ValidationSubject(coordinates, confidence, "PROXIMITY", approach, KERMIT, ticketClass);
    }
}
