package org.carball.advisor.knowledge;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * When a pattern is worth applying: indicator phrases, numeric thresholds and
 * the advisory text shown alongside a recommendation.
 */
@Value
@Builder
public class PatternCriteria {
    ComplexityLevel minimumComplexity;
    @Singular
    List<String> indicators;
    @Singular
    Map<String, Integer> thresholds;
    @Singular
    List<String> useCases;
    @Singular
    List<String> benefits;

    public OptionalInt threshold(String name) {
        Integer value = thresholds.get(name);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }
}
