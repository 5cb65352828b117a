package org.carball.advisor.model.opportunity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OpportunityType {
    REFACTOR_TO_PATTERN("refactor_to_pattern"),
    ANTI_PATTERN_DETECTED("anti_pattern_detected"),
    OPTIMIZATION_OPPORTUNITY("optimization_opportunity"),
    COMPLEXITY_REDUCTION("complexity_reduction");

    private final String value;

    OpportunityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
