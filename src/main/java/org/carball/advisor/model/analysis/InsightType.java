package org.carball.advisor.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InsightType {
    ARCHITECTURAL_PATTERN("architectural_pattern"),
    ANTI_PATTERN("anti_pattern"),
    OPTIMIZATION("optimization"),
    COMPLEXITY_REDUCTION("complexity_reduction"),
    ASSESSMENT("assessment");

    private final String value;

    InsightType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
