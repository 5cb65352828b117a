package org.carball.advisor.knowledge;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PatternCategory {
    CREATIONAL("creational"),
    STRUCTURAL("structural"),
    BEHAVIORAL("behavioral");

    private final String value;

    PatternCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
