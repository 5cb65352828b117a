package org.carball.advisor.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Effort {
    LOW("Low", 1.0),
    MEDIUM("Medium", 0.7),
    HIGH("High", 0.4),
    // assessments carry no work of their own
    NOT_APPLICABLE("N/A", 0.0);

    private final String displayName;
    private final double inverseWeight;

    Effort(String displayName, double inverseWeight) {
        this.displayName = displayName;
        this.inverseWeight = inverseWeight;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getInverseWeight() {
        return inverseWeight;
    }
}
