package org.carball.advisor.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Impact {
    LOW("Low", 0.3),
    MEDIUM("Medium", 0.6),
    HIGH("High", 0.8),
    CRITICAL("Critical", 1.0);

    private final String displayName;
    private final double weight;

    Impact(String displayName, double weight) {
        this.displayName = displayName;
        this.weight = weight;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getWeight() {
        return weight;
    }
}
