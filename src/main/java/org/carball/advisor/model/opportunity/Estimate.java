package org.carball.advisor.model.opportunity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Three-step scale used for both the effort and the impact of a finding.
 * Effort is scored inversely: cheap work ranks higher.
 */
public enum Estimate {
    LOW("Low", 1.0, 0.3),
    MEDIUM("Medium", 0.7, 0.6),
    HIGH("High", 0.4, 1.0);

    private final String displayName;
    private final double effortWeight;
    private final double impactWeight;

    Estimate(String displayName, double effortWeight, double impactWeight) {
        this.displayName = displayName;
        this.effortWeight = effortWeight;
        this.impactWeight = impactWeight;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getEffortWeight() {
        return effortWeight;
    }

    public double getImpactWeight() {
        return impactWeight;
    }
}
