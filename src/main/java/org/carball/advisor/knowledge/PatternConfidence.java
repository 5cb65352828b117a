package org.carball.advisor.knowledge;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordinal strength-of-belief attached to a finding. Declaration order is the
 * comparison order, so {@code LOW < MEDIUM < HIGH < CRITICAL}.
 */
public enum PatternConfidence {
    LOW("low", 0.2),
    MEDIUM("medium", 0.5),
    HIGH("high", 0.8),
    CRITICAL("critical", 1.0);

    private final String value;
    private final double weight;

    PatternConfidence(String value, double weight) {
        this.value = value;
        this.weight = weight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getWeight() {
        return weight;
    }

    public boolean isAtLeast(PatternConfidence minimum) {
        return compareTo(minimum) >= 0;
    }

    public String getDisplayName() {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
