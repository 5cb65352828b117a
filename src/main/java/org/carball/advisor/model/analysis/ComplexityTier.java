package org.carball.advisor.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ComplexityTier {
    HIGH("High (anti-patterns detected)",
            "Focus on eliminating anti-patterns first"),
    MEDIUM_HIGH("Medium-High (multiple clear improvement opportunities)",
            "Implement high-confidence patterns for immediate benefits"),
    MEDIUM("Medium (multiple opportunities available)",
            "Prioritize patterns by business value and technical debt reduction"),
    LOW_MEDIUM("Low-Medium (some improvement opportunities)",
            "Selective pattern implementation based on team capacity"),
    LOW("Low (well-structured)",
            "Maintain current good practices");

    private final String label;
    private final String primaryRecommendation;

    ComplexityTier(String label, String primaryRecommendation) {
        this.label = label;
        this.primaryRecommendation = primaryRecommendation;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getLabel() {
        return label;
    }

    public String getPrimaryRecommendation() {
        return primaryRecommendation;
    }
}
