package org.carball.advisor.model.opportunity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.carball.advisor.knowledge.PatternConfidence;

/**
 * One detected place where a pattern could be applied, or where a pattern is
 * being misapplied.
 */
@Value
@Builder(toBuilder = true)
public class PatternOpportunity {

    private static final double CONFIDENCE_WEIGHT = 0.4;
    private static final double EFFORT_WEIGHT = 0.3;
    private static final double IMPACT_WEIGHT = 0.3;

    @NonNull
    String patternName;
    @NonNull
    OpportunityType opportunityType;
    @NonNull
    PatternConfidence confidence;
    @NonNull
    String filePath;
    int lineNumber;
    Integer endLineNumber;
    String description;
    String codeSnippet;
    String suggestedImprovement;
    String reasoning;
    @NonNull
    Estimate estimatedEffort;
    @NonNull
    Estimate impact;

    @JsonProperty("priority_score")
    public double getPriorityScore() {
        return confidence.getWeight() * CONFIDENCE_WEIGHT
                + estimatedEffort.getEffortWeight() * EFFORT_WEIGHT
                + impact.getImpactWeight() * IMPACT_WEIGHT;
    }
}
