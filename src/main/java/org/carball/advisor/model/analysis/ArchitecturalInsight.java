package org.carball.advisor.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.advisor.knowledge.PatternConfidence;

import java.util.List;

/**
 * A codebase-level observation derived from the findings of many files.
 */
@Value
@Builder
public class ArchitecturalInsight {

    private static final double CONFIDENCE_WEIGHT = 0.4;
    private static final double EFFORT_WEIGHT = 0.2;
    private static final double IMPACT_WEIGHT = 0.4;

    InsightType insightType;
    String title;
    String description;
    @Singular
    List<String> affectedFiles;
    PatternConfidence confidence;
    Impact impact;
    Effort effort;
    @Singular
    List<String> recommendations;

    @JsonProperty("priority_score")
    public double getPriorityScore() {
        return confidence.getWeight() * CONFIDENCE_WEIGHT
                + effort.getInverseWeight() * EFFORT_WEIGHT
                + impact.getWeight() * IMPACT_WEIGHT;
    }
}
