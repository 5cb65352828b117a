package org.carball.advisor.analyzer;

import org.carball.advisor.config.InsightThresholds;
import org.carball.advisor.knowledge.PatternConfidence;
import org.carball.advisor.model.analysis.ArchitecturalInsight;
import org.carball.advisor.model.analysis.ComplexityTier;
import org.carball.advisor.model.analysis.Effort;
import org.carball.advisor.model.analysis.Impact;
import org.carball.advisor.model.analysis.InsightType;
import org.carball.advisor.model.opportunity.OpportunityType;
import org.carball.advisor.model.opportunity.PatternOpportunity;

import java.util.List;

public class ComplexityAssessor {

    private final InsightThresholds thresholds;

    public ComplexityAssessor(InsightThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * First matching rule wins: anti-patterns, then confident findings, then
     * raw volume.
     */
    public ComplexityTier assess(List<PatternOpportunity> opportunities) {
        long antiPatterns = opportunities.stream()
                .filter(o -> o.getOpportunityType() == OpportunityType.ANTI_PATTERN_DETECTED)
                .count();
        long highConfidence = opportunities.stream()
                .filter(o -> o.getConfidence().isAtLeast(PatternConfidence.HIGH))
                .count();
        int total = opportunities.size();

        if (antiPatterns > 0) {
            return ComplexityTier.HIGH;
        } else if (highConfidence >= thresholds.getMediumHighConfidentFindings()) {
            return ComplexityTier.MEDIUM_HIGH;
        } else if (total >= thresholds.getMediumTotal()) {
            return ComplexityTier.MEDIUM;
        } else if (total >= thresholds.getLowMediumTotal()) {
            return ComplexityTier.LOW_MEDIUM;
        } else {
            return ComplexityTier.LOW;
        }
    }

    public static String describe(ComplexityTier tier) {
        return "Complexity Level: " + tier.getLabel();
    }

    public static ArchitecturalInsight toInsight(ComplexityTier tier) {
        return ArchitecturalInsight.builder()
                .insightType(InsightType.ASSESSMENT)
                .title("Codebase Complexity Assessment")
                .description(describe(tier))
                .confidence(PatternConfidence.HIGH)
                .impact(Impact.CRITICAL)
                .effort(Effort.NOT_APPLICABLE)
                .recommendation(tier.getPrimaryRecommendation())
                .build();
    }
}
