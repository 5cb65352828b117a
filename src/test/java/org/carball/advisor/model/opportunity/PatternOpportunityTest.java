package org.carball.advisor.model.opportunity;

import org.carball.advisor.knowledge.PatternConfidence;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class PatternOpportunityTest {

    @Test
    public void shouldScoreDataModelSingletonAtMaximum() {
        PatternOpportunity opportunity = base()
                .confidence(PatternConfidence.CRITICAL)
                .estimatedEffort(Estimate.LOW)
                .impact(Estimate.HIGH)
                .build();

        assertThat(opportunity.getPriorityScore()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    public void shouldScoreWeakestCombinationAtMinimum() {
        PatternOpportunity opportunity = base()
                .confidence(PatternConfidence.LOW)
                .estimatedEffort(Estimate.HIGH)
                .impact(Estimate.LOW)
                .build();

        assertThat(opportunity.getPriorityScore()).isCloseTo(0.29, within(1e-9));
    }

    @Test
    public void shouldWeighConfidenceEffortAndImpact() {
        // 0.8 * 0.4 + 0.7 * 0.3 + 0.6 * 0.3
        PatternOpportunity opportunity = base()
                .confidence(PatternConfidence.HIGH)
                .estimatedEffort(Estimate.MEDIUM)
                .impact(Estimate.MEDIUM)
                .build();

        assertThat(opportunity.getPriorityScore()).isCloseTo(0.71, within(1e-9));
    }

    @Test
    public void shouldRequirePatternName() {
        assertThatThrownBy(() -> base().patternName(null).build())
                .isInstanceOf(NullPointerException.class);
    }

    private static PatternOpportunity.PatternOpportunityBuilder base() {
        return PatternOpportunity.builder()
                .patternName("singleton")
                .opportunityType(OpportunityType.REFACTOR_TO_PATTERN)
                .confidence(PatternConfidence.MEDIUM)
                .filePath("Sample.java")
                .lineNumber(1)
                .estimatedEffort(Estimate.MEDIUM)
                .impact(Estimate.MEDIUM);
    }
}
