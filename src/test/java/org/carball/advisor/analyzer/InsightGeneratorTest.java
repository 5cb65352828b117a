package org.carball.advisor.analyzer;

import org.carball.advisor.config.InsightThresholds;
import org.carball.advisor.knowledge.PatternConfidence;
import org.carball.advisor.model.analysis.ArchitecturalInsight;
import org.carball.advisor.model.analysis.InsightType;
import org.carball.advisor.model.opportunity.Estimate;
import org.carball.advisor.model.opportunity.OpportunityType;
import org.carball.advisor.model.opportunity.PatternOpportunity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class InsightGeneratorTest {

    private InsightThresholds thresholds;
    private InsightGenerator generator;

    @BeforeEach
    public void setUp() {
        thresholds = InsightThresholds.createDefaults();
        generator = new InsightGenerator(thresholds);
    }

    @Test
    public void shouldReturnNothingBelowThresholds() {
        // Given
        Map<String, List<PatternOpportunity>> byPattern = new LinkedHashMap<>();
        byPattern.put("factory", List.of(opportunity("factory", "A.java"), opportunity("factory", "B.java")));
        byPattern.put("builder", List.of(opportunity("builder", "C.java")));

        // When
        List<ArchitecturalInsight> insights = generator.generate(byPattern, 3);

        // Then
        assertThat(insights).isEmpty();
    }

    @Test
    public void shouldCombineFactoryAndStrategyWithSortedFiles() {
        // Given
        Map<String, List<PatternOpportunity>> byPattern = new LinkedHashMap<>();
        byPattern.put("strategy", List.of(opportunity("strategy", "z/Router.java"),
                opportunity("strategy", "a/Pricing.java")));
        byPattern.put("factory", List.of(opportunity("factory", "m/Shapes.java"),
                opportunity("factory", "a/Pricing.java")));

        // When
        Optional<ArchitecturalInsight> insight = find(generator.generate(byPattern, 4),
                "Combine Factory and Strategy Patterns");

        // Then
        assertThat(insight).isPresent();
        assertThat(insight.get().getInsightType()).isEqualTo(InsightType.ARCHITECTURAL_PATTERN);
        assertThat(insight.get().getConfidence()).isEqualTo(PatternConfidence.LOW);
        assertThat(insight.get().getAffectedFiles())
                .containsExactly("a/Pricing.java", "m/Shapes.java", "z/Router.java");
        assertThat(insight.get().getRecommendations()).hasSize(3);
    }

    @Test
    public void shouldSuggestEventSourcingForObserversAndCommands() {
        Map<String, List<PatternOpportunity>> byPattern = new LinkedHashMap<>();
        byPattern.put("observer", List.of(opportunity("observer", "EventHub.java")));
        byPattern.put("command", List.of(opportunity("command", "BackupTask.java")));

        Optional<ArchitecturalInsight> insight = find(generator.generate(byPattern, 2),
                "Event Sourcing Architecture Opportunity");

        assertThat(insight).isPresent();
        assertThat(insight.get().getAffectedFiles()).containsExactly("BackupTask.java", "EventHub.java");
    }

    @Test
    public void shouldCentralizeDataAccessFromSingleFinding() {
        Map<String, List<PatternOpportunity>> byPattern = Map.of(
                "repository", List.of(opportunity("repository", "ReportService.java")));

        List<ArchitecturalInsight> insights = generator.generate(byPattern, 1);

        assertThat(insights).extracting(ArchitecturalInsight::getTitle)
                .containsExactly("Centralize Data Access with Repository Pattern");
    }

    @Test
    public void shouldSuggestBuildersAtTwoFindings() {
        // Given
        Map<String, List<PatternOpportunity>> byPattern = Map.of("builder", List.of(
                opportunity("builder", "Shipment.java"),
                opportunity("builder", "Shipment.java"),
                opportunity("builder", "Order.java")));

        // When
        Optional<ArchitecturalInsight> insight = find(generator.generate(byPattern, 3),
                "Simplify Object Construction with Builder Pattern");

        // Then
        assertThat(insight).isPresent();
        assertThat(insight.get().getDescription()).startsWith("Found 3 builder pattern opportunities.");
        assertThat(insight.get().getAffectedFiles()).containsExactly("Shipment.java", "Order.java");
    }

    @Test
    public void shouldSuggestEventDrivenArchitecture() {
        Map<String, List<PatternOpportunity>> byPattern = Map.of("observer", List.of(
                opportunity("observer", "EventHub.java"),
                opportunity("observer", "Inventory.java")));

        assertThat(find(generator.generate(byPattern, 2), "Implement Event-Driven Architecture")).isPresent();
    }

    @Test
    public void shouldReduceComplexityForRepeatedStrategies() {
        Map<String, List<PatternOpportunity>> byPattern = Map.of("strategy", List.of(
                opportunity("strategy", "A.java"),
                opportunity("strategy", "B.java"),
                opportunity("strategy", "C.java")));

        Optional<ArchitecturalInsight> insight = find(generator.generate(byPattern, 3),
                "Reduce Complexity with Strategy Pattern");

        assertThat(insight).map(ArchitecturalInsight::getInsightType).hasValue(InsightType.COMPLEXITY_REDUCTION);
    }

    @Test
    public void shouldFlagOveruseUsingConfiguredThreshold() {
        // Given
        thresholds.setPatternOveruse(2);
        Map<String, List<PatternOpportunity>> byPattern = new LinkedHashMap<>();
        byPattern.put("adapter", List.of(opportunity("adapter", "A.java"), opportunity("adapter", "B.java")));
        byPattern.put("command", List.of(opportunity("command", "C.java")));

        // When
        Optional<ArchitecturalInsight> insight = find(generator.generate(byPattern, 3), "Potential Pattern Overuse");

        // Then
        assertThat(insight).isPresent();
        assertThat(insight.get().getDescription()).contains("adapter (2)").doesNotContain("command");
        assertThat(insight.get().getAffectedFiles()).isEmpty();
    }

    private static Optional<ArchitecturalInsight> find(List<ArchitecturalInsight> insights, String title) {
        return insights.stream().filter(insight -> insight.getTitle().equals(title)).findFirst();
    }

    private static PatternOpportunity opportunity(String pattern, String file) {
        return PatternOpportunity.builder()
                .patternName(pattern)
                .opportunityType(OpportunityType.REFACTOR_TO_PATTERN)
                .confidence(PatternConfidence.MEDIUM)
                .filePath(file)
                .lineNumber(1)
                .description("test finding")
                .estimatedEffort(Estimate.MEDIUM)
                .impact(Estimate.MEDIUM)
                .build();
    }
}
