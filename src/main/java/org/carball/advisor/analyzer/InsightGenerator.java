package org.carball.advisor.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.advisor.config.InsightThresholds;
import org.carball.advisor.knowledge.BuiltinPatterns;
import org.carball.advisor.knowledge.PatternConfidence;
import org.carball.advisor.model.analysis.ArchitecturalInsight;
import org.carball.advisor.model.analysis.Effort;
import org.carball.advisor.model.analysis.Impact;
import org.carball.advisor.model.analysis.InsightType;
import org.carball.advisor.model.opportunity.OpportunityType;
import org.carball.advisor.model.opportunity.PatternOpportunity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Turns repository-wide groups of findings into architectural insights.
 * The complexity assessment is added separately by {@link ComplexityAssessor}.
 */
@Slf4j
public class InsightGenerator {

    private static final List<String> DATABASE_PATH_KEYWORDS = List.of("database", "connection", "db");

    private final InsightThresholds thresholds;

    public InsightGenerator(InsightThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * @param byPattern findings grouped by pattern name, groups and their
     *                  contents in first-seen order
     */
    public List<ArchitecturalInsight> generate(Map<String, List<PatternOpportunity>> byPattern, int totalOpportunities) {
        List<ArchitecturalInsight> insights = new ArrayList<>();

        analyzeSingletons(byPattern.getOrDefault(BuiltinPatterns.SINGLETON, List.of()), insights);
        analyzeFactories(byPattern.getOrDefault(BuiltinPatterns.FACTORY, List.of()), insights);
        analyzeObservers(byPattern.getOrDefault(BuiltinPatterns.OBSERVER, List.of()), insights);
        analyzeStrategies(byPattern.getOrDefault(BuiltinPatterns.STRATEGY, List.of()), insights);
        analyzeBuilders(byPattern.getOrDefault(BuiltinPatterns.BUILDER, List.of()), insights);
        analyzeRepositories(byPattern.getOrDefault(BuiltinPatterns.REPOSITORY, List.of()), insights);
        analyzeCrossPatterns(byPattern, insights);
        detectArchitecturalAntiPatterns(byPattern, totalOpportunities, insights);

        log.debug("Generated {} architectural insights", insights.size());
        return insights;
    }

    private void analyzeSingletons(List<PatternOpportunity> singletons, List<ArchitecturalInsight> insights) {
        List<PatternOpportunity> antiPatterns = singletons.stream()
                .filter(o -> o.getOpportunityType() == OpportunityType.ANTI_PATTERN_DETECTED)
                .collect(Collectors.toList());
        List<PatternOpportunity> valid = singletons.stream()
                .filter(o -> o.getOpportunityType() != OpportunityType.ANTI_PATTERN_DETECTED)
                .collect(Collectors.toList());

        if (antiPatterns.size() >= thresholds.getSingletonOveruseAntiPatterns()) {
            insights.add(ArchitecturalInsight.builder()
                    .insightType(InsightType.ANTI_PATTERN)
                    .title("Singleton Pattern Overuse Detected")
                    .description(String.format("Found %d inappropriate singleton implementations. "
                            + "Singletons should not be used for data models or entity classes.", antiPatterns.size()))
                    .affectedFiles(distinctFiles(antiPatterns))
                    .confidence(PatternConfidence.HIGH)
                    .impact(Impact.HIGH)
                    .effort(Effort.MEDIUM)
                    .recommendation("Convert data model singletons to regular classes")
                    .recommendation("Use dependency injection for better testability")
                    .recommendation("Consider Repository pattern for data access centralization")
                    .recommendation("Review singleton usage - ensure they're truly needed")
                    .build());
        }

        if (valid.size() >= thresholds.getSharedResourceSingletons()) {
            Set<String> sharedResourceFiles = new LinkedHashSet<>();
            valid.stream()
                    .map(PatternOpportunity::getFilePath)
                    .filter(path -> path.toLowerCase(Locale.ROOT).contains("config"))
                    .forEach(sharedResourceFiles::add);
            valid.stream()
                    .map(PatternOpportunity::getFilePath)
                    .filter(path -> DATABASE_PATH_KEYWORDS.stream().anyMatch(path.toLowerCase(Locale.ROOT)::contains))
                    .forEach(sharedResourceFiles::add);

            if (!sharedResourceFiles.isEmpty()) {
                insights.add(ArchitecturalInsight.builder()
                        .insightType(InsightType.OPTIMIZATION)
                        .title("Centralize Shared Resources with Singleton")
                        .description("Multiple configuration or database connection classes could benefit "
                                + "from singleton pattern.")
                        .affectedFiles(sharedResourceFiles)
                        .confidence(PatternConfidence.MEDIUM)
                        .impact(Impact.MEDIUM)
                        .effort(Effort.LOW)
                        .recommendation("Implement singleton for configuration management")
                        .recommendation("Centralize database connections with singleton pattern")
                        .recommendation("Ensure thread-safety for multi-threaded applications")
                        .recommendation("Consider lazy initialization for performance")
                        .build());
            }
        }
    }

    private void analyzeFactories(List<PatternOpportunity> factories, List<ArchitecturalInsight> insights) {
        if (factories.size() < thresholds.getFactoryStandardization()) {
            return;
        }
        insights.add(ArchitecturalInsight.builder()
                .insightType(InsightType.ARCHITECTURAL_PATTERN)
                .title("Standardize Object Creation with Factory Pattern")
                .description(String.format("Found %d factory pattern opportunities. "
                        + "Consider implementing a consistent object creation strategy.", factories.size()))
                .affectedFiles(distinctFiles(factories))
                .confidence(PatternConfidence.MEDIUM)
                .impact(Impact.MEDIUM)
                .effort(Effort.MEDIUM)
                .recommendation("Implement factory methods for complex object creation")
                .recommendation("Consider Abstract Factory for families of related objects")
                .recommendation("Centralize creation logic to improve maintainability")
                .recommendation("Use factories to support polymorphism and extensibility")
                .build());
    }

    private void analyzeObservers(List<PatternOpportunity> observers, List<ArchitecturalInsight> insights) {
        if (observers.size() < thresholds.getEventDrivenObservers()) {
            return;
        }
        insights.add(ArchitecturalInsight.builder()
                .insightType(InsightType.ARCHITECTURAL_PATTERN)
                .title("Implement Event-Driven Architecture")
                .description(String.format("Found %d observer pattern opportunities. "
                        + "Consider implementing a centralized event system.", observers.size()))
                .affectedFiles(distinctFiles(observers))
                .confidence(PatternConfidence.MEDIUM)
                .impact(Impact.HIGH)
                .effort(Effort.MEDIUM)
                .recommendation("Implement centralized event bus or observer registry")
                .recommendation("Define clear event contracts and interfaces")
                .recommendation("Consider async event handling for performance")
                .recommendation("Implement proper error handling in event notifications")
                .build());
    }

    private void analyzeStrategies(List<PatternOpportunity> strategies, List<ArchitecturalInsight> insights) {
        if (strategies.size() < thresholds.getStrategyComplexity()) {
            return;
        }
        insights.add(ArchitecturalInsight.builder()
                .insightType(InsightType.COMPLEXITY_REDUCTION)
                .title("Reduce Complexity with Strategy Pattern")
                .description(String.format("Found %d strategy pattern opportunities. "
                        + "Multiple conditional chains suggest high algorithmic complexity.", strategies.size()))
                .affectedFiles(distinctFiles(strategies))
                .confidence(PatternConfidence.HIGH)
                .impact(Impact.MEDIUM)
                .effort(Effort.MEDIUM)
                .recommendation("Replace complex conditional logic with strategy patterns")
                .recommendation("Create strategy interfaces for algorithm families")
                .recommendation("Implement strategy selection mechanisms")
                .recommendation("Consider configuration-driven strategy selection")
                .build());
    }

    private void analyzeBuilders(List<PatternOpportunity> builders, List<ArchitecturalInsight> insights) {
        if (builders.size() < thresholds.getBuilderConstruction()) {
            return;
        }
        insights.add(ArchitecturalInsight.builder()
                .insightType(InsightType.OPTIMIZATION)
                .title("Simplify Object Construction with Builder Pattern")
                .description(String.format("Found %d builder pattern opportunities. "
                        + "Complex constructors suggest need for builder pattern.", builders.size()))
                .affectedFiles(distinctFiles(builders))
                .confidence(PatternConfidence.MEDIUM)
                .impact(Impact.MEDIUM)
                .effort(Effort.LOW)
                .recommendation("Implement builder pattern for complex object construction")
                .recommendation("Use fluent interfaces for better readability")
                .recommendation("Add validation at each construction step")
                .recommendation("Consider immutable objects with builders")
                .build());
    }

    private void analyzeRepositories(List<PatternOpportunity> repositories, List<ArchitecturalInsight> insights) {
        if (repositories.size() < thresholds.getRepositoryCentralization()) {
            return;
        }
        insights.add(ArchitecturalInsight.builder()
                .insightType(InsightType.ARCHITECTURAL_PATTERN)
                .title("Centralize Data Access with Repository Pattern")
                .description("Data access logic could benefit from repository pattern implementation.")
                .affectedFiles(distinctFiles(repositories))
                .confidence(PatternConfidence.MEDIUM)
                .impact(Impact.HIGH)
                .effort(Effort.HIGH)
                .recommendation("Implement repository interfaces for data access")
                .recommendation("Separate domain logic from data access logic")
                .recommendation("Consider Unit of Work pattern for transaction management")
                .recommendation("Implement repository abstractions for testing")
                .build());
    }

    private void analyzeCrossPatterns(Map<String, List<PatternOpportunity>> byPattern,
                                      List<ArchitecturalInsight> insights) {
        List<PatternOpportunity> factories = byPattern.getOrDefault(BuiltinPatterns.FACTORY, List.of());
        List<PatternOpportunity> strategies = byPattern.getOrDefault(BuiltinPatterns.STRATEGY, List.of());
        if (!factories.isEmpty() && !strategies.isEmpty()) {
            insights.add(ArchitecturalInsight.builder()
                    .insightType(InsightType.ARCHITECTURAL_PATTERN)
                    .title("Combine Factory and Strategy Patterns")
                    .description("Factory and Strategy opportunities detected. "
                            + "Consider creating strategies through factories.")
                    .affectedFiles(sortedUnion(factories, strategies))
                    .confidence(PatternConfidence.LOW)
                    .impact(Impact.MEDIUM)
                    .effort(Effort.MEDIUM)
                    .recommendation("Use Factory pattern to create Strategy instances")
                    .recommendation("Implement strategy registry for dynamic selection")
                    .recommendation("Consider configuration-driven strategy creation")
                    .build());
        }

        List<PatternOpportunity> observers = byPattern.getOrDefault(BuiltinPatterns.OBSERVER, List.of());
        List<PatternOpportunity> commands = byPattern.getOrDefault(BuiltinPatterns.COMMAND, List.of());
        if (!observers.isEmpty() && !commands.isEmpty()) {
            insights.add(ArchitecturalInsight.builder()
                    .insightType(InsightType.ARCHITECTURAL_PATTERN)
                    .title("Event Sourcing Architecture Opportunity")
                    .description("Observer and Command patterns together suggest event sourcing possibilities.")
                    .affectedFiles(sortedUnion(observers, commands))
                    .confidence(PatternConfidence.LOW)
                    .impact(Impact.HIGH)
                    .effort(Effort.HIGH)
                    .recommendation("Consider implementing event sourcing architecture")
                    .recommendation("Use Command pattern for event creation")
                    .recommendation("Use Observer pattern for event handling")
                    .recommendation("Implement event store for audit and replay capabilities")
                    .build());
        }
    }

    private void detectArchitecturalAntiPatterns(Map<String, List<PatternOpportunity>> byPattern,
                                                 int totalOpportunities,
                                                 List<ArchitecturalInsight> insights) {
        Map<String, Integer> heavilyUsed = new LinkedHashMap<>();
        byPattern.forEach((pattern, opportunities) -> {
            if (opportunities.size() >= thresholds.getPatternOveruse()) {
                heavilyUsed.put(pattern, opportunities.size());
            }
        });

        if (!heavilyUsed.isEmpty()) {
            String patternsList = heavilyUsed.entrySet().stream()
                    .map(e -> e.getKey() + " (" + e.getValue() + ")")
                    .collect(Collectors.joining(", "));
            insights.add(ArchitecturalInsight.builder()
                    .insightType(InsightType.ANTI_PATTERN)
                    .title("Potential Pattern Overuse")
                    .description("High number of pattern opportunities detected: " + patternsList
                            + ". Consider if simpler solutions might be more appropriate.")
                    .confidence(PatternConfidence.LOW)
                    .impact(Impact.MEDIUM)
                    .effort(Effort.LOW)
                    .recommendation("Review each pattern opportunity carefully")
                    .recommendation("Consider simpler alternatives where appropriate")
                    .recommendation("Ensure patterns solve real problems, not imaginary ones")
                    .recommendation("Follow YAGNI (You Aren't Gonna Need It) principle")
                    .build());
        }

        if (totalOpportunities >= thresholds.getHighComplexityTotal()) {
            insights.add(ArchitecturalInsight.builder()
                    .insightType(InsightType.ANTI_PATTERN)
                    .title("High Complexity Warning")
                    .description(String.format("Found %d pattern opportunities. "
                            + "High pattern density might indicate over-engineering.", totalOpportunities))
                    .confidence(PatternConfidence.MEDIUM)
                    .impact(Impact.HIGH)
                    .effort(Effort.LOW)
                    .recommendation("Prioritize high-impact, low-effort improvements")
                    .recommendation("Focus on anti-pattern elimination first")
                    .recommendation("Consider architectural simplification")
                    .recommendation("Implement patterns incrementally, not all at once")
                    .build());
        }
    }

    private static List<String> distinctFiles(List<PatternOpportunity> opportunities) {
        return opportunities.stream()
                .map(PatternOpportunity::getFilePath)
                .distinct()
                .collect(Collectors.toList());
    }

    private static List<String> sortedUnion(List<PatternOpportunity> first, List<PatternOpportunity> second) {
        Set<String> files = new TreeSet<>(distinctFiles(first));
        files.addAll(distinctFiles(second));
        return new ArrayList<>(files);
    }
}
