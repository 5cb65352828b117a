package org.carball.advisor.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Repository-level counts that turn groups of findings into insights.
 */
@Data
@Slf4j
public class InsightThresholds {

    // Pattern-specific insights
    @JsonProperty("singleton_overuse_anti_patterns")
    private int singletonOveruseAntiPatterns = 2;

    @JsonProperty("shared_resource_singletons")
    private int sharedResourceSingletons = 2;

    @JsonProperty("factory_standardization")
    private int factoryStandardization = 3;

    @JsonProperty("event_driven_observers")
    private int eventDrivenObservers = 2;

    @JsonProperty("strategy_complexity")
    private int strategyComplexity = 3;

    @JsonProperty("builder_construction")
    private int builderConstruction = 2;

    @JsonProperty("repository_centralization")
    private int repositoryCentralization = 1;

    // Anti-pattern insights
    @JsonProperty("pattern_overuse")
    private int patternOveruse = 5;

    @JsonProperty("high_complexity_total")
    private int highComplexityTotal = 20;

    // Complexity tiers
    @JsonProperty("medium_high_confident_findings")
    private int mediumHighConfidentFindings = 5;

    @JsonProperty("medium_total")
    private int mediumTotal = 10;

    @JsonProperty("low_medium_total")
    private int lowMediumTotal = 5;

    // Recommendation summary
    @JsonProperty("summary_top_insights")
    private int summaryTopInsights = 5;

    @JsonProperty("summary_recommendations_per_insight")
    private int summaryRecommendationsPerInsight = 2;

    @JsonProperty("summary_max_recommendations")
    private int summaryMaxRecommendations = 10;

    public static InsightThresholds createDefaults() {
        return new InsightThresholds();
    }

    public void validate() {
        if (mediumTotal <= lowMediumTotal) {
            log.warn("Medium tier total ({}) should be greater than low-medium tier total ({})",
                    mediumTotal, lowMediumTotal);
        }

        if (highComplexityTotal <= mediumTotal) {
            log.warn("High complexity warning total ({}) should be greater than medium tier total ({})",
                    highComplexityTotal, mediumTotal);
        }

        if (patternOveruse <= 1) {
            log.warn("Pattern overuse threshold ({}) flags every repeated pattern", patternOveruse);
        }

        if (summaryMaxRecommendations <= 0) {
            log.warn("Recommendation summary cap ({}) leaves the summary empty", summaryMaxRecommendations);
        }
    }

    public String getDescription() {
        return String.format("Insights: overuse=%d, highComplexity=%d, tiers=%d/%d/%d, summary=%d",
                patternOveruse, highComplexityTotal,
                mediumHighConfidentFindings, mediumTotal, lowMediumTotal,
                summaryMaxRecommendations);
    }
}
