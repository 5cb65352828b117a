package org.carball.advisor.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.advisor.knowledge.BuiltinPatterns;
import org.carball.advisor.knowledge.KnowledgeBase;
import org.carball.advisor.knowledge.PatternKnowledge;

import java.util.function.IntConsumer;

/**
 * Per-file detector cut-offs. Field initializers mirror the built-in pattern
 * criteria so that a bare YAML load and {@link #createDefaults} agree.
 */
@Data
@Slf4j
public class DetectionThresholds {

    @JsonProperty("builder_min_parameters")
    private int builderMinParameters = 5;

    @JsonProperty("builder_high_confidence_parameters")
    private int builderHighConfidenceParameters = 7;

    @JsonProperty("builder_high_effort_parameters")
    private int builderHighEffortParameters = 8;

    @JsonProperty("strategy_min_branches")
    private int strategyMinBranches = 3;

    @JsonProperty("strategy_high_confidence_branches")
    private int strategyHighConfidenceBranches = 4;

    @JsonProperty("factory_type_check_branches")
    private int factoryTypeCheckBranches = 2;

    @JsonProperty("factory_creation_returns")
    private int factoryCreationReturns = 2;

    @JsonProperty("factory_distinct_types")
    private int factoryDistinctTypes = 2;

    @JsonProperty("repository_data_access_calls")
    private int repositoryDataAccessCalls = 2;

    /**
     * Reads pattern-specific cut-offs from the knowledge base criteria, keeping
     * the field defaults where a pattern does not declare one.
     */
    public static DetectionThresholds createDefaults(KnowledgeBase knowledgeBase) {
        DetectionThresholds thresholds = new DetectionThresholds();

        apply(knowledgeBase, BuiltinPatterns.BUILDER, "constructor_parameters", thresholds::setBuilderMinParameters);
        apply(knowledgeBase, BuiltinPatterns.BUILDER, "high_confidence_parameters",
                thresholds::setBuilderHighConfidenceParameters);
        apply(knowledgeBase, BuiltinPatterns.BUILDER, "high_effort_parameters",
                thresholds::setBuilderHighEffortParameters);
        apply(knowledgeBase, BuiltinPatterns.STRATEGY, "algorithms", thresholds::setStrategyMinBranches);
        apply(knowledgeBase, BuiltinPatterns.STRATEGY, "high_confidence_algorithms",
                thresholds::setStrategyHighConfidenceBranches);
        apply(knowledgeBase, BuiltinPatterns.FACTORY, "type_check_chain", thresholds::setFactoryTypeCheckBranches);
        apply(knowledgeBase, BuiltinPatterns.FACTORY, "creation_returns", thresholds::setFactoryCreationReturns);
        apply(knowledgeBase, BuiltinPatterns.FACTORY, "distinct_types", thresholds::setFactoryDistinctTypes);
        apply(knowledgeBase, BuiltinPatterns.REPOSITORY, "data_access_calls",
                thresholds::setRepositoryDataAccessCalls);

        return thresholds;
    }

    private static void apply(KnowledgeBase knowledgeBase, String pattern, String threshold, IntConsumer setter) {
        knowledgeBase.lookup(pattern)
                .map(PatternKnowledge::getWhenToUse)
                .ifPresent(criteria -> criteria.threshold(threshold).ifPresent(setter));
    }

    public void validate() {
        if (builderHighConfidenceParameters < builderMinParameters) {
            log.warn("Builder high-confidence parameter count ({}) is below the minimum parameter count ({})",
                    builderHighConfidenceParameters, builderMinParameters);
        }

        if (builderHighEffortParameters < builderMinParameters) {
            log.warn("Builder high-effort parameter count ({}) is below the minimum parameter count ({})",
                    builderHighEffortParameters, builderMinParameters);
        }

        if (strategyMinBranches < 2) {
            log.warn("Strategy branch threshold ({}) should be at least 2", strategyMinBranches);
        }

        if (strategyHighConfidenceBranches < strategyMinBranches) {
            log.warn("Strategy high-confidence branches ({}) is below the minimum branch count ({})",
                    strategyHighConfidenceBranches, strategyMinBranches);
        }

        if (factoryTypeCheckBranches < 1 || factoryCreationReturns < 1 || repositoryDataAccessCalls < 1) {
            log.warn("Factory and repository thresholds should be positive: typeChecks={}, returns={}, dataAccess={}",
                    factoryTypeCheckBranches, factoryCreationReturns, repositoryDataAccessCalls);
        }

        if (factoryDistinctTypes < 2) {
            log.warn("Factory distinct type threshold ({}) flags every method that returns a new object",
                    factoryDistinctTypes);
        }
    }

    public String getDescription() {
        return String.format("Detection: builder=%d/%d/%d, strategy=%d/%d, factory=%d/%d/%d, repository=%d",
                builderMinParameters, builderHighConfidenceParameters, builderHighEffortParameters,
                strategyMinBranches, strategyHighConfidenceBranches,
                factoryTypeCheckBranches, factoryCreationReturns, factoryDistinctTypes, repositoryDataAccessCalls);
    }
}
