package org.carball.advisor.model.analysis;

import org.carball.advisor.model.opportunity.PatternOpportunity;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of one repository run. Map keys are root-relative paths in sorted
 * order; only files with findings appear in {@code opportunitiesByFile}.
 */
public record RepositoryAnalysis(
        String repositoryPath,
        int totalFilesAnalyzed,
        int filesWithOpportunities,
        int totalOpportunities,
        Map<String, List<PatternOpportunity>> opportunitiesByFile,
        List<ArchitecturalInsight> architecturalInsights,
        Map<String, Integer> patternUsageSummary,
        ComplexityTier complexityTier,
        String complexityAssessment,
        List<String> recommendationsSummary
) {}
