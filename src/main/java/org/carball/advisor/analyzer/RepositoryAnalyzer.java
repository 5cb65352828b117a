package org.carball.advisor.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.advisor.config.AnalyzerConfig;
import org.carball.advisor.config.InsightThresholds;
import org.carball.advisor.knowledge.KnowledgeBase;
import org.carball.advisor.model.analysis.ArchitecturalInsight;
import org.carball.advisor.model.analysis.ComplexityTier;
import org.carball.advisor.model.analysis.RepositoryAnalysis;
import org.carball.advisor.model.opportunity.PatternOpportunity;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Analyzes every source file under a directory and aggregates the findings
 * into a {@link RepositoryAnalysis}.
 */
@Slf4j
public class RepositoryAnalyzer {

    private final AnalyzerConfig config;
    private final FileAnalyzer fileAnalyzer;
    private final InsightGenerator insightGenerator;
    private final ComplexityAssessor complexityAssessor;

    public RepositoryAnalyzer(KnowledgeBase knowledgeBase, AnalyzerConfig config) {
        this.config = config;
        this.fileAnalyzer = new FileAnalyzer(knowledgeBase, config.getDetectionThresholds());
        this.insightGenerator = new InsightGenerator(config.getInsightThresholds());
        this.complexityAssessor = new ComplexityAssessor(config.getInsightThresholds());

        log.info("Initialized RepositoryAnalyzer with config: {}", config.getConfigurationSummary());
    }

    public RepositoryAnalysis analyze(Path root) {
        return analyze(root, List.of());
    }

    public RepositoryAnalysis analyze(Path root, List<String> excludePatterns) {
        if (root == null || !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Repository path does not exist or is not a directory: " + root);
        }
        log.info("Starting pattern analysis of {}", root);

        List<String> excludes = new ArrayList<>(config.getExcludePatterns());
        excludes.addAll(excludePatterns);
        SourceFileScanner scanner = new SourceFileScanner(config.getFileExtensions(), excludes);
        List<Path> files = scanner.scan(root);
        log.info("Found {} source files to analyze", files.size());

        // Step 1: Per-file analysis, re-ordered by path regardless of execution mode
        Stream<Path> stream = config.isParallel() ? files.parallelStream() : files.stream();
        List<Map.Entry<String, List<PatternOpportunity>>> results = stream
                .map(file -> {
                    String relative = SourceFileScanner.relativePath(root, file);
                    return Map.entry(relative, fileAnalyzer.analyzeFile(file, relative));
                })
                .collect(Collectors.toList());

        Map<String, List<PatternOpportunity>> opportunitiesByFile = new LinkedHashMap<>();
        results.stream()
                .filter(entry -> !entry.getValue().isEmpty())
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> opportunitiesByFile.put(entry.getKey(), List.copyOf(entry.getValue())));

        // Step 2: Flatten and group by pattern
        List<PatternOpportunity> allOpportunities = opportunitiesByFile.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toList());
        Map<String, List<PatternOpportunity>> byPattern = allOpportunities.stream()
                .collect(Collectors.groupingBy(PatternOpportunity::getPatternName, LinkedHashMap::new,
                        Collectors.toList()));

        // Step 3: Insights and complexity tier
        List<ArchitecturalInsight> insights = new ArrayList<>(
                insightGenerator.generate(byPattern, allOpportunities.size()));
        ComplexityTier tier = complexityAssessor.assess(allOpportunities);
        insights.add(ComplexityAssessor.toInsight(tier));
        insights.sort(Comparator.comparingDouble(ArchitecturalInsight::getPriorityScore).reversed());

        Map<String, Integer> patternUsage = new LinkedHashMap<>();
        byPattern.forEach((pattern, opportunities) -> patternUsage.put(pattern, opportunities.size()));

        RepositoryAnalysis analysis = new RepositoryAnalysis(
                root.toString(),
                files.size(),
                opportunitiesByFile.size(),
                allOpportunities.size(),
                Collections.unmodifiableMap(opportunitiesByFile),
                List.copyOf(insights),
                Collections.unmodifiableMap(patternUsage),
                tier,
                ComplexityAssessor.describe(tier),
                summarizeRecommendations(insights, config.getInsightThresholds()));

        log.info("Analysis complete. {} opportunities in {} of {} files, complexity: {}",
                analysis.totalOpportunities(), analysis.filesWithOpportunities(),
                analysis.totalFilesAnalyzed(), tier.getLabel());
        return analysis;
    }

    /**
     * Leading recommendations of the top-ranked insights, de-duplicated in
     * order. Expects {@code rankedInsights} sorted by priority.
     */
    static List<String> summarizeRecommendations(List<ArchitecturalInsight> rankedInsights,
                                                 InsightThresholds thresholds) {
        Set<String> unique = new LinkedHashSet<>();
        rankedInsights.stream()
                .limit(Math.max(0, thresholds.getSummaryTopInsights()))
                .forEach(insight -> insight.getRecommendations().stream()
                        .limit(Math.max(0, thresholds.getSummaryRecommendationsPerInsight()))
                        .forEach(unique::add));

        return unique.stream()
                .limit(Math.max(0, thresholds.getSummaryMaxRecommendations()))
                .collect(Collectors.toUnmodifiableList());
    }
}
