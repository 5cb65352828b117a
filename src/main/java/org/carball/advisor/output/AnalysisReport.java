package org.carball.advisor.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.carball.advisor.model.analysis.ArchitecturalInsight;
import org.carball.advisor.model.analysis.RepositoryAnalysis;
import org.carball.advisor.model.opportunity.PatternOpportunity;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class AnalysisReport {

    static final double HIGH_PRIORITY_SCORE = 0.7;
    private static final int TOP_INSIGHTS = 5;
    private static final int INSIGHT_RECOMMENDATIONS = 3;
    private static final int ACTION_ITEMS = 8;
    private static final int FILE_OPPORTUNITIES = 8;
    private static final int OPPORTUNITY_REPORT_LIMIT = 10;

    private final RepositoryAnalysis analysis;
    private final ObjectMapper objectMapper;

    public AnalysisReport(RepositoryAnalysis analysis) {
        this.analysis = analysis;
        this.objectMapper = createObjectMapper();
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public void writeJson(Path output) throws IOException {
        objectMapper.writeValue(output.toFile(), analysis);
        log.info("Analysis saved to {}", output);
    }

    /**
     * Reads a snapshot written by {@link #writeJson} as a plain JSON tree.
     */
    public static JsonNode readSnapshot(Path snapshot) throws IOException {
        return createObjectMapper().readTree(snapshot.toFile());
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        // Header
        md.append("# Repository Pattern Analysis Report\n\n");
        md.append("**Repository:** ").append(analysis.repositoryPath()).append("  \n");
        md.append("**Files Analyzed:** ").append(analysis.totalFilesAnalyzed()).append("  \n");
        md.append("**Total Opportunities:** ").append(analysis.totalOpportunities()).append("  \n");
        md.append("**Complexity:** ").append(analysis.complexityAssessment()).append("  \n\n");

        if (analysis.totalOpportunities() == 0) {
            md.append("**Excellent!** No pattern opportunities detected. Your codebase appears well-structured.\n");
            return md.toString();
        }

        // Pattern summary
        md.append("## Pattern Opportunity Summary\n\n");
        md.append("| Pattern | Opportunities |\n");
        md.append("|---------|---------------|\n");
        analysis.patternUsageSummary().entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(e -> md.append("| ").append(capitalize(e.getKey())).append(" | ")
                        .append(e.getValue()).append(" |\n"));
        md.append("\n");

        // Insights arrive ranked
        md.append("## Key Architectural Insights\n\n");
        int insightNum = 1;
        for (ArchitecturalInsight insight : analysis.architecturalInsights().subList(0,
                Math.min(TOP_INSIGHTS, analysis.architecturalInsights().size()))) {
            md.append("### ").append(insightNum++).append(". ").append(insight.getTitle()).append("\n\n");
            md.append("- **Type:** ").append(titleCase(insight.getInsightType().getValue())).append("\n");
            md.append("- **Impact:** ").append(insight.getImpact().getDisplayName())
                    .append(" | **Effort:** ").append(insight.getEffort().getDisplayName()).append("\n");
            md.append("- **Description:** ").append(insight.getDescription()).append("\n");
            if (!insight.getAffectedFiles().isEmpty()) {
                md.append("- **Affected Files:** ").append(insight.getAffectedFiles().size()).append(" files\n");
            }
            md.append("\n**Recommendations:**\n");
            insight.getRecommendations().stream()
                    .limit(INSIGHT_RECOMMENDATIONS)
                    .forEach(rec -> md.append("- ").append(rec).append("\n"));
            md.append("\n");
        }

        // Priority recommendations
        md.append("## Priority Action Items\n\n");
        int recNum = 1;
        for (String rec : analysis.recommendationsSummary()) {
            if (recNum > ACTION_ITEMS) {
                break;
            }
            md.append(recNum++).append(". ").append(rec).append("\n");
        }
        md.append("\n");

        // High-priority file-level opportunities
        md.append("## High-Priority File Opportunities\n\n");
        List<PatternOpportunity> highPriority = highPriority(allOpportunities());
        if (highPriority.isEmpty()) {
            md.append("No opportunities above the high-priority score of ").append(HIGH_PRIORITY_SCORE).append(".\n");
        }
        for (PatternOpportunity opp : highPriority.subList(0, Math.min(FILE_OPPORTUNITIES, highPriority.size()))) {
            md.append("**").append(capitalize(opp.getPatternName())).append("** in `")
                    .append(fileName(opp.getFilePath())).append(":").append(opp.getLineNumber()).append("`\n");
            md.append("- ").append(opp.getDescription()).append("\n");
            md.append("- Effort: ").append(opp.getEstimatedEffort().getDisplayName())
                    .append(" | Impact: ").append(opp.getImpact().getDisplayName()).append("\n\n");
        }

        return md.toString();
    }

    /**
     * File-level view: counts per pattern and the strongest individual
     * findings.
     */
    public String toOpportunityMarkdown() {
        List<PatternOpportunity> all = allOpportunities();
        if (all.isEmpty()) {
            return "No pattern opportunities detected! Your code looks well-structured.\n";
        }

        StringBuilder md = new StringBuilder();
        md.append("# Pattern Analysis Report\n\n");
        md.append("**Total Opportunities Found:** ").append(all.size())
                .append(" across ").append(analysis.opportunitiesByFile().size()).append(" files\n\n");

        md.append("## Summary by Pattern\n\n");
        Map<String, List<PatternOpportunity>> byPattern = all.stream()
                .collect(Collectors.groupingBy(PatternOpportunity::getPatternName, LinkedHashMap::new,
                        Collectors.toList()));
        byPattern.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> {
                    long high = e.getValue().stream().filter(o -> o.getPriorityScore() > HIGH_PRIORITY_SCORE).count();
                    md.append("- **").append(capitalize(e.getKey())).append("**: ").append(e.getValue().size())
                            .append(" opportunities (").append(high).append(" high priority)\n");
                });

        md.append("\n## High Priority Opportunities\n\n");
        List<PatternOpportunity> highPriority = highPriority(all);
        int num = 1;
        for (PatternOpportunity opp : highPriority.subList(0, Math.min(OPPORTUNITY_REPORT_LIMIT, highPriority.size()))) {
            md.append("### ").append(num++).append(". ").append(capitalize(opp.getPatternName())).append(" Pattern\n\n");
            md.append("- **File:** ").append(opp.getFilePath()).append(":").append(opp.getLineNumber()).append("\n");
            md.append("- **Confidence:** ").append(opp.getConfidence().getDisplayName()).append("\n");
            md.append("- **Description:** ").append(opp.getDescription()).append("\n");
            md.append("- **Reasoning:** ").append(opp.getReasoning()).append("\n");
            md.append("- **Effort:** ").append(opp.getEstimatedEffort().getDisplayName())
                    .append(" | **Impact:** ").append(opp.getImpact().getDisplayName()).append("\n\n");
        }

        if (highPriority.size() > OPPORTUNITY_REPORT_LIMIT) {
            md.append("... and ").append(highPriority.size() - OPPORTUNITY_REPORT_LIMIT)
                    .append(" more high priority opportunities.\n");
        }

        return md.toString();
    }

    private List<PatternOpportunity> allOpportunities() {
        List<PatternOpportunity> all = new ArrayList<>();
        analysis.opportunitiesByFile().values().forEach(all::addAll);
        return all;
    }

    private static List<PatternOpportunity> highPriority(List<PatternOpportunity> opportunities) {
        return opportunities.stream()
                .filter(o -> o.getPriorityScore() > HIGH_PRIORITY_SCORE)
                .sorted(Comparator.comparingDouble(PatternOpportunity::getPriorityScore).reversed())
                .collect(Collectors.toList());
    }

    private static String fileName(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }

    private static String titleCase(String value) {
        return Arrays.stream(value.split("_"))
                .map(AnalysisReport::capitalize)
                .collect(Collectors.joining(" "));
    }
}
