package org.carball.advisor.config;

import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.advisor.knowledge.KnowledgeBase;

import java.util.ArrayList;
import java.util.List;

@Data
@Slf4j
public class AnalyzerConfig {

    @JsonMerge
    @JsonProperty("detection")
    private DetectionThresholds detectionThresholds = new DetectionThresholds();

    @JsonMerge
    @JsonProperty("insights")
    private InsightThresholds insightThresholds = new InsightThresholds();

    // Substrings matched against "/" + root-relative path
    @JsonProperty("exclude_patterns")
    private List<String> excludePatterns = new ArrayList<>();

    @JsonProperty("file_extensions")
    private List<String> fileExtensions = new ArrayList<>(List.of(".java"));

    @JsonProperty("parallel")
    private boolean parallel;

    public static AnalyzerConfig defaults(KnowledgeBase knowledgeBase) {
        AnalyzerConfig config = new AnalyzerConfig();
        config.setDetectionThresholds(DetectionThresholds.createDefaults(knowledgeBase));
        config.setInsightThresholds(InsightThresholds.createDefaults());
        return config;
    }

    /**
     * Validates the configuration and logs warnings for questionable values.
     */
    public void validate() {
        detectionThresholds.validate();
        insightThresholds.validate();

        if (fileExtensions.isEmpty()) {
            log.warn("No file extensions configured; no files will be analyzed");
        }

        for (String extension : fileExtensions) {
            if (!extension.startsWith(".")) {
                log.warn("File extension '{}' does not start with '.' and may match unexpected files", extension);
            }
        }

        if (excludePatterns.stream().anyMatch(String::isBlank)) {
            log.warn("Blank exclude pattern configured; it excludes every file");
        }
    }

    public String getConfigurationSummary() {
        return String.format("%s | %s | extensions=%s | excludes=%d | parallel=%s",
                detectionThresholds.getDescription(), insightThresholds.getDescription(),
                fileExtensions, excludePatterns.size(), parallel);
    }
}
