package org.carball.advisor.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.advisor.knowledge.KnowledgeBase;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

@Slf4j
public class ConfigurationLoader {

    private final KnowledgeBase knowledgeBase;
    private final ObjectMapper yamlMapper;

    public ConfigurationLoader(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads configuration using the hierarchy: env vars > YAML file > defaults.
     * A null config file skips the YAML layer.
     */
    public AnalyzerConfig loadConfiguration(Path configFile) {
        return loadConfiguration(configFile, System.getenv());
    }

    AnalyzerConfig loadConfiguration(Path configFile, Map<String, String> env) {
        log.debug("Loading configuration");

        // Start with defaults
        AnalyzerConfig config = AnalyzerConfig.defaults(knowledgeBase);

        // 1. Apply YAML file
        if (configFile != null) {
            applyYamlFile(config, configFile);
        }

        // 2. Apply environment variables (highest priority)
        applyEnvironmentVariables(config, env);

        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    private void applyYamlFile(AnalyzerConfig config, Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            log.warn("Configuration file not found: {}. Using defaults", configFile);
            return;
        }

        try {
            yamlMapper.readerForUpdating(config).readValue(configFile.toFile());
            log.info("Applied configuration file: {}", configFile);
        } catch (IOException e) {
            log.warn("Error reading configuration file: {} - {}. Using defaults", configFile, e.getMessage());
        }
    }

    private void applyEnvironmentVariables(AnalyzerConfig config, Map<String, String> env) {
        DetectionThresholds detection = config.getDetectionThresholds();
        InsightThresholds insights = config.getInsightThresholds();

        applyInt(env, "ADVISOR_BUILDER_MIN_PARAMETERS", detection::setBuilderMinParameters);
        applyInt(env, "ADVISOR_STRATEGY_MIN_BRANCHES", detection::setStrategyMinBranches);
        applyInt(env, "ADVISOR_REPOSITORY_DATA_ACCESS_CALLS", detection::setRepositoryDataAccessCalls);
        applyInt(env, "ADVISOR_PATTERN_OVERUSE", insights::setPatternOveruse);
        applyInt(env, "ADVISOR_HIGH_COMPLEXITY_TOTAL", insights::setHighComplexityTotal);

        if (env.containsKey("ADVISOR_FILE_EXTENSIONS")) {
            config.setFileExtensions(splitList(env.get("ADVISOR_FILE_EXTENSIONS")));
        }
        if (env.containsKey("ADVISOR_EXCLUDE_PATTERNS")) {
            config.getExcludePatterns().addAll(splitList(env.get("ADVISOR_EXCLUDE_PATTERNS")));
        }
        if (env.containsKey("ADVISOR_PARALLEL")) {
            config.setParallel(Boolean.parseBoolean(env.get("ADVISOR_PARALLEL")));
        }
    }

    private void applyInt(Map<String, String> env, String name, IntConsumer setter) {
        String value = env.get(name);
        if (value == null) {
            return;
        }
        try {
            setter.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, value);
        }
    }

    private List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Returns help text for the configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Configuration Options:

            YAML file keys:
              detection.builder_min_parameters        Constructor parameters that suggest a builder
              detection.strategy_min_branches         Conditional branches that suggest a strategy
              detection.repository_data_access_calls  Data-access calls that suggest a repository
              insights.pattern_overuse                Findings per pattern that trigger an overuse warning
              insights.high_complexity_total          Total findings that trigger a complexity warning
              exclude_patterns                        Path substrings to skip
              file_extensions                         Extensions of files to analyze
              parallel                                Analyze files on a parallel stream

            Environment Variables:
              ADVISOR_BUILDER_MIN_PARAMETERS          Same as detection.builder_min_parameters
              ADVISOR_STRATEGY_MIN_BRANCHES           Same as detection.strategy_min_branches
              ADVISOR_REPOSITORY_DATA_ACCESS_CALLS    Same as detection.repository_data_access_calls
              ADVISOR_PATTERN_OVERUSE                 Same as insights.pattern_overuse
              ADVISOR_HIGH_COMPLEXITY_TOTAL           Same as insights.high_complexity_total
              ADVISOR_FILE_EXTENSIONS                 Comma-separated, replaces file_extensions
              ADVISOR_EXCLUDE_PATTERNS                Comma-separated, added to exclude_patterns
              ADVISOR_PARALLEL                        true or false

            Priority Order (highest to lowest):
              1. Environment variables
              2. YAML configuration file
              3. Built-in defaults
            """;
    }
}
