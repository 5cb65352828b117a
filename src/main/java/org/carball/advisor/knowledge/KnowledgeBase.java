package org.carball.advisor.knowledge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only registry of pattern knowledge keyed by lowercase pattern name.
 * Built once and handed to the analyzers; safe for concurrent reads.
 */
public final class KnowledgeBase {

    private final Map<String, PatternKnowledge> patterns;

    public KnowledgeBase(Collection<PatternKnowledge> knowledge) {
        Map<String, PatternKnowledge> registry = new LinkedHashMap<>();
        for (PatternKnowledge entry : knowledge) {
            String key = entry.getKey().toLowerCase(Locale.ROOT);
            if (registry.putIfAbsent(key, entry) != null) {
                throw new IllegalArgumentException("Duplicate pattern key: " + key);
            }
        }
        this.patterns = Collections.unmodifiableMap(registry);
    }

    public Optional<PatternKnowledge> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(patterns.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Lookup for names the analyzers themselves emit. An unknown name means a
     * detector and the registry are out of sync, which is a defect.
     */
    public PatternKnowledge requirePattern(String name) {
        return lookup(name).orElseThrow(() ->
                new IllegalStateException("Pattern not registered in knowledge base: " + name));
    }

    public List<String> patternNames() {
        return List.copyOf(patterns.keySet());
    }

    public List<PatternKnowledge> byCategory(PatternCategory category) {
        return patterns.values().stream()
                .filter(p -> p.getCategory() == category)
                .collect(Collectors.toList());
    }

    /**
     * Scores every pattern against free-text tokens. Each indicator phrase that
     * contains a token adds {@code 1 / indicatorCount}; scores are capped at 1.0
     * and zero scores are dropped. Ties keep registry order.
     */
    public List<IndicatorMatch> scoreIndicators(List<String> tokens) {
        List<IndicatorMatch> results = new ArrayList<>();

        for (Map.Entry<String, PatternKnowledge> entry : patterns.entrySet()) {
            List<String> indicators = entry.getValue().getWhenToUse().getIndicators();
            if (indicators.isEmpty()) {
                continue;
            }
            double increment = 1.0 / indicators.size();
            double score = 0.0;

            for (String token : tokens) {
                String needle = token.toLowerCase(Locale.ROOT);
                for (String indicator : indicators) {
                    if (indicator.toLowerCase(Locale.ROOT).contains(needle)) {
                        score += increment;
                    }
                }
            }

            if (score > 0) {
                results.add(new IndicatorMatch(entry.getKey(), Math.min(score, 1.0)));
            }
        }

        // List.sort is stable, so equal scores stay in registry order
        results.sort(Comparator.comparingDouble(IndicatorMatch::score).reversed());
        return results;
    }

    public List<AntiPatternWarning> detectAntiPatternMentions(String text) {
        List<AntiPatternWarning> warnings = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return warnings;
        }
        String haystack = text.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, PatternKnowledge> entry : patterns.entrySet()) {
            for (String redFlag : entry.getValue().getWhenNotToUse().getRedFlags()) {
                if (haystack.contains(redFlag.toLowerCase(Locale.ROOT))) {
                    warnings.add(new AntiPatternWarning(entry.getKey(), redFlag,
                            String.format("Potential %s anti-pattern detected: %s", entry.getKey(), redFlag)));
                }
            }
        }
        return warnings;
    }

    public Optional<String> complexityRecommendation(String patternName, ComplexityLevel scenarioComplexity) {
        return lookup(patternName).map(knowledge -> {
            ComplexityLevel minimum = knowledge.getWhenToUse().getMinimumComplexity();
            if (scenarioComplexity.isBelow(minimum)) {
                return String.format("%s might be overkill for %s scenarios",
                        knowledge.getName(), scenarioComplexity.getValue());
            }
            return String.format("%s is appropriate for %s scenarios",
                    knowledge.getName(), scenarioComplexity.getValue());
        });
    }

    public int size() {
        return patterns.size();
    }
}
