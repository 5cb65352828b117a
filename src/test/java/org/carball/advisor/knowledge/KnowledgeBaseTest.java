package org.carball.advisor.knowledge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class KnowledgeBaseTest {

    private KnowledgeBase knowledgeBase;

    @BeforeEach
    public void setUp() {
        knowledgeBase = BuiltinPatterns.createDefault();
    }

    @Test
    public void shouldRegisterAllBuiltinPatternsInOrder() {
        assertThat(knowledgeBase.patternNames()).containsExactly(
                "singleton", "factory", "observer", "strategy", "command",
                "builder", "adapter", "decorator", "state", "repository");
        assertThat(knowledgeBase.size()).isEqualTo(10);
    }

    @Test
    public void shouldLookupCaseInsensitively() {
        assertThat(knowledgeBase.lookup("SINGLETON"))
                .map(PatternKnowledge::getName)
                .hasValue("Singleton Pattern");
        assertThat(knowledgeBase.lookup("Builder")).isPresent();
    }

    @Test
    public void shouldReturnEmptyForUnknownPattern() {
        assertThat(knowledgeBase.lookup("visitor")).isEmpty();
        assertThat(knowledgeBase.lookup(null)).isEmpty();
    }

    @Test
    public void shouldFailRequireForUnknownPattern() {
        assertThatThrownBy(() -> knowledgeBase.requirePattern("visitor"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("visitor");
    }

    @Test
    public void shouldRejectDuplicateKeys() {
        PatternKnowledge singleton = knowledgeBase.requirePattern("singleton");

        assertThatThrownBy(() -> new KnowledgeBase(List.of(singleton, singleton)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("singleton");
    }

    @Test
    public void shouldExposeCriteriaThresholds() {
        PatternCriteria builder = knowledgeBase.requirePattern("builder").getWhenToUse();
        PatternCriteria strategy = knowledgeBase.requirePattern("strategy").getWhenToUse();

        assertThat(builder.threshold("constructor_parameters")).hasValue(5);
        assertThat(strategy.threshold("algorithms")).hasValue(3);
        assertThat(strategy.threshold("missing")).isEmpty();
    }

    @Test
    public void shouldGroupByCategory() {
        List<String> creational = knowledgeBase.byCategory(PatternCategory.CREATIONAL).stream()
                .map(PatternKnowledge::getKey)
                .collect(Collectors.toList());

        assertThat(creational).containsExactly("singleton", "factory", "builder");
        assertThat(knowledgeBase.byCategory(PatternCategory.STRUCTURAL))
                .extracting(PatternKnowledge::getKey)
                .containsExactly("adapter", "decorator");
    }

    @Test
    public void shouldScoreIndicatorsAndKeepRegistryOrderForTies() {
        // When
        List<IndicatorMatch> matches = knowledgeBase.scoreIndicators(List.of("multiple"));

        // Then: decorator has 5 indicators, factory/strategy/repository 6, observer 10
        assertThat(matches).extracting(IndicatorMatch::patternName)
                .containsExactly("decorator", "factory", "strategy", "repository", "observer");
        assertThat(matches.get(0).score()).isCloseTo(0.2, within(1e-9));
        assertThat(matches.get(4).score()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    public void shouldScoreSingleIndicatorMatch() {
        List<IndicatorMatch> matches = knowledgeBase.scoreIndicators(List.of("Database Connection"));

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).patternName()).isEqualTo("singleton");
        assertThat(matches.get(0).score()).isCloseTo(1.0 / 8, within(1e-9));
    }

    @Test
    public void shouldCapIndicatorScoreAtOne() {
        List<IndicatorMatch> matches = knowledgeBase.scoreIndicators(Collections.nCopies(20, "single instance"));

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).score()).isEqualTo(1.0);
    }

    @Test
    public void shouldReturnNoMatchesForEmptyTokens() {
        assertThat(knowledgeBase.scoreIndicators(List.of())).isEmpty();
    }

    @Test
    public void shouldDetectAntiPatternMentions() {
        // When
        List<AntiPatternWarning> warnings = knowledgeBase.detectAntiPatternMentions(
                "We keep Data Models as singletons, and there is only one observer anyway");

        // Then
        assertThat(warnings).extracting(AntiPatternWarning::patternName)
                .contains("singleton", "observer");
        assertThat(warnings).extracting(AntiPatternWarning::message)
                .contains("Potential singleton anti-pattern detected: data models",
                        "Potential observer anti-pattern detected: only one observer");
    }

    @Test
    public void shouldReturnNoWarningsForNeutralText() {
        assertThat(knowledgeBase.detectAntiPatternMentions("parse the request body")).isEmpty();
        assertThat(knowledgeBase.detectAntiPatternMentions("")).isEmpty();
    }

    @Test
    public void shouldRecommendBasedOnMinimumComplexity() {
        assertThat(knowledgeBase.complexityRecommendation("decorator", ComplexityLevel.SIMPLE))
                .hasValue("Decorator Pattern might be overkill for simple scenarios");
        assertThat(knowledgeBase.complexityRecommendation("adapter", ComplexityLevel.SIMPLE))
                .hasValue("Adapter Pattern is appropriate for simple scenarios");
        assertThat(knowledgeBase.complexityRecommendation("decorator", ComplexityLevel.ENTERPRISE))
                .hasValue("Decorator Pattern is appropriate for enterprise scenarios");
        assertThat(knowledgeBase.complexityRecommendation("visitor", ComplexityLevel.SIMPLE)).isEmpty();
    }

    @Test
    public void shouldOrderConfidenceLevels() {
        assertThat(PatternConfidence.CRITICAL.isAtLeast(PatternConfidence.HIGH)).isTrue();
        assertThat(PatternConfidence.MEDIUM.isAtLeast(PatternConfidence.HIGH)).isFalse();
        assertThat(PatternConfidence.LOW.compareTo(PatternConfidence.MEDIUM)).isNegative();
    }
}
