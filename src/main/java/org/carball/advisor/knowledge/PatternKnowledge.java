package org.carball.advisor.knowledge;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PatternKnowledge {
    String key;
    String name;
    PatternCategory category;
    String description;
    PatternCriteria whenToUse;
    AntiPatternCriteria whenNotToUse;
    AdvancedScenarios advanced;
    @Singular
    List<String> alternatives;
    // 1-10, effort to implement
    int complexityScore;
    // 1-10, effort to understand
    int learningDifficulty;
}
