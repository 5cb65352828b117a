package org.carball.advisor.knowledge;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AntiPatternCriteria {
    @Singular
    List<String> redFlags;
    @Singular("scenarioToAvoid")
    List<String> scenariosToAvoid;
    @Singular
    List<String> betterAlternatives;
    @Singular
    List<String> commonMistakes;
}
