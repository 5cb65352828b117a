package org.carball.advisor.knowledge;

import lombok.Builder;
import lombok.Value;

/**
 * Free-text notes for experienced readers. Every field may be null.
 */
@Value
@Builder
public class AdvancedScenarios {
    String threadingConsiderations;
    String performanceImplications;
    String testingChallenges;
    String optimizationTips;
    String enterpriseConsiderations;
}
