package org.carball.advisor.analyzer.detector;

import org.carball.advisor.analyzer.FileAnalyzer;
import org.carball.advisor.config.DetectionThresholds;
import org.carball.advisor.knowledge.BuiltinPatterns;
import org.carball.advisor.knowledge.KnowledgeBase;
import org.carball.advisor.knowledge.PatternConfidence;
import org.carball.advisor.model.opportunity.OpportunityType;
import org.carball.advisor.model.opportunity.PatternOpportunity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class StrategyDetectorTest {

    private FileAnalyzer analyzer;

    @BeforeEach
    public void setUp() {
        KnowledgeBase knowledgeBase = BuiltinPatterns.createDefault();
        analyzer = new FileAnalyzer(knowledgeBase, DetectionThresholds.createDefaults(knowledgeBase),
                List.of(new StrategyDetector()));
    }

    @Test
    public void shouldFlagLongChainOnceAtItsHead() {
        // Given
        String code = """
            public class Compressor {
                public byte[] compress(String format, byte[] data) {
                    if (format.equals("zip")) {
                        return zip(data);
                    } else if (format.equals("gzip")) {
                        return gzip(data);
                    } else if (format.equals("lz4")) {
                        return lz4(data);
                    } else if (format.equals("snappy")) {
                        return snappy(data);
                    }
                    return data;
                }
            }
            """;

        // When
        List<PatternOpportunity> opportunities = analyzer.analyzeSource(code, "Compressor.java");

        // Then
        assertThat(opportunities).hasSize(1);
        PatternOpportunity opportunity = opportunities.get(0);
        assertThat(opportunity.getPatternName()).isEqualTo("strategy");
        assertThat(opportunity.getOpportunityType()).isEqualTo(OpportunityType.REFACTOR_TO_PATTERN);
        assertThat(opportunity.getConfidence()).isEqualTo(PatternConfidence.HIGH);
        assertThat(opportunity.getLineNumber()).isEqualTo(3);
        assertThat(opportunity.getDescription())
                .isEqualTo("Long if/else-if chain (4 conditions) suggests Strategy pattern");
    }

    @Test
    public void shouldUseMediumConfidenceForThreeBranches() {
        String code = """
            public class Notifier {
                public void send(int channel, String message) {
                    if (channel == 1) {
                        sendEmail(message);
                    } else if (channel == 2) {
                        sendSms(message);
                    } else if (channel == 3) {
                        sendPush(message);
                    }
                }
            }
            """;

        List<PatternOpportunity> opportunities = analyzer.analyzeSource(code, "Notifier.java");

        assertThat(opportunities).extracting(PatternOpportunity::getConfidence)
                .containsExactly(PatternConfidence.MEDIUM);
    }

    @Test
    public void shouldIgnoreChainCallingSameCode() {
        String code = """
            public class Grader {
                public void grade(int score) {
                    if (score > 90) {
                        record(score);
                    } else if (score > 80) {
                        record(score);
                    } else if (score > 70) {
                        record(score);
                    }
                }
            }
            """;

        assertThat(analyzer.analyzeSource(code, "Grader.java")).isEmpty();
    }

    @Test
    public void shouldIgnoreShortChains() {
        String code = """
            public class Toggle {
                public void flip(boolean on) {
                    if (on) {
                        enable();
                    } else if (!on) {
                        disable();
                    }
                }
            }
            """;

        assertThat(analyzer.analyzeSource(code, "Toggle.java")).isEmpty();
    }

    @Test
    public void shouldFlagSwitchSelectingBehavior() {
        // Given
        String code = """
            public class Exporter {
                public void export(String format) {
                    switch (format) {
                        case "csv":
                            writeCsv();
                            break;
                        case "json":
                            writeJson();
                            break;
                        case "xml":
                            writeXml();
                            break;
                        default:
                            break;
                    }
                }
            }
            """;

        // When
        List<PatternOpportunity> opportunities = analyzer.analyzeSource(code, "Exporter.java");

        // Then
        assertThat(opportunities).hasSize(1);
        assertThat(opportunities.get(0).getConfidence()).isEqualTo(PatternConfidence.MEDIUM);
        assertThat(opportunities.get(0).getDescription())
                .isEqualTo("Switch with 3 cases selecting behavior suggests Strategy pattern");
    }
}
