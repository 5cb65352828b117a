package org.carball.advisor.analyzer.detector;

import org.carball.advisor.analyzer.FileAnalyzer;
import org.carball.advisor.config.DetectionThresholds;
import org.carball.advisor.knowledge.BuiltinPatterns;
import org.carball.advisor.knowledge.KnowledgeBase;
import org.carball.advisor.knowledge.PatternConfidence;
import org.carball.advisor.model.opportunity.Estimate;
import org.carball.advisor.model.opportunity.OpportunityType;
import org.carball.advisor.model.opportunity.PatternOpportunity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class CommandDetectorTest {

    private FileAnalyzer analyzer;

    @BeforeEach
    public void setUp() {
        KnowledgeBase knowledgeBase = BuiltinPatterns.createDefault();
        analyzer = new FileAnalyzer(knowledgeBase, DetectionThresholds.createDefaults(knowledgeBase),
                List.of(new CommandDetector()));
    }

    @Test
    public void shouldFlagExecuteStoringState() {
        // Given
        String code = """
            public class BackupTask {
                private long lastRun;
                private int attempts;

                public void execute() {
                    this.lastRun = System.currentTimeMillis();
                    attempts = attempts + 1;
                }
            }
            """;

        // When
        List<PatternOpportunity> opportunities = analyzer.analyzeSource(code, "BackupTask.java");

        // Then
        assertThat(opportunities).hasSize(1);
        PatternOpportunity opportunity = opportunities.get(0);
        assertThat(opportunity.getPatternName()).isEqualTo("command");
        assertThat(opportunity.getOpportunityType()).isEqualTo(OpportunityType.OPTIMIZATION_OPPORTUNITY);
        assertThat(opportunity.getConfidence()).isEqualTo(PatternConfidence.LOW);
        assertThat(opportunity.getEstimatedEffort()).isEqualTo(Estimate.MEDIUM);
        assertThat(opportunity.getImpact()).isEqualTo(Estimate.LOW);
        assertThat(opportunity.getLineNumber()).isEqualTo(5);
        assertThat(opportunity.getDescription()).isEqualTo("Method execute stores state - consider Command pattern");
    }

    @Test
    public void shouldMatchNamesContainingExecutionVerb() {
        String code = """
            public class Migration {
                private boolean applied;

                public void runMigration() {
                    applied = true;
                }
            }
            """;

        assertThat(analyzer.analyzeSource(code, "Migration.java")).hasSize(1);
    }

    @Test
    public void shouldIgnoreLocalAssignments() {
        String code = """
            public class Calculation {
                public int perform(int input) {
                    int result;
                    result = input * 2;
                    return result;
                }
            }
            """;

        assertThat(analyzer.analyzeSource(code, "Calculation.java")).isEmpty();
    }

    @Test
    public void shouldIgnoreNonExecutionMethods() {
        String code = """
            public class Counter {
                private int value;

                public void increment() {
                    this.value = value + 1;
                }
            }
            """;

        assertThat(analyzer.analyzeSource(code, "Counter.java")).isEmpty();
    }

    @Test
    public void shouldIgnoreAssignmentsInsideNestedClasses() {
        String code = """
            public class Scheduler {
                public void execute() {
                    Callback callback = new Callback() {
                        private int last;

                        @Override
                        public void accept(int value) {
                            this.last = value;
                        }
                    };
                    callback.accept(1);
                }
            }
            """;

        assertThat(analyzer.analyzeSource(code, "Scheduler.java")).isEmpty();
    }
}
