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

public class FactoryDetectorTest {

    private KnowledgeBase knowledgeBase;
    private FileAnalyzer analyzer;

    @BeforeEach
    public void setUp() {
        knowledgeBase = BuiltinPatterns.createDefault();
        analyzer = new FileAnalyzer(knowledgeBase, DetectionThresholds.createDefaults(knowledgeBase),
                List.of(new FactoryDetector()));
    }

    @Test
    public void shouldFlagTypeCheckChain() {
        // Given
        String code = """
            public class ShapeRenderer {
                public void render(Object shape) {
                    if (shape instanceof Circle) {
                        drawCircle((Circle) shape);
                    } else if (shape instanceof Square) {
                        drawSquare((Square) shape);
                    }
                }
            }
            """;

        // When
        List<PatternOpportunity> opportunities = analyzer.analyzeSource(code, "ShapeRenderer.java");

        // Then
        assertThat(opportunities).hasSize(1);
        PatternOpportunity opportunity = opportunities.get(0);
        assertThat(opportunity.getPatternName()).isEqualTo("factory");
        assertThat(opportunity.getOpportunityType()).isEqualTo(OpportunityType.REFACTOR_TO_PATTERN);
        assertThat(opportunity.getConfidence()).isEqualTo(PatternConfidence.MEDIUM);
        assertThat(opportunity.getDescription()).isEqualTo("Type-based conditionals suggest Factory pattern");
        assertThat(opportunity.getLineNumber()).isEqualTo(3);
    }

    @Test
    public void shouldIgnoreChainWithoutTypeChecks() {
        String code = """
            public class Thermostat {
                public void adjust(int temperature) {
                    if (temperature > 25) {
                        cool();
                    } else if (temperature < 18) {
                        heat();
                    }
                }
            }
            """;

        assertThat(analyzer.analyzeSource(code, "Thermostat.java")).isEmpty();
    }

    @Test
    public void shouldFlagInformalFactoryMethod() {
        // Given
        String code = """
            public class ParserFactory {
                public Parser createParser(String type) {
                    if ("json".equals(type)) {
                        return new JsonParser();
                    }
                    return new XmlParser();
                }
            }
            """;

        // When
        List<PatternOpportunity> opportunities = analyzer.analyzeSource(code, "ParserFactory.java");

        // Then
        assertThat(opportunities).hasSize(1);
        PatternOpportunity opportunity = opportunities.get(0);
        assertThat(opportunity.getOpportunityType()).isEqualTo(OpportunityType.OPTIMIZATION_OPPORTUNITY);
        assertThat(opportunity.getEstimatedEffort()).isEqualTo(Estimate.LOW);
        assertThat(opportunity.getImpact()).isEqualTo(Estimate.LOW);
        assertThat(opportunity.getDescription())
                .isEqualTo("Method createParser returns multiple types - consider Factory pattern");
    }

    @Test
    public void shouldFlagAnyMethodReturningDifferentTypes() {
        String code = """
            public class Shelter {
                public Animal adopt(boolean barks) {
                    if (barks) {
                        return new Dog();
                    }
                    return new Cat();
                }
            }
            """;

        List<PatternOpportunity> opportunities = analyzer.analyzeSource(code, "Shelter.java");

        assertThat(opportunities).hasSize(1);
        assertThat(opportunities.get(0).getReasoning())
                .isEqualTo("Method returns 2 different types, suggesting factory behavior");
    }

    @Test
    public void shouldIgnoreMethodReturningSameTypeTwice() {
        String code = """
            public class WidgetShop {
                public Widget pick(boolean large) {
                    if (large) {
                        return new Widget(10);
                    }
                    return new Widget(1);
                }
            }
            """;

        assertThat(analyzer.analyzeSource(code, "WidgetShop.java")).isEmpty();
    }

    @Test
    public void shouldCreditNestedReturnsToTheirOwnMethod() {
        // Given
        String code = """
            import java.util.function.Supplier;

            public class ShapeSupplier {
                public Supplier<Shape> supplier(boolean round) {
                    return new Supplier<Shape>() {
                        @Override
                        public Shape get() {
                            if (round) {
                                return new Circle();
                            }
                            return new Square();
                        }
                    };
                }
            }
            """;

        // When
        List<PatternOpportunity> opportunities = analyzer.analyzeSource(code, "ShapeSupplier.java");

        // Then
        assertThat(opportunities).hasSize(1);
        assertThat(opportunities.get(0).getDescription())
                .isEqualTo("Method get returns multiple types - consider Factory pattern");
        assertThat(opportunities.get(0).getReasoning())
                .isEqualTo("Method returns 2 different types, suggesting factory behavior");
    }

    @Test
    public void shouldIgnoreReturnsInsideLambdas() {
        String code = """
            import java.util.function.Supplier;

            public class PetSupplier {
                public Supplier<Pet> createSupplier(boolean barks) {
                    return () -> {
                        if (barks) {
                            return new Dog();
                        }
                        return new Cat();
                    };
                }
            }
            """;

        assertThat(analyzer.analyzeSource(code, "PetSupplier.java")).isEmpty();
    }

    @Test
    public void shouldHonorConfiguredDistinctTypeThreshold() {
        // Given
        DetectionThresholds thresholds = DetectionThresholds.createDefaults(knowledgeBase);
        thresholds.setFactoryDistinctTypes(3);
        FileAnalyzer strictAnalyzer = new FileAnalyzer(knowledgeBase, thresholds, List.of(new FactoryDetector()));
        String code = """
            public class Shelter {
                public Animal adopt(boolean barks) {
                    if (barks) {
                        return new Dog();
                    }
                    return new Cat();
                }
            }
            """;

        // When / Then
        assertThat(strictAnalyzer.analyzeSource(code, "Shelter.java")).isEmpty();
        assertThat(analyzer.analyzeSource(code, "Shelter.java")).hasSize(1);
    }

    @Test
    public void shouldReportAnnotatedMethodAtItsName() {
        String code = """
            public class Shelter {
                @Override
                @SuppressWarnings("unchecked")
                public Animal adopt(boolean barks) {
                    if (barks) {
                        return new Dog();
                    }
                    return new Cat();
                }
            }
            """;

        List<PatternOpportunity> opportunities = analyzer.analyzeSource(code, "Shelter.java");

        assertThat(opportunities).hasSize(1);
        assertThat(opportunities.get(0).getLineNumber()).isEqualTo(4);
        assertThat(opportunities.get(0).getCodeSnippet()).isEqualTo("public Animal adopt(boolean barks) {");
    }
}
