package org.carball.advisor.analyzer.detector;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import org.carball.advisor.analyzer.AnalyzerState;
import org.carball.advisor.analyzer.NodeKind;
import org.carball.advisor.analyzer.PatternDetector;
import org.carball.advisor.config.DetectionThresholds;
import org.carball.advisor.knowledge.BuiltinPatterns;
import org.carball.advisor.knowledge.PatternConfidence;
import org.carball.advisor.model.opportunity.Estimate;
import org.carball.advisor.model.opportunity.OpportunityType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Constructors with long parameter lists.
 */
public class BuilderDetector implements PatternDetector {

    @Override
    public String patternName() {
        return BuiltinPatterns.BUILDER;
    }

    @Override
    public Set<NodeKind> nodeKinds() {
        return EnumSet.of(NodeKind.CONSTRUCTOR);
    }

    @Override
    public void inspect(Node node, NodeKind kind, AnalyzerState state) {
        ConstructorDeclaration constructor = (ConstructorDeclaration) node;
        DetectionThresholds thresholds = state.getThresholds();
        int paramCount = constructor.getParameters().size();

        if (paramCount < thresholds.getBuilderMinParameters()) {
            return;
        }

        long optionalParams = constructor.getParameters().stream()
                .filter(this::isOptional)
                .count();

        PatternConfidence confidence = paramCount >= thresholds.getBuilderHighConfidenceParameters()
                ? PatternConfidence.HIGH : PatternConfidence.MEDIUM;
        Estimate effort = paramCount >= thresholds.getBuilderHighEffortParameters()
                ? Estimate.HIGH : Estimate.MEDIUM;

        state.report(state.opportunityAt(patternName(), constructor)
                .opportunityType(OpportunityType.REFACTOR_TO_PATTERN)
                .confidence(confidence)
                .description(String.format("Constructor with %d parameters could benefit from Builder pattern",
                        paramCount))
                .suggestedImprovement("Implement Builder pattern for more readable object construction")
                .reasoning(String.format("Constructor has %d parameters (%d optional). Builder pattern threshold: %d+ parameters",
                        paramCount, optionalParams, thresholds.getBuilderMinParameters()))
                .estimatedEffort(effort)
                .impact(Estimate.MEDIUM)
                .build());
    }

    private boolean isOptional(Parameter parameter) {
        if (parameter.isVarArgs()) {
            return true;
        }
        return parameter.getType() instanceof ClassOrInterfaceType
                && ((ClassOrInterfaceType) parameter.getType()).getNameAsString().equals("Optional");
    }
}
