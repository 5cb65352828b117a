package org.carball.advisor.analyzer.detector;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import org.carball.advisor.analyzer.AnalyzerState;
import org.carball.advisor.analyzer.NodeKind;
import org.carball.advisor.analyzer.PatternDetector;
import org.carball.advisor.knowledge.BuiltinPatterns;
import org.carball.advisor.knowledge.PatternConfidence;
import org.carball.advisor.model.opportunity.Estimate;
import org.carball.advisor.model.opportunity.OpportunityType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Execution-style methods that also record state on their object.
 */
public class CommandDetector implements PatternDetector {

    private static final List<String> EXECUTION_NAMES = List.of("execute", "run", "perform", "do");

    @Override
    public String patternName() {
        return BuiltinPatterns.COMMAND;
    }

    @Override
    public Set<NodeKind> nodeKinds() {
        return EnumSet.of(NodeKind.METHOD);
    }

    @Override
    public void inspect(Node node, NodeKind kind, AnalyzerState state) {
        MethodDeclaration method = (MethodDeclaration) node;
        String name = method.getNameAsString();
        if (!Keywords.containsAny(name, EXECUTION_NAMES)) {
            return;
        }

        Set<String> instanceFields = state.currentType()
                .map(this::instanceFieldNames)
                .orElse(Collections.emptySet());
        boolean storesState = Scopes.findOwned(method, AssignExpr.class).stream()
                .map(AssignExpr::getTarget)
                .anyMatch(target -> isInstanceState(target, instanceFields));
        if (!storesState) {
            return;
        }

        state.report(state.opportunityAt(patternName(), method)
                .opportunityType(OpportunityType.OPTIMIZATION_OPPORTUNITY)
                .confidence(PatternConfidence.LOW)
                .description("Method " + name + " stores state - consider Command pattern")
                .suggestedImprovement("Consider Command pattern if undo/redo or queuing needed")
                .reasoning("Method stores state and has execution-like name - possible command")
                .estimatedEffort(Estimate.MEDIUM)
                .impact(Estimate.LOW)
                .build());
    }

    private Set<String> instanceFieldNames(ClassOrInterfaceDeclaration type) {
        return type.getFields().stream()
                .filter(field -> !field.isStatic())
                .flatMap(field -> field.getVariables().stream())
                .map(variable -> variable.getNameAsString())
                .collect(Collectors.toSet());
    }

    private boolean isInstanceState(Expression target, Set<String> instanceFields) {
        if (target.isFieldAccessExpr()) {
            return target.asFieldAccessExpr().getScope().isThisExpr();
        }
        return target.isNameExpr() && instanceFields.contains(target.asNameExpr().getNameAsString());
    }
}
