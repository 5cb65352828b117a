package org.carball.advisor.analyzer.detector;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import org.carball.advisor.analyzer.AnalyzerState;
import org.carball.advisor.analyzer.NodeKind;
import org.carball.advisor.analyzer.PatternDetector;
import org.carball.advisor.knowledge.BuiltinPatterns;
import org.carball.advisor.knowledge.PatternConfidence;
import org.carball.advisor.model.opportunity.Estimate;
import org.carball.advisor.model.opportunity.OpportunityType;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Creation logic spread over type checks, and methods that already act as
 * informal factories.
 */
public class FactoryDetector implements PatternDetector {

    private static final List<String> CREATION_NAMES = List.of("create", "factory");

    @Override
    public String patternName() {
        return BuiltinPatterns.FACTORY;
    }

    @Override
    public Set<NodeKind> nodeKinds() {
        return EnumSet.of(NodeKind.CONDITIONAL, NodeKind.METHOD);
    }

    @Override
    public void inspect(Node node, NodeKind kind, AnalyzerState state) {
        if (kind == NodeKind.CONDITIONAL) {
            ConditionalChain.fromHead((IfStmt) node)
                    .ifPresent(chain -> inspectChain(chain, state));
        } else {
            inspectMethod((MethodDeclaration) node, state);
        }
    }

    private void inspectChain(ConditionalChain chain, AnalyzerState state) {
        if (chain.length() < state.getThresholds().getFactoryTypeCheckBranches() || !chain.hasTypeCheck()) {
            return;
        }

        state.report(state.opportunityAt(patternName(), chain.head())
                .opportunityType(OpportunityType.REFACTOR_TO_PATTERN)
                .confidence(PatternConfidence.MEDIUM)
                .description("Type-based conditionals suggest Factory pattern")
                .suggestedImprovement("Use Factory pattern to encapsulate object creation logic")
                .reasoning("Multiple instanceof checks indicate object creation based on type")
                .estimatedEffort(Estimate.MEDIUM)
                .impact(Estimate.MEDIUM)
                .build());
    }

    private void inspectMethod(MethodDeclaration method, AnalyzerState state) {
        List<Expression> returned = Scopes.findOwned(method, ReturnStmt.class).stream()
                .map(ReturnStmt::getExpression)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());

        long creatingReturns = returned.stream()
                .filter(e -> e.isMethodCallExpr() || e.isObjectCreationExpr())
                .count();
        Set<String> createdTypes = returned.stream()
                .filter(Expression::isObjectCreationExpr)
                .map(e -> e.asObjectCreationExpr().getType().getNameAsString())
                .collect(Collectors.toSet());

        String name = method.getNameAsString();
        boolean namedFactory = Keywords.containsAny(name, CREATION_NAMES)
                && creatingReturns >= state.getThresholds().getFactoryCreationReturns();
        boolean returnsSeveralTypes = createdTypes.size() >= state.getThresholds().getFactoryDistinctTypes();

        if (!namedFactory && !returnsSeveralTypes) {
            return;
        }

        String reasoning = returnsSeveralTypes
                ? String.format("Method returns %d different types, suggesting factory behavior", createdTypes.size())
                : String.format("Method name and %d creating return statements suggest factory behavior", creatingReturns);

        state.report(state.opportunityAt(patternName(), method)
                .opportunityType(OpportunityType.OPTIMIZATION_OPPORTUNITY)
                .confidence(PatternConfidence.MEDIUM)
                .description(String.format("Method %s returns multiple types - consider Factory pattern", name))
                .suggestedImprovement("Formalize as Factory pattern with clear interface")
                .reasoning(reasoning)
                .estimatedEffort(Estimate.LOW)
                .impact(Estimate.LOW)
                .build());
    }
}
