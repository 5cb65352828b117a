package org.carball.advisor.analyzer.detector;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.stmt.ForEachStmt;
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

/**
 * Hand-written notification loops: iterating a listener collection and
 * calling a callback on each element.
 */
public class ObserverDetector implements PatternDetector {

    private static final List<String> COLLECTION_NAMES = List.of("observer", "listener", "subscriber", "notification");
    private static final List<String> CALLBACK_NAMES = List.of("update", "notify", "handle");

    @Override
    public String patternName() {
        return BuiltinPatterns.OBSERVER;
    }

    @Override
    public Set<NodeKind> nodeKinds() {
        return EnumSet.of(NodeKind.LOOP, NodeKind.CALL);
    }

    @Override
    public void inspect(Node node, NodeKind kind, AnalyzerState state) {
        if (kind == NodeKind.LOOP) {
            ForEachStmt loop = (ForEachStmt) node;
            Optional<String> collection = collectionName(loop.getIterable());
            if (collection.isPresent() && callsCallback(loop.getBody())) {
                report(loop, collection.get(), state);
            }
            return;
        }

        MethodCallExpr call = (MethodCallExpr) node;
        if (!call.getNameAsString().equals("forEach") || call.getArguments().size() != 1) {
            return;
        }
        Optional<String> collection = call.getScope().flatMap(this::collectionName);
        Expression action = call.getArgument(0);
        boolean notifies = action.isMethodReferenceExpr()
                ? isCallback(((MethodReferenceExpr) action).getIdentifier())
                : action.isLambdaExpr() && callsCallback(action.asLambdaExpr().getBody());
        if (collection.isPresent() && notifies) {
            report(call, collection.get(), state);
        }
    }

    private void report(Node loop, String collection, AnalyzerState state) {
        state.report(state.opportunityAt(patternName(), loop)
                .opportunityType(OpportunityType.REFACTOR_TO_PATTERN)
                .confidence(PatternConfidence.MEDIUM)
                .description("Manual observer notification loop detected")
                .suggestedImprovement("Implement formal Observer pattern with subscription management")
                .reasoning("Loop over " + collection + " with notification calls suggests need for Observer pattern")
                .estimatedEffort(Estimate.LOW)
                .impact(Estimate.MEDIUM)
                .build());
    }

    private Optional<String> collectionName(Expression iterable) {
        String name;
        if (iterable.isNameExpr()) {
            name = iterable.asNameExpr().getNameAsString();
        } else if (iterable.isFieldAccessExpr()) {
            name = iterable.asFieldAccessExpr().getNameAsString();
        } else {
            return Optional.empty();
        }
        return Keywords.containsAny(name, COLLECTION_NAMES) ? Optional.of(name) : Optional.empty();
    }

    private boolean callsCallback(Node body) {
        return Scopes.findOwned(body, MethodCallExpr.class).stream()
                .anyMatch(call -> isCallback(call.getNameAsString()));
    }

    static boolean isCallback(String methodName) {
        if (Keywords.containsAny(methodName, CALLBACK_NAMES)) {
            return true;
        }
        return methodName.length() > 2
                && methodName.startsWith("on")
                && (Character.isUpperCase(methodName.charAt(2)) || methodName.charAt(2) == '_');
    }
}
