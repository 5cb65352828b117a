package org.carball.advisor.analyzer.detector;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.type.Type;
import org.carball.advisor.analyzer.AnalyzerState;
import org.carball.advisor.analyzer.NodeKind;
import org.carball.advisor.analyzer.PatternDetector;
import org.carball.advisor.knowledge.BuiltinPatterns;
import org.carball.advisor.knowledge.PatternConfidence;
import org.carball.advisor.model.opportunity.Estimate;
import org.carball.advisor.model.opportunity.OpportunityType;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classes that receive an object in their constructor and forward calls to
 * it through a field.
 */
public class AdapterDetector implements PatternDetector {

    private static final Set<String> VALUE_TYPES = Set.of(
            "String", "Integer", "Long", "Short", "Byte", "Double", "Float", "Boolean", "Character",
            "java.lang.String", "java.lang.Integer", "java.lang.Long", "java.lang.Boolean");

    @Override
    public String patternName() {
        return BuiltinPatterns.ADAPTER;
    }

    @Override
    public Set<NodeKind> nodeKinds() {
        return EnumSet.of(NodeKind.TYPE);
    }

    @Override
    public void inspect(Node node, NodeKind kind, AnalyzerState state) {
        ClassOrInterfaceDeclaration type = (ClassOrInterfaceDeclaration) node;

        boolean takesObject = type.getConstructors().stream()
                .flatMap(constructor -> constructor.getParameters().stream())
                .map(Parameter::getType)
                .anyMatch(this::isObjectType);
        if (!takesObject) {
            return;
        }

        Set<String> fieldNames = type.getFields().stream()
                .filter(field -> !field.isStatic())
                .flatMap(field -> field.getVariables().stream())
                .map(variable -> variable.getNameAsString())
                .collect(Collectors.toSet());

        boolean delegates = type.getMethods().stream()
                .flatMap(method -> method.findAll(MethodCallExpr.class).stream())
                .anyMatch(call -> call.getScope().filter(scope -> isFieldReference(scope, fieldNames)).isPresent());
        if (!delegates) {
            return;
        }

        String name = type.getNameAsString();
        state.report(state.opportunityAt(patternName(), type)
                .opportunityType(OpportunityType.OPTIMIZATION_OPPORTUNITY)
                .confidence(PatternConfidence.LOW)
                .description("Class " + name + " shows adapter-like behavior")
                .suggestedImprovement("Consider formalizing as Adapter pattern if interfacing incompatible classes")
                .reasoning("Class takes object in constructor and delegates calls - possible adapter")
                .estimatedEffort(Estimate.LOW)
                .impact(Estimate.LOW)
                .build());
    }

    private boolean isObjectType(Type type) {
        if (!type.isClassOrInterfaceType()) {
            // primitives; arrays are containers rather than collaborators
            return false;
        }
        String name = type.asClassOrInterfaceType().getNameWithScope();
        return !VALUE_TYPES.contains(name);
    }

    private boolean isFieldReference(Expression scope, Set<String> fieldNames) {
        if (scope.isNameExpr()) {
            return fieldNames.contains(scope.asNameExpr().getNameAsString());
        }
        if (scope.isFieldAccessExpr()) {
            return scope.asFieldAccessExpr().getScope().isThisExpr()
                    && fieldNames.contains(scope.asFieldAccessExpr().getNameAsString());
        }
        return false;
    }
}
