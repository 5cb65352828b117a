package org.carball.advisor.analyzer.detector;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import org.carball.advisor.analyzer.AnalyzerState;
import org.carball.advisor.analyzer.NodeKind;
import org.carball.advisor.analyzer.PatternDetector;
import org.carball.advisor.knowledge.BuiltinPatterns;
import org.carball.advisor.knowledge.PatternConfidence;
import org.carball.advisor.model.opportunity.Estimate;
import org.carball.advisor.model.opportunity.OpportunityType;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Data-access calls made directly from classes that are not themselves a
 * repository or DAO.
 */
public class RepositoryDetector implements PatternDetector {

    private static final Set<String> DATA_ACCESS_PACKAGES = Set.of(
            "java.sql", "javax.persistence", "jakarta.persistence", "org.springframework.jdbc");

    private static final Set<String> DATA_ACCESS_CALLS = Set.of(
            "executeQuery", "executeUpdate", "prepareStatement", "createQuery", "createNativeQuery",
            "query", "update", "persist", "merge", "find");

    @Override
    public String patternName() {
        return BuiltinPatterns.REPOSITORY;
    }

    @Override
    public Set<NodeKind> nodeKinds() {
        return EnumSet.of(NodeKind.TYPE);
    }

    @Override
    public void inspect(Node node, NodeKind kind, AnalyzerState state) {
        ClassOrInterfaceDeclaration type = (ClassOrInterfaceDeclaration) node;
        String name = type.getNameAsString().toLowerCase(Locale.ROOT);
        if (name.endsWith("repository") || name.endsWith("dao") || !state.importsAnyOf(DATA_ACCESS_PACKAGES)) {
            return;
        }

        // nested types are inspected on their own
        long dataAccessCalls = type.findAll(MethodCallExpr.class).stream()
                .filter(call -> call.findAncestor(ClassOrInterfaceDeclaration.class).filter(t -> t == type).isPresent())
                .filter(call -> DATA_ACCESS_CALLS.contains(call.getNameAsString()))
                .count();
        if (dataAccessCalls < state.getThresholds().getRepositoryDataAccessCalls()) {
            return;
        }

        state.report(state.opportunityAt(patternName(), type)
                .opportunityType(OpportunityType.REFACTOR_TO_PATTERN)
                .confidence(PatternConfidence.LOW)
                .description("Class " + type.getNameAsString() + " mixes data access with other logic")
                .suggestedImprovement("Move queries behind a Repository interface")
                .reasoning(String.format("%d direct data-access calls outside a repository or DAO class",
                        dataAccessCalls))
                .estimatedEffort(Estimate.HIGH)
                .impact(Estimate.HIGH)
                .build());
    }
}
