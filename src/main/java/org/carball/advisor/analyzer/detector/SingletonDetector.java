package org.carball.advisor.analyzer.detector;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import org.carball.advisor.analyzer.AnalyzerState;
import org.carball.advisor.analyzer.NodeKind;
import org.carball.advisor.analyzer.PatternDetector;
import org.carball.advisor.knowledge.BuiltinPatterns;
import org.carball.advisor.knowledge.PatternConfidence;
import org.carball.advisor.model.opportunity.Estimate;
import org.carball.advisor.model.opportunity.OpportunityType;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Flags singletons applied to data models, and shared-resource classes that
 * are not singletons yet.
 */
public class SingletonDetector implements PatternDetector {

    static final Set<String> INSTANCE_FIELD_NAMES = Set.of("instance", "_instance", "INSTANCE", "singleton", "SINGLETON");

    static final List<String> DATA_MODEL_NAMES = List.of(
            "user", "product", "order", "customer", "item", "model",
            "entity", "record", "data", "person", "account", "invoice");

    static final List<String> SHARED_RESOURCE_NAMES = List.of(
            "database", "connection", "config", "settings", "logger",
            "cache", "registry", "manager", "service", "client");

    @Override
    public String patternName() {
        return BuiltinPatterns.SINGLETON;
    }

    @Override
    public Set<NodeKind> nodeKinds() {
        return EnumSet.of(NodeKind.TYPE);
    }

    @Override
    public void inspect(Node node, NodeKind kind, AnalyzerState state) {
        ClassOrInterfaceDeclaration type = (ClassOrInterfaceDeclaration) node;
        String name = type.getNameAsString();

        if (hasPrivateConstructor(type) && hasInstanceField(type)) {
            if (Keywords.containsAny(name, DATA_MODEL_NAMES)) {
                state.report(state.opportunityAt(patternName(), type)
                        .opportunityType(OpportunityType.ANTI_PATTERN_DETECTED)
                        .confidence(PatternConfidence.CRITICAL)
                        .description("Anti-pattern: " + name + " should not be a singleton")
                        .suggestedImprovement("Convert to regular class - data models should have multiple instances")
                        .reasoning("Data models (User, Product, Order, etc.) should not be singletons "
                                + "as you need multiple instances")
                        .estimatedEffort(Estimate.LOW)
                        .impact(Estimate.HIGH)
                        .build());
            }
            return;
        }

        if (Keywords.containsAny(name, SHARED_RESOURCE_NAMES)) {
            state.report(state.opportunityAt(patternName(), type)
                    .opportunityType(OpportunityType.REFACTOR_TO_PATTERN)
                    .confidence(PatternConfidence.MEDIUM)
                    .description(name + " could benefit from singleton pattern")
                    .suggestedImprovement("Implement singleton pattern with thread-safe instance control")
                    .reasoning("Classes like DatabaseConnection, ConfigManager, Logger often benefit from singleton")
                    .estimatedEffort(Estimate.MEDIUM)
                    .impact(Estimate.MEDIUM)
                    .build());
        }
    }

    private boolean hasPrivateConstructor(ClassOrInterfaceDeclaration type) {
        return type.getConstructors().stream().anyMatch(ConstructorDeclaration::isPrivate);
    }

    private boolean hasInstanceField(ClassOrInterfaceDeclaration type) {
        return type.getFields().stream()
                .filter(FieldDeclaration::isStatic)
                .flatMap(field -> field.getVariables().stream())
                .anyMatch(variable -> INSTANCE_FIELD_NAMES.contains(variable.getNameAsString()));
    }
}
