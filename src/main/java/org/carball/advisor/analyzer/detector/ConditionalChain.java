package org.carball.advisor.analyzer.detector;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * An {@code if / else if} chain viewed from its head. Nested {@code else if}
 * statements are not chains of their own.
 */
final class ConditionalChain {

    private final IfStmt head;
    private final List<IfStmt> branches;

    private ConditionalChain(IfStmt head, List<IfStmt> branches) {
        this.head = head;
        this.branches = branches;
    }

    static Optional<ConditionalChain> fromHead(IfStmt statement) {
        if (isElseIf(statement)) {
            return Optional.empty();
        }

        List<IfStmt> branches = new ArrayList<>();
        IfStmt current = statement;
        branches.add(current);
        while (current.getElseStmt().filter(Statement::isIfStmt).isPresent()) {
            current = current.getElseStmt().get().asIfStmt();
            branches.add(current);
        }
        return Optional.of(new ConditionalChain(statement, branches));
    }

    private static boolean isElseIf(IfStmt statement) {
        Optional<Node> parent = statement.getParentNode();
        return parent.isPresent()
                && parent.get() instanceof IfStmt
                && ((IfStmt) parent.get()).getElseStmt().filter(e -> e == statement).isPresent();
    }

    IfStmt head() {
        return head;
    }

    int length() {
        return branches.size();
    }

    boolean hasTypeCheck() {
        return branches.stream()
                .anyMatch(branch -> branch.getCondition().findFirst(InstanceOfExpr.class).isPresent());
    }

    /**
     * Names of every method called and every type instantiated anywhere in
     * the chain, conditions and trailing {@code else} included.
     */
    Set<String> invokedNames() {
        return invokedNames(head);
    }

    static Set<String> invokedNames(Node scope) {
        Set<String> names = new LinkedHashSet<>();
        scope.findAll(MethodCallExpr.class).forEach(call -> names.add(call.getNameAsString()));
        scope.findAll(ObjectCreationExpr.class).forEach(creation -> names.add(creation.getType().getNameAsString()));
        return names;
    }
}
