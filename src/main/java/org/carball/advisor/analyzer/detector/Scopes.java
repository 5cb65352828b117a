package org.carball.advisor.analyzer.detector;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.expr.LambdaExpr;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

final class Scopes {

    private Scopes() {
    }

    /**
     * Nodes of {@code type} below {@code owner} that are not inside a nested
     * method, constructor, lambda or class body.
     */
    static <T extends Node> List<T> findOwned(Node owner, Class<T> type) {
        return owner.findAll(type).stream()
                .filter(node -> isOwnedBy(node, owner))
                .collect(Collectors.toList());
    }

    static boolean isOwnedBy(Node node, Node owner) {
        Optional<Node> parent = node.getParentNode();
        while (parent.isPresent()) {
            Node current = parent.get();
            if (current == owner) {
                return true;
            }
            // members of anonymous and local classes are judged on their own
            if (current instanceof BodyDeclaration || current instanceof LambdaExpr) {
                return false;
            }
            parent = current.getParentNode();
        }
        return false;
    }
}
