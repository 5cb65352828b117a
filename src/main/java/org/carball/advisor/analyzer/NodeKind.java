package org.carball.advisor.analyzer;

import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchStmt;

import java.util.Optional;

/**
 * The syntax node kinds the file walk dispatches on. Every other node is
 * traversed without dispatch.
 */
public enum NodeKind {
    IMPORT(ImportDeclaration.class),
    TYPE(ClassOrInterfaceDeclaration.class),
    CONSTRUCTOR(ConstructorDeclaration.class),
    METHOD(MethodDeclaration.class),
    CONDITIONAL(IfStmt.class),
    SWITCH(SwitchStmt.class),
    LOOP(ForEachStmt.class),
    CALL(MethodCallExpr.class);

    private final Class<? extends Node> nodeClass;

    NodeKind(Class<? extends Node> nodeClass) {
        this.nodeClass = nodeClass;
    }

    public static Optional<NodeKind> of(Node node) {
        // interfaces carry no state or construction logic worth inspecting
        if (node instanceof ClassOrInterfaceDeclaration && ((ClassOrInterfaceDeclaration) node).isInterface()) {
            return Optional.empty();
        }
        for (NodeKind kind : values()) {
            if (kind.nodeClass.isInstance(node)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
