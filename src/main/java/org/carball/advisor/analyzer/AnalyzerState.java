package org.carball.advisor.analyzer;

import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.advisor.config.DetectionThresholds;
import org.carball.advisor.knowledge.KnowledgeBase;
import org.carball.advisor.model.opportunity.PatternOpportunity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Context threaded through one file walk: enclosing declarations, imports
 * seen so far and the findings collected. One instance per file.
 */
@Slf4j
public class AnalyzerState {

    private static final int MAX_SNIPPET_LENGTH = 120;

    @Getter
    private final String filePath;
    @Getter
    private final DetectionThresholds thresholds;
    private final KnowledgeBase knowledgeBase;
    private final Set<String> imports = new LinkedHashSet<>();
    private final List<PatternOpportunity> opportunities = new ArrayList<>();

    private ClassOrInterfaceDeclaration currentType;
    private CallableDeclaration<?> currentFunction;

    public AnalyzerState(String filePath, KnowledgeBase knowledgeBase, DetectionThresholds thresholds) {
        this.filePath = filePath;
        this.knowledgeBase = knowledgeBase;
        this.thresholds = thresholds;
    }

    public Optional<ClassOrInterfaceDeclaration> currentType() {
        return Optional.ofNullable(currentType);
    }

    public Optional<CallableDeclaration<?>> currentFunction() {
        return Optional.ofNullable(currentFunction);
    }

    ClassOrInterfaceDeclaration enterType(ClassOrInterfaceDeclaration type) {
        ClassOrInterfaceDeclaration previous = currentType;
        currentType = type;
        return previous;
    }

    void exitType(ClassOrInterfaceDeclaration previous) {
        currentType = previous;
    }

    CallableDeclaration<?> enterFunction(CallableDeclaration<?> function) {
        CallableDeclaration<?> previous = currentFunction;
        currentFunction = function;
        return previous;
    }

    void exitFunction(CallableDeclaration<?> previous) {
        currentFunction = previous;
    }

    void addImport(String name) {
        imports.add(name);
    }

    public boolean importsAnyOf(Set<String> packagePrefixes) {
        return imports.stream().anyMatch(name -> packagePrefixes.stream()
                .anyMatch(prefix -> name.equals(prefix) || name.startsWith(prefix + ".")));
    }

    /**
     * Starts a finding located at {@code node}, with file, lines and snippet
     * filled in. Type and method declarations are located at their name, so
     * leading annotations do not shift the reported line.
     */
    public PatternOpportunity.PatternOpportunityBuilder opportunityAt(String patternName, Node node) {
        int beginLine = node.getBegin().map(p -> p.line).orElse(0);
        int line = declaredNameLine(node).orElse(beginLine);
        return PatternOpportunity.builder()
                .patternName(patternName)
                .filePath(filePath)
                .lineNumber(line)
                .endLineNumber(node.getEnd().map(p -> p.line).orElse(null))
                .codeSnippet(snippet(node, Math.max(0, line - beginLine)));
    }

    public void report(PatternOpportunity opportunity) {
        knowledgeBase.requirePattern(opportunity.getPatternName());
        opportunities.add(opportunity);
        log.debug("Found {} opportunity in {}:{} ({})", opportunity.getPatternName(), filePath,
                opportunity.getLineNumber(), opportunity.getConfidence().getValue());
    }

    List<PatternOpportunity> getOpportunities() {
        return opportunities;
    }

    private static Optional<Integer> declaredNameLine(Node node) {
        if (node instanceof TypeDeclaration) {
            return ((TypeDeclaration<?>) node).getName().getBegin().map(p -> p.line);
        }
        if (node instanceof CallableDeclaration) {
            return ((CallableDeclaration<?>) node).getName().getBegin().map(p -> p.line);
        }
        return Optional.empty();
    }

    private static String snippet(Node node, int lineOffset) {
        String text = node.getTokenRange().map(TokenRange::toString).orElseGet(node::toString);
        String line = text.lines().skip(lineOffset).findFirst().orElse("").strip();
        return line.length() > MAX_SNIPPET_LENGTH
                ? line.substring(0, MAX_SNIPPET_LENGTH) + "..."
                : line;
    }
}
