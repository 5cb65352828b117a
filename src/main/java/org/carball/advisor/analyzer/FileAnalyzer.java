package org.carball.advisor.analyzer;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import lombok.extern.slf4j.Slf4j;
import org.carball.advisor.analyzer.detector.AdapterDetector;
import org.carball.advisor.analyzer.detector.BuilderDetector;
import org.carball.advisor.analyzer.detector.CommandDetector;
import org.carball.advisor.analyzer.detector.FactoryDetector;
import org.carball.advisor.analyzer.detector.ObserverDetector;
import org.carball.advisor.analyzer.detector.RepositoryDetector;
import org.carball.advisor.analyzer.detector.SingletonDetector;
import org.carball.advisor.analyzer.detector.StrategyDetector;
import org.carball.advisor.config.DetectionThresholds;
import org.carball.advisor.knowledge.KnowledgeBase;
import org.carball.advisor.model.opportunity.PatternOpportunity;
import org.carball.advisor.parser.SourceParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs every registered detector over one source file in a single
 * depth-first walk.
 */
@Slf4j
public class FileAnalyzer {

    private static final Comparator<Node> SOURCE_ORDER = Comparator.comparing(
            (Node n) -> n.getBegin().orElse(null), Comparator.nullsLast(Comparator.<Position>naturalOrder()));

    private final KnowledgeBase knowledgeBase;
    private final DetectionThresholds thresholds;
    private final SourceParser parser;
    private final Map<NodeKind, List<PatternDetector>> dispatch = new EnumMap<>(NodeKind.class);

    public FileAnalyzer(KnowledgeBase knowledgeBase, DetectionThresholds thresholds) {
        this(knowledgeBase, thresholds, defaultDetectors());
    }

    public FileAnalyzer(KnowledgeBase knowledgeBase, DetectionThresholds thresholds, List<PatternDetector> detectors) {
        this.knowledgeBase = knowledgeBase;
        this.thresholds = thresholds;
        this.parser = new SourceParser();

        for (NodeKind kind : NodeKind.values()) {
            dispatch.put(kind, new ArrayList<>());
        }
        for (PatternDetector detector : detectors) {
            knowledgeBase.requirePattern(detector.patternName());
            detector.nodeKinds().forEach(kind -> dispatch.get(kind).add(detector));
        }
    }

    public static List<PatternDetector> defaultDetectors() {
        return List.of(
                new SingletonDetector(),
                new BuilderDetector(),
                new StrategyDetector(),
                new FactoryDetector(),
                new ObserverDetector(),
                new AdapterDetector(),
                new CommandDetector(),
                new RepositoryDetector()
        );
    }

    /**
     * Findings for one parsed file, highest priority first. Ties keep the
     * order in which the walk found them.
     */
    public List<PatternOpportunity> analyze(CompilationUnit compilationUnit, String filePath) {
        AnalyzerState state = new AnalyzerState(filePath, knowledgeBase, thresholds);
        walk(compilationUnit, state);

        List<PatternOpportunity> opportunities = new ArrayList<>(state.getOpportunities());
        opportunities.sort(Comparator.comparingDouble(PatternOpportunity::getPriorityScore).reversed());
        return opportunities;
    }

    public List<PatternOpportunity> analyzeSource(String source, String filePath) {
        return parser.parse(source, filePath)
                .map(cu -> analyze(cu, filePath))
                .orElseGet(List::of);
    }

    public List<PatternOpportunity> analyzeFile(Path file) {
        return analyzeFile(file, file.toString());
    }

    /**
     * Reads and analyzes {@code file}, reporting findings under
     * {@code displayPath}. Unreadable files yield no findings.
     */
    public List<PatternOpportunity> analyzeFile(Path file, String displayPath) {
        String source;
        try {
            source = Files.readString(file);
        } catch (IOException e) {
            log.warn("Error reading file: {} - {}", file, e.getMessage());
            return List.of();
        }
        return analyzeSource(source, displayPath);
    }

    private void walk(Node node, AnalyzerState state) {
        Optional<NodeKind> kind = NodeKind.of(node);
        kind.ifPresent(k -> dispatch.get(k).forEach(detector -> detector.inspect(node, k, state)));

        if (node instanceof ImportDeclaration) {
            state.addImport(((ImportDeclaration) node).getNameAsString());
            return;
        }

        boolean entersType = kind.filter(k -> k == NodeKind.TYPE).isPresent();
        boolean entersFunction = kind.filter(k -> k == NodeKind.CONSTRUCTOR || k == NodeKind.METHOD).isPresent();

        ClassOrInterfaceDeclaration previousType = entersType
                ? state.enterType((ClassOrInterfaceDeclaration) node) : null;
        CallableDeclaration<?> previousFunction = entersFunction
                ? state.enterFunction((CallableDeclaration<?>) node) : null;

        List<Node> children = new ArrayList<>(node.getChildNodes());
        children.sort(SOURCE_ORDER);
        for (Node child : children) {
            walk(child, state);
        }

        if (entersFunction) {
            state.exitFunction(previousFunction);
        }
        if (entersType) {
            state.exitType(previousType);
        }
    }
}
