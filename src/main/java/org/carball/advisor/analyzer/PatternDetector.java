package org.carball.advisor.analyzer;

import com.github.javaparser.ast.Node;

import java.util.Set;

/**
 * A single rule applied during the file walk. Detectors are stateless; all
 * per-file context lives in the {@link AnalyzerState} they are handed.
 */
public interface PatternDetector {

    /**
     * Knowledge base key of the pattern this detector reports.
     */
    String patternName();

    Set<NodeKind> nodeKinds();

    void inspect(Node node, NodeKind kind, AnalyzerState state);
}
