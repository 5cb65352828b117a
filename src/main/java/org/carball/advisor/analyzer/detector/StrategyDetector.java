package org.carball.advisor.analyzer.detector;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import org.carball.advisor.analyzer.AnalyzerState;
import org.carball.advisor.analyzer.NodeKind;
import org.carball.advisor.analyzer.PatternDetector;
import org.carball.advisor.config.DetectionThresholds;
import org.carball.advisor.knowledge.BuiltinPatterns;
import org.carball.advisor.knowledge.PatternConfidence;
import org.carball.advisor.model.opportunity.Estimate;
import org.carball.advisor.model.opportunity.OpportunityType;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Long conditional chains and switches whose branches call different code,
 * which usually means one algorithm is being picked out of several.
 */
public class StrategyDetector implements PatternDetector {

    @Override
    public String patternName() {
        return BuiltinPatterns.STRATEGY;
    }

    @Override
    public Set<NodeKind> nodeKinds() {
        return EnumSet.of(NodeKind.CONDITIONAL, NodeKind.SWITCH);
    }

    @Override
    public void inspect(Node node, NodeKind kind, AnalyzerState state) {
        if (kind == NodeKind.CONDITIONAL) {
            ConditionalChain.fromHead((IfStmt) node)
                    .ifPresent(chain -> inspectChain(chain, state));
        } else {
            inspectSwitch((SwitchStmt) node, state);
        }
    }

    private void inspectChain(ConditionalChain chain, AnalyzerState state) {
        int length = chain.length();
        if (length < state.getThresholds().getStrategyMinBranches()) {
            return;
        }
        // distinct algorithms tend to call distinct methods
        if (chain.invokedNames().size() < length) {
            return;
        }

        state.report(state.opportunityAt(patternName(), chain.head())
                .opportunityType(OpportunityType.REFACTOR_TO_PATTERN)
                .confidence(confidenceFor(length, state.getThresholds()))
                .description(String.format("Long if/else-if chain (%d conditions) suggests Strategy pattern", length))
                .suggestedImprovement("Replace with Strategy pattern for better maintainability")
                .reasoning(String.format("Chain length %d exceeds threshold of %d. Strategy pattern helps eliminate conditionals",
                        length, state.getThresholds().getStrategyMinBranches()))
                .estimatedEffort(Estimate.MEDIUM)
                .impact(Estimate.MEDIUM)
                .build());
    }

    private void inspectSwitch(SwitchStmt switchStmt, AnalyzerState state) {
        List<SwitchEntry> cases = switchStmt.getEntries().stream()
                .filter(entry -> !entry.getLabels().isEmpty())
                .collect(Collectors.toList());
        int length = cases.size();
        if (length < state.getThresholds().getStrategyMinBranches()) {
            return;
        }
        if (ConditionalChain.invokedNames(switchStmt).size() < length) {
            return;
        }

        state.report(state.opportunityAt(patternName(), switchStmt)
                .opportunityType(OpportunityType.REFACTOR_TO_PATTERN)
                .confidence(confidenceFor(length, state.getThresholds()))
                .description(String.format("Switch with %d cases selecting behavior suggests Strategy pattern", length))
                .suggestedImprovement("Replace the switch with a map of Strategy implementations")
                .reasoning(String.format("%d cases call different code. Strategy pattern helps eliminate conditionals",
                        length))
                .estimatedEffort(Estimate.MEDIUM)
                .impact(Estimate.MEDIUM)
                .build());
    }

    private PatternConfidence confidenceFor(int branches, DetectionThresholds thresholds) {
        return branches >= thresholds.getStrategyHighConfidenceBranches()
                ? PatternConfidence.HIGH : PatternConfidence.MEDIUM;
    }
}
