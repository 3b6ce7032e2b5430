package com.mainframe.transpiler.flow;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.mainframe.transpiler.diagnostics.SemanticError;
import com.mainframe.transpiler.lst.StatementNode;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Result of control-flow resolution for one program.
 */
@Getter
@Builder
public class FlowAnalysis {
    private final FlowGraph graph;
    private final Region mainRegion;

    /** Main region first, then performed ranges in order of first use. */
    @Singular
    private final List<Region> regions;

    @Singular
    private final List<FlowWarning> warnings;

    /** Unresolved PERFORM / GO TO targets, keyed by the paragraph containing them. */
    private final Map<String, List<SemanticError>> paragraphErrors;

    @Singular
    private final List<StructuringFailure> failures;

    @Singular
    private final List<GotoEscape> escapes;

    private final Set<FlowNode> reachable;

    private final IdentityHashMap<StatementNode, PerformSite> sites;

    public Optional<PerformSite> site(StatementNode statement) {
        return Optional.ofNullable(sites.get(statement));
    }

    public boolean isReachable(FlowNode node) {
        return reachable.contains(node);
    }

    public List<SemanticError> errorsIn(String paragraph) {
        return paragraphErrors.getOrDefault(paragraph, List.of());
    }

    public List<SemanticError> allErrors() {
        return paragraphErrors.values().stream().flatMap(List::stream).toList();
    }

    public Optional<Region> region(String key) {
        return regions.stream().filter(r -> r.getKey().equals(key)).findFirst();
    }
}
