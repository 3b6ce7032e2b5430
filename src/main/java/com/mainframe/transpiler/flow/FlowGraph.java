package com.mainframe.transpiler.flow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Paragraph-level flow graph: nodes in source order, edges in discovery order.
 */
public class FlowGraph {
    private final List<FlowNode> nodes;
    private final List<FlowEdge> edges = new ArrayList<>();
    private final Map<String, List<FlowNode>> byName = new LinkedHashMap<>();

    FlowGraph(List<FlowNode> nodes) {
        this.nodes = List.copyOf(nodes);
        for (FlowNode node : nodes) {
            byName.computeIfAbsent(node.getName(), n -> new ArrayList<>()).add(node);
        }
    }

    void addEdge(FlowEdge edge) {
        edges.add(edge);
    }

    public List<FlowNode> getNodes() {
        return nodes;
    }

    public List<FlowEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public Optional<FlowNode> entry() {
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0));
    }

    public FlowNode byOrdinal(int ordinal) {
        return nodes.get(ordinal - 1);
    }

    /**
     * Resolves a procedure name, preferring a paragraph of the given section.
     */
    public Optional<FlowNode> resolve(String name, String fromSection) {
        List<FlowNode> candidates = byName.getOrDefault(name, List.of());
        for (FlowNode candidate : candidates) {
            if (fromSection != null && fromSection.equals(candidate.getSectionName()) && !candidate.isSectionHeader()) {
                return Optional.of(candidate);
            }
        }
        return candidates.stream().findFirst();
    }

    public List<FlowEdge> edgesFrom(FlowNode node) {
        List<FlowEdge> out = new ArrayList<>();
        for (FlowEdge edge : edges) {
            if (edge.getFrom() == node) {
                out.add(edge);
            }
        }
        return out;
    }

    public List<FlowEdge> edgesOfKind(EdgeKind kind) {
        return edges.stream().filter(e -> e.getKind() == kind).toList();
    }

    /**
     * Nodes from {@code first} to {@code last} inclusive, in source order.
     */
    public List<FlowNode> range(FlowNode first, FlowNode last) {
        return nodes.subList(first.getOrdinal() - 1, last.getOrdinal());
    }

    /**
     * Last node of a section: its final paragraph, or the header itself when it has none.
     */
    public FlowNode endOfSection(FlowNode header) {
        FlowNode last = header;
        for (int i = header.getOrdinal(); i < nodes.size(); i++) {
            FlowNode next = nodes.get(i);
            if (next.isSectionHeader() || !header.getName().equals(next.getSectionName())) {
                break;
            }
            last = next;
        }
        return last;
    }
}
