package com.mainframe.transpiler.flow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.diagnostics.SemanticError;
import com.mainframe.transpiler.diagnostics.SemanticErrorKind;
import com.mainframe.transpiler.lst.ClauseNode;
import com.mainframe.transpiler.lst.ClauseRole;
import com.mainframe.transpiler.lst.LiteralNode;
import com.mainframe.transpiler.lst.LstNode;
import com.mainframe.transpiler.lst.LstWalker;
import com.mainframe.transpiler.lst.ParagraphNode;
import com.mainframe.transpiler.lst.SectionNode;
import com.mainframe.transpiler.lst.StatementNode;
import com.mainframe.transpiler.parser.ParseResult;
import com.mainframe.transpiler.symbol.DataItem;
import com.mainframe.transpiler.symbol.SymbolTable;

/**
 * Builds the paragraph flow graph of a program and structures it into regions.
 *
 * Resolution only:
 * - PERFORM, GO TO and fall-through edges, with unresolved targets reported
 * - reachability from the entry paragraph
 * - PERFORM UNTIL loops whose condition nothing in the loop can change
 * - one region per performed range plus the main region, each SEQUENTIAL, DISPATCH or IRREDUCIBLE
 *
 * It does NOT lower anything; the translator consumes the regions.
 */
public class ControlFlowResolver {
    private static final Logger log = LoggerFactory.getLogger(ControlFlowResolver.class);

    public static final String MAIN_REGION = "MAIN";

    public FlowAnalysis resolve(ParseResult parse, SymbolTable symbols) {
        FlowGraph graph = new FlowGraph(buildNodes(parse));
        Map<String, List<SemanticError>> errors = new LinkedHashMap<>();
        IdentityHashMap<StatementNode, PerformSite> sites = new IdentityHashMap<>();

        addEdges(graph, errors);
        Set<FlowNode> reachable = reachable(graph);

        FlowAnalysis.FlowAnalysisBuilder analysis = FlowAnalysis.builder()
                .graph(graph)
                .paragraphErrors(errors)
                .reachable(reachable)
                .sites(sites);

        for (FlowNode node : graph.getNodes()) {
            if (!reachable.contains(node) && !node.isImplicit()) {
                analysis.warning(new FlowWarning(FlowWarningKind.UNREACHABLE_PARAGRAPH, node.getName(),
                        "Paragraph " + node.getName() + " is never reached from the entry paragraph", node.getSpan()));
            }
        }

        // Regions: main, then performed ranges in order of first use
        Map<String, Region> regions = new LinkedHashMap<>();
        Region main = null;
        if (!graph.getNodes().isEmpty()) {
            main = structure(MAIN_REGION, true, graph.getNodes(), graph, analysis);
            regions.put(MAIN_REGION, main);
        }

        for (FlowNode node : graph.getNodes()) {
            for (StatementNode top : node.getStatements()) {
                for (StatementNode statement : LstWalker.statements(top)) {
                    if (statement.isVerb("PERFORM")) {
                        sites.put(statement, classifyPerform(statement, node, graph, regions, analysis));
                    } else if (statement.isVerb("GO")) {
                        sites.put(statement, new PerformSite(statement, node.getName(), PerformKind.GOTO, LoopAnnotation.ONCE, null));
                    }
                }
            }
        }

        analysis.mainRegion(main);
        analysis.regions(regions.values());

        DataAccess access = new DataAccess(symbols);
        for (FlowNode node : graph.getNodes()) {
            for (StatementNode top : node.getStatements()) {
                for (StatementNode statement : LstWalker.statements(top)) {
                    PerformSite site = sites.get(statement);
                    if (site != null && site.getKind() != PerformKind.GOTO) {
                        checkLoopRisk(statement, site, node, graph, access, analysis);
                    }
                }
            }
        }

        FlowAnalysis result = analysis.build();
        log.info("Resolved control flow of {}: {} paragraphs, {} edges, {} regions, {} warnings",
                parse.getFileName(), graph.getNodes().size(), graph.getEdges().size(),
                result.getRegions().size(), result.getWarnings().size());
        return result;
    }

    // ------------------------------------------------------------------ graph

    private static List<FlowNode> buildNodes(ParseResult parse) {
        List<FlowNode> nodes = new ArrayList<>();
        parse.procedureDivision().ifPresent(division -> {
            for (LstNode child : division.getChildren()) {
                if (child instanceof ParagraphNode paragraph) {
                    nodes.add(new FlowNode(paragraph.getName(), nodes.size() + 1, null, false,
                            paragraph.isImplicit(), paragraph, paragraph.statements()));
                } else if (child instanceof SectionNode section) {
                    nodes.add(new FlowNode(section.getName(), nodes.size() + 1, section.getName(), true,
                            false, section, section.statements()));
                    for (ParagraphNode paragraph : section.paragraphs()) {
                        nodes.add(new FlowNode(paragraph.getName(), nodes.size() + 1, section.getName(), false,
                                paragraph.isImplicit(), paragraph, paragraph.statements()));
                    }
                }
            }
        });
        return nodes;
    }

    private static void addEdges(FlowGraph graph, Map<String, List<SemanticError>> errors) {
        List<FlowNode> nodes = graph.getNodes();
        for (FlowNode node : nodes) {
            for (StatementNode top : node.getStatements()) {
                for (StatementNode statement : LstWalker.statements(top)) {
                    if (statement.isVerb("PERFORM") && statement.hasClause(ClauseRole.PROCEDURE)) {
                        addPerformEdges(graph, node, statement, errors);
                    } else if (statement.isVerb("GO")) {
                        for (String target : procedureNames(statement)) {
                            Optional<FlowNode> resolved = resolveTarget(graph, node, statement, target, errors);
                            resolved.ifPresent(t -> graph.addEdge(new FlowEdge(node, t, EdgeKind.GOTO, LoopAnnotation.ONCE, statement)));
                        }
                    }
                }
            }
            if (node.getOrdinal() < nodes.size() && !alwaysTransfers(node)) {
                graph.addEdge(new FlowEdge(node, graph.byOrdinal(node.getOrdinal() + 1), EdgeKind.FALL_THROUGH,
                        LoopAnnotation.ONCE, null));
            }
        }
    }

    private static void addPerformEdges(FlowGraph graph, FlowNode node, StatementNode perform,
                                        Map<String, List<SemanticError>> errors) {
        Optional<FlowNode[]> range = performRange(graph, node, perform, errors);
        if (range.isEmpty()) {
            return;
        }
        LoopAnnotation annotation = annotationOf(perform);
        FlowNode first = range.get()[0];
        FlowNode last = range.get()[1];
        if (perform.hasClause(ClauseRole.THRU)) {
            for (FlowNode target : graph.range(first, last)) {
                graph.addEdge(new FlowEdge(node, target, EdgeKind.PERFORM, annotation, perform));
            }
        } else {
            graph.addEdge(new FlowEdge(node, first, EdgeKind.PERFORM, annotation, perform));
        }
    }

    /**
     * First and last paragraph of a PERFORM's range; a section stands for all its paragraphs.
     */
    private static Optional<FlowNode[]> performRange(FlowGraph graph, FlowNode from, StatementNode perform,
                                                     Map<String, List<SemanticError>> errors) {
        String headName = firstIdentifier(perform.clause(ClauseRole.PROCEDURE).orElseThrow());
        Optional<FlowNode> head = resolveTarget(graph, from, perform, headName, errors);
        if (head.isEmpty()) {
            return Optional.empty();
        }
        FlowNode first = head.get();
        FlowNode last = first.isSectionHeader() ? graph.endOfSection(first) : first;

        Optional<ClauseNode> thru = perform.clause(ClauseRole.THRU);
        if (thru.isPresent()) {
            Optional<FlowNode> end = resolveTarget(graph, from, perform, firstIdentifier(thru.get()), errors);
            if (end.isEmpty()) {
                return Optional.empty();
            }
            last = end.get().isSectionHeader() ? graph.endOfSection(end.get()) : end.get();
            if (last.getOrdinal() < first.getOrdinal()) {
                log.warn("PERFORM {} THRU {} at {}: range end precedes its start; performing {} only",
                        first.getName(), last.getName(), perform.getSpan(), first.getName());
                last = first;
            }
        }
        return Optional.of(new FlowNode[] {first, last});
    }

    private static Optional<FlowNode> resolveTarget(FlowGraph graph, FlowNode from, StatementNode statement,
                                                    String name, Map<String, List<SemanticError>> errors) {
        Optional<FlowNode> target = graph.resolve(name, from.getSectionName());
        if (target.isEmpty()) {
            SemanticError error = new SemanticError(SemanticErrorKind.UNDECLARED_PARAGRAPH, name,
                    statement.getVerb() + " names undeclared paragraph " + name, statement.getSpan());
            List<SemanticError> list = errors.computeIfAbsent(from.getName(), n -> new ArrayList<>());
            if (list.stream().noneMatch(e -> e.getSpan().equals(error.getSpan()) && e.getItem().equals(name))) {
                list.add(error);
                log.warn("{}: {}", statement.getSpan(), error.getMessage());
            }
        }
        return target;
    }

    /**
     * True when the paragraph's last statement never lets control reach the next paragraph.
     */
    static boolean alwaysTransfers(FlowNode node) {
        StatementNode last = node.lastStatement();
        if (last == null) {
            return false;
        }
        if (last.isVerb("GO")) {
            return !procedureNames(last).isEmpty() && !last.hasClause(ClauseRole.DEPENDING_ON);
        }
        return isTermination(last);
    }

    /**
     * STOP RUN, GOBACK or EXIT PROGRAM.
     */
    public static boolean isTermination(StatementNode statement) {
        if (statement.isVerb("STOP") || statement.isVerb("GOBACK")) {
            return true;
        }
        return statement.isVerb("EXIT")
                && statement.clause(ClauseRole.OPTIONS).map(c -> "PROGRAM".equals(c.getOperator())).orElse(false);
    }

    static boolean alwaysTerminates(FlowNode node) {
        StatementNode last = node.lastStatement();
        return last != null && isTermination(last);
    }

    private static Set<FlowNode> reachable(FlowGraph graph) {
        Set<FlowNode> seen = new LinkedHashSet<>();
        Optional<FlowNode> entry = graph.entry();
        if (entry.isEmpty()) {
            return seen;
        }
        Deque<FlowNode> work = new ArrayDeque<>();
        work.push(entry.get());
        while (!work.isEmpty()) {
            FlowNode node = work.pop();
            if (!seen.add(node)) {
                continue;
            }
            for (FlowEdge edge : graph.edgesFrom(node)) {
                if (!seen.contains(edge.getTo())) {
                    work.push(edge.getTo());
                }
            }
        }
        return seen;
    }

    // ------------------------------------------------------------------ regions

    private PerformSite classifyPerform(StatementNode perform, FlowNode node, FlowGraph graph,
                                        Map<String, Region> regions, FlowAnalysis.FlowAnalysisBuilder analysis) {
        LoopAnnotation annotation = annotationOf(perform);
        if (!perform.hasClause(ClauseRole.PROCEDURE)) {
            return new PerformSite(perform, node.getName(), PerformKind.INLINE, annotation, null);
        }
        Optional<FlowNode[]> range = performRange(graph, node, perform, new LinkedHashMap<>());
        if (range.isEmpty()) {
            return new PerformSite(perform, node.getName(), PerformKind.OUT_OF_LINE, annotation, null);
        }
        FlowNode first = range.get()[0];
        FlowNode last = range.get()[1];
        String key = first == last ? first.getName() : first.getName() + ".." + last.getName();
        Region region = regions.get(key);
        if (region == null) {
            region = structure(key, false, graph.range(first, last), graph, analysis);
            regions.put(key, region);
        }
        return new PerformSite(perform, node.getName(), PerformKind.OUT_OF_LINE, annotation, region);
    }

    private static LoopAnnotation annotationOf(StatementNode perform) {
        if (perform.hasClause(ClauseRole.VARYING)) return LoopAnnotation.VARYING;
        if (perform.hasClause(ClauseRole.UNTIL)) return LoopAnnotation.UNTIL;
        if (perform.hasClause(ClauseRole.TIMES)) return LoopAnnotation.TIMES;
        return LoopAnnotation.ONCE;
    }

    /**
     * Decides the shape of a region from the GO TOs of its members.
     */
    private Region structure(String key, boolean main, List<FlowNode> members, FlowGraph graph,
                             FlowAnalysis.FlowAnalysisBuilder analysis) {
        FlowNode head = members.get(0);
        FlowNode last = members.get(members.size() - 1);

        boolean hasGoto = false;
        List<List<Integer>> successors = new ArrayList<>();
        for (int i = 0; i < members.size(); i++) {
            successors.add(new ArrayList<>());
        }

        for (FlowNode member : members) {
            int from = member.getOrdinal() - head.getOrdinal();
            for (FlowEdge edge : graph.edgesFrom(member)) {
                FlowNode to = edge.getTo();
                boolean inside = to.getOrdinal() >= head.getOrdinal() && to.getOrdinal() <= last.getOrdinal();
                if (edge.getKind() == EdgeKind.GOTO) {
                    hasGoto = true;
                    if (!inside) {
                        analysis.escape(new GotoEscape(key, member.getName(), to.getName(), edge.getStatement()));
                        continue;
                    }
                }
                if (edge.getKind() != EdgeKind.PERFORM && inside) {
                    successors.get(from).add(to.getOrdinal() - head.getOrdinal());
                }
            }
        }

        if (!hasGoto) {
            List<FlowNode> calls = new ArrayList<>();
            for (FlowNode member : members) {
                calls.add(member);
                if (main && alwaysTerminates(member)) {
                    break;
                }
            }
            log.debug("Region {} is sequential over {} paragraphs", key, calls.size());
            return new Region(key, main, RegionShape.SEQUENTIAL, List.copyOf(members), List.copyOf(calls));
        }

        boolean irreducible = false;
        for (List<Integer> component : new SccFinder(successors).find()) {
            boolean cyclic = component.size() > 1 || successors.get(component.get(0)).contains(component.get(0));
            if (!cyclic) {
                continue;
            }
            Set<Integer> inComponent = new LinkedHashSet<>(component);
            List<Integer> entries = new ArrayList<>();
            for (int node : component) {
                boolean entry = node == 0;
                for (int pred = 0; pred < successors.size() && !entry; pred++) {
                    if (!inComponent.contains(pred) && successors.get(pred).contains(node)) {
                        entry = true;
                    }
                }
                if (entry) {
                    entries.add(node);
                }
            }
            if (entries.size() > 1) {
                irreducible = true;
                for (int node : component) {
                    FlowNode paragraph = members.get(node);
                    analysis.failure(new StructuringFailure(key, paragraph.getName(),
                            "Paragraph " + paragraph.getName() + " is part of a loop with " + entries.size()
                                    + " entry points in region " + key,
                            paragraph.getSpan()));
                }
            }
        }

        RegionShape shape = irreducible ? RegionShape.IRREDUCIBLE : RegionShape.DISPATCH;
        log.debug("Region {} structured as {}", key, shape);
        return new Region(key, main, shape, List.copyOf(members), List.copyOf(members));
    }

    // ------------------------------------------------------------------ loop risk

    private void checkLoopRisk(StatementNode perform, PerformSite site, FlowNode node, FlowGraph graph,
                               DataAccess access, FlowAnalysis.FlowAnalysisBuilder analysis) {
        Optional<ClauseNode> until = perform.clause(ClauseRole.UNTIL)
                .or(() -> perform.clause(ClauseRole.VARYING).flatMap(v -> v.clause(ClauseRole.UNTIL)));
        if (until.isEmpty()) {
            return;
        }

        Set<DataItem> reads = access.reads(until.get());
        Set<DataItem> writes = new LinkedHashSet<>();
        boolean escapes;

        if (site.getKind() == PerformKind.INLINE) {
            List<StatementNode> body = perform.body(ClauseRole.BODY);
            writes.addAll(access.writes(body));
            escapes = body.stream().flatMap(s -> LstWalker.statements(s).stream())
                    .anyMatch(s -> s.isVerb("GO") || isTermination(s));
            Set<FlowNode> performed = new LinkedHashSet<>();
            for (StatementNode statement : body) {
                for (StatementNode nested : LstWalker.statements(statement)) {
                    collectPerformed(nested, node, graph, performed);
                }
            }
            for (FlowNode paragraph : performed) {
                writes.addAll(access.writes(paragraph.getStatements()));
                escapes |= terminates(paragraph);
            }
        } else if (site.getRegion() != null) {
            Region region = site.getRegion();
            Set<FlowNode> performed = new LinkedHashSet<>(region.getMembers());
            for (FlowNode member : region.getMembers()) {
                for (StatementNode statement : member.getStatements()) {
                    for (StatementNode nested : LstWalker.statements(statement)) {
                        collectPerformed(nested, member, graph, performed);
                    }
                }
            }
            escapes = false;
            for (FlowNode paragraph : performed) {
                writes.addAll(access.writes(paragraph.getStatements()));
                escapes |= terminates(paragraph);
                if (region.getMembers().contains(paragraph)) {
                    for (FlowEdge edge : graph.edgesFrom(paragraph)) {
                        escapes |= edge.getKind() == EdgeKind.GOTO && !region.contains(edge.getTo());
                    }
                }
            }
        } else {
            return;
        }

        perform.clause(ClauseRole.VARYING)
                .flatMap(v -> v.clause(ClauseRole.TARGET))
                .flatMap(t -> t.clause(ClauseRole.REFERENCE))
                .ifPresent(reference -> writes.addAll(access.reads(reference)));

        if (escapes) {
            return;
        }
        for (DataItem read : reads) {
            for (DataItem written : writes) {
                if (DataAccess.overlaps(read, written)) {
                    return;
                }
            }
        }

        analysis.warning(new FlowWarning(FlowWarningKind.INFINITE_LOOP_RISK, node.getName(),
                "PERFORM UNTIL " + until.get().clause(ClauseRole.CONDITION).map(LstNode::toSourceText).orElse("?")
                        + " never changes the data its condition reads",
                perform.getSpan()));
    }

    /**
     * Adds every paragraph transitively performed from the statement.
     */
    private static void collectPerformed(StatementNode statement, FlowNode from, FlowGraph graph, Set<FlowNode> out) {
        if (!statement.isVerb("PERFORM") || !statement.hasClause(ClauseRole.PROCEDURE)) {
            return;
        }
        Optional<FlowNode[]> range = performRange(graph, from, statement, new LinkedHashMap<>());
        if (range.isEmpty()) {
            return;
        }
        for (FlowNode paragraph : graph.range(range.get()[0], range.get()[1])) {
            if (out.add(paragraph)) {
                for (StatementNode top : paragraph.getStatements()) {
                    for (StatementNode nested : LstWalker.statements(top)) {
                        collectPerformed(nested, paragraph, graph, out);
                    }
                }
            }
        }
    }

    private static boolean terminates(FlowNode paragraph) {
        return paragraph.getStatements().stream()
                .flatMap(s -> LstWalker.statements(s).stream())
                .anyMatch(ControlFlowResolver::isTermination);
    }

    // ------------------------------------------------------------------ helpers

    /**
     * Target names of a GO TO, in order.
     */
    public static List<String> procedureNames(StatementNode statement) {
        List<String> names = new ArrayList<>();
        for (ClauseNode clause : statement.clauses(ClauseRole.PROCEDURE)) {
            names.add(firstIdentifier(clause));
        }
        return names;
    }

    private static String firstIdentifier(ClauseNode clause) {
        List<LiteralNode> literals = clause.literals();
        return literals.get(literals.size() - 1).upper();
    }
}
