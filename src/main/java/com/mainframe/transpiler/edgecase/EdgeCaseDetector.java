package com.mainframe.transpiler.edgecase;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.flow.FlowAnalysis;
import com.mainframe.transpiler.lst.SourceSpan;
import com.mainframe.transpiler.parser.ParseResult;
import com.mainframe.transpiler.symbol.SymbolTable;

/**
 * Runs the edge-case catalog over one analyzed program.
 *
 * Findings are ordered by source position (catalog order breaks ties) and numbered
 * {@code EC-1, EC-2, ...} in that order, so ids are stable across runs.
 */
public class EdgeCaseDetector {
    private static final Logger log = LoggerFactory.getLogger(EdgeCaseDetector.class);

    private static final Comparator<SourceSpan> BY_POSITION = Comparator
            .comparing(SourceSpan::getFileName, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(SourceSpan::getLine)
            .thenComparingInt(SourceSpan::getStartColumn);

    private final List<EdgeCasePredicate> catalog;

    public EdgeCaseDetector() {
        this(defaultCatalog());
    }

    public EdgeCaseDetector(List<EdgeCasePredicate> catalog) {
        this.catalog = List.copyOf(catalog);
    }

    public static List<EdgeCasePredicate> defaultCatalog() {
        return List.of(
                new AlterStatementPredicate(),
                new SortMergePredicate(),
                new IrreducibleControlFlowPredicate(),
                new GotoOutOfRangePredicate(),
                new MixedPicComputePredicate(),
                new RedefinesVariableOccursPredicate(),
                new EmbeddedExecPredicate(),
                new UnsupportedStatementPredicate(),
                new UnresolvedCopyPredicate(),
                new ExternalCallPredicate(),
                new AlphanumericEditedTargetPredicate(),
                new RedefinesAliasingPredicate());
    }

    public EdgeCaseReport detect(ParseResult parse, SymbolTable symbols, FlowAnalysis flow) {
        DetectionContext context = new DetectionContext(parse, symbols, flow);
        List<EdgeCase> found = new ArrayList<>();
        for (EdgeCasePredicate predicate : catalog) {
            found.addAll(predicate.detect(context));
        }

        // List.sort is stable: equal positions keep catalog order
        found.sort(Comparator.comparing(EdgeCase::getSpan, Comparator.nullsLast(BY_POSITION)));

        List<EdgeCase> numbered = new ArrayList<>();
        for (EdgeCase edgeCase : found) {
            EdgeCase withId = edgeCase.toBuilder().id("EC-" + (numbered.size() + 1)).build();
            numbered.add(withId);
            log.debug("{} {} {} at {}: {}", withId.getId(), withId.getSeverity(), withId.getCategory(),
                    withId.location(), withId.getMessage());
        }

        EdgeCaseReport report = new EdgeCaseReport(numbered);
        log.info("Detected {} edge cases in {} ({} blocking, {} needing augmentation)", numbered.size(),
                parse.getFileName(), numbered.stream().filter(EdgeCase::isBlocking).count(),
                report.needingAugmentation().size());
        return report;
    }
}
