package com.mainframe.transpiler.translate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.diagnostics.SemanticError;
import com.mainframe.transpiler.edgecase.EdgeCase;
import com.mainframe.transpiler.edgecase.EdgeCaseReport;
import com.mainframe.transpiler.flow.ControlFlowResolver;
import com.mainframe.transpiler.flow.FlowAnalysis;
import com.mainframe.transpiler.flow.FlowNode;
import com.mainframe.transpiler.flow.Region;
import com.mainframe.transpiler.flow.RegionShape;
import com.mainframe.transpiler.ir.ControlVariable;
import com.mainframe.transpiler.ir.IrField;
import com.mainframe.transpiler.ir.IrFile;
import com.mainframe.transpiler.ir.IrParagraph;
import com.mainframe.transpiler.ir.IrProgram;
import com.mainframe.transpiler.ir.IrRegion;
import com.mainframe.transpiler.ir.IrStatement;
import com.mainframe.transpiler.ir.Sequence;
import com.mainframe.transpiler.naming.IdentifierSanitizer;
import com.mainframe.transpiler.naming.NameKind;
import com.mainframe.transpiler.naming.NameScope;
import com.mainframe.transpiler.naming.NamingUtil;
import com.mainframe.transpiler.parser.ParseResult;
import com.mainframe.transpiler.symbol.SymbolTable;

/**
 * Lowers a parsed, resolved and classified program into the target-neutral IR.
 *
 * Every paragraph becomes a unit. A paragraph touched by a blocking edge case, an unresolved
 * procedure name or a reference that does not resolve is emitted as a blocked unit that raises
 * when called; the rest of the program is still lowered.
 */
public class IrTranslator {
    private static final Logger log = LoggerFactory.getLogger(IrTranslator.class);

    public TranslationResult translate(ParseResult parse, SymbolTable symbols, FlowAnalysis flow, EdgeCaseReport edgeCases) {
        String unitName = NamingUtil.unitName(parse.getProgramId(), parse.getFileName());
        NameScope names = symbols.getNames();

        LayoutBuilder layout = new LayoutBuilder(symbols, unitName);
        List<IrField> records = layout.records();
        List<IrFile> files = layout.files();
        Map<String, IrFile> filesByName = new LinkedHashMap<>();
        files.forEach(f -> filesByName.put(f.getCobolName(), f));

        List<FlowNode> nodes = flow.getGraph().getNodes();
        Map<FlowNode, String> paragraphIds = new LinkedHashMap<>();
        for (FlowNode node : nodes) {
            paragraphIds.put(node, names.claim(node.getName(), NameKind.PARAGRAPH));
        }
        Map<String, String> regionIds = new LinkedHashMap<>();
        for (Region region : flow.getRegions()) {
            regionIds.put(region.getKey(), names.claim(regionName(region)));
        }
        String mainId = regionIds.computeIfAbsent(ControlFlowResolver.MAIN_REGION, k -> names.claim("procedure_division"));
        ControlVariable jump = new ControlVariable(names.claim("jump"), -1);

        ExpressionLowering expressions = new ExpressionLowering(symbols, layout);
        Set<String> calledRegions = new LinkedHashSet<>();
        StatementLowering statements = new StatementLowering(flow, edgeCases, expressions, paragraphIds, regionIds,
                filesByName, jump, calledRegions);

        List<SemanticError> errors = new ArrayList<>();
        IrProgram.IrProgramBuilder program = IrProgram.builder()
                .programId(parse.getProgramId())
                .unitName(unitName)
                .sourcePath(parse.getFileName())
                .records(records)
                .files(files)
                .entryRegion(mainId);

        int blocked = 0;
        for (FlowNode node : nodes) {
            IrParagraph paragraph = paragraph(node, paragraphIds.get(node), statements, flow, edgeCases, errors);
            if (paragraph.isBlocked()) {
                blocked++;
                log.warn("Paragraph {} of {} is blocked: {}", node.getName(), parse.getFileName(), paragraph.getBlockedReason());
            }
            program.paragraph(paragraph);
        }

        RegionLowering regions = new RegionLowering(paragraphIds, jump);
        List<ControlVariable> cursors = new ArrayList<>();
        boolean dispatching = false;
        for (Region region : flow.getRegions()) {
            if (!region.isMain() && !calledRegions.contains(region.getKey())) {
                continue;
            }
            String identifier = regionIds.get(region.getKey());
            switch (region.getShape()) {
                case SEQUENTIAL:
                    program.region(regions.sequential(region, identifier));
                    break;
                case DISPATCH: {
                    ControlVariable cursor = new ControlVariable(names.claim("cur_" + identifier), 0);
                    cursors.add(cursor);
                    program.region(regions.dispatch(region, identifier, cursor));
                    dispatching = true;
                    break;
                }
                default:
                    program.region(regions.irreducible(region, identifier));
                    break;
            }
        }
        if (flow.getMainRegion() == null) {
            program.region(IrRegion.builder()
                    .key(ControlFlowResolver.MAIN_REGION)
                    .identifier(mainId)
                    .shape(RegionShape.SEQUENTIAL)
                    .body(Sequence.empty())
                    .build());
        }
        if (dispatching || statements.isJumpUsed()) {
            program.controlVariable(jump);
        }
        cursors.forEach(program::controlVariable);

        IrProgram result = program.build();
        log.info("Translated {} to IR: {} records, {} paragraphs ({} blocked), {} regions, {} reference errors",
                parse.getFileName(), records.size(), result.getParagraphs().size(), blocked,
                result.getRegions().size(), errors.size());
        return new TranslationResult(result, List.copyOf(errors));
    }

    private static IrParagraph paragraph(FlowNode node, String identifier, StatementLowering statements,
                                         FlowAnalysis flow, EdgeCaseReport edgeCases, List<SemanticError> errors) {
        IrParagraph.IrParagraphBuilder paragraph = IrParagraph.builder()
                .cobolName(node.getName())
                .identifier(identifier)
                .ordinal(node.getOrdinal())
                .sectionName(node.getSectionName());

        String reason = blockReason(node, flow, edgeCases);
        if (reason != null) {
            return paragraph.body(Sequence.empty()).blockedReason(reason).build();
        }
        try {
            IrStatement body = statements.paragraph(node);
            return paragraph.body(body).build();
        } catch (LoweringException e) {
            if (e.getError() != null) {
                errors.add(e.getError());
            }
            return paragraph.body(Sequence.empty()).blockedReason(e.getMessage()).build();
        }
    }

    private static String blockReason(FlowNode node, FlowAnalysis flow, EdgeCaseReport edgeCases) {
        if (edgeCases.isBlocked(node.getName())) {
            return "blocked by " + edgeCases.getEdgeCases().stream()
                    .filter(EdgeCase::isBlocking)
                    .filter(e -> node.getName().equals(e.getParagraph()))
                    .map(e -> e.getId() + " " + e.getCategory())
                    .collect(Collectors.joining(", "));
        }
        List<SemanticError> unresolved = flow.errorsIn(node.getName());
        if (!unresolved.isEmpty()) {
            return unresolved.get(0).getMessage();
        }
        return null;
    }

    private static String regionName(Region region) {
        if (region.isMain()) {
            return "procedure_division";
        }
        String head = namePart(region.head().getName());
        if (region.getMembers().size() == 1) {
            return "perform_" + head;
        }
        return "perform_" + head + "_thru_" + namePart(region.last().getName());
    }

    /** Sanitized paragraph name without the prefix a leading digit needs on its own. */
    private static String namePart(String paragraph) {
        String sanitized = IdentifierSanitizer.sanitize(paragraph, NameKind.PARAGRAPH);
        String prefix = NameKind.PARAGRAPH.getDigitPrefix();
        if (sanitized.startsWith(prefix) && sanitized.length() > prefix.length()
                && Character.isDigit(sanitized.charAt(prefix.length()))) {
            return sanitized.substring(prefix.length());
        }
        return sanitized;
    }
}
