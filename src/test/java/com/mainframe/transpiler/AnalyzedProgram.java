package com.mainframe.transpiler;

import com.mainframe.transpiler.edgecase.EdgeCaseDetector;
import com.mainframe.transpiler.edgecase.EdgeCaseReport;
import com.mainframe.transpiler.flow.ControlFlowResolver;
import com.mainframe.transpiler.flow.FlowAnalysis;
import com.mainframe.transpiler.ir.IrProgram;
import com.mainframe.transpiler.parser.CobolSourceParser;
import com.mainframe.transpiler.parser.ParseResult;
import com.mainframe.transpiler.symbol.SymbolTable;
import com.mainframe.transpiler.symbol.SymbolTableBuilder;
import com.mainframe.transpiler.translate.IrTranslator;
import com.mainframe.transpiler.translate.TranslationResult;

import lombok.Value;

/**
 * Runs the analysis stages over a sample program, in the order the orchestrator runs them.
 */
@Value
public class AnalyzedProgram {
    ParseResult parse;
    SymbolTable symbols;
    FlowAnalysis flow;
    EdgeCaseReport edgeCases;
    TranslationResult translation;

    public static AnalyzedProgram of(String source, String fileName) {
        ParseResult parse = new CobolSourceParser().parse(source, fileName, null);
        SymbolTable symbols = new SymbolTableBuilder().build(parse);
        FlowAnalysis flow = new ControlFlowResolver().resolve(parse, symbols);
        EdgeCaseReport edgeCases = new EdgeCaseDetector().detect(parse, symbols, flow);
        TranslationResult translation = new IrTranslator().translate(parse, symbols, flow, edgeCases);
        return new AnalyzedProgram(parse, symbols, flow, edgeCases, translation);
    }

    public IrProgram program() {
        return translation.getProgram();
    }
}
