package com.mainframe.transpiler.orchestrator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.augment.AugmentationClient;
import com.mainframe.transpiler.augment.AugmentationContext;
import com.mainframe.transpiler.augment.AugmentationResult;
import com.mainframe.transpiler.codegen.CodeGenerator;
import com.mainframe.transpiler.codegen.TemplateRenderingException;
import com.mainframe.transpiler.config.TranspilerConfig;
import com.mainframe.transpiler.diagnostics.GenerationError;
import com.mainframe.transpiler.diagnostics.ProgramDiagnostics;
import com.mainframe.transpiler.edgecase.EdgeCase;
import com.mainframe.transpiler.edgecase.EdgeCaseDetector;
import com.mainframe.transpiler.flow.ControlFlowResolver;
import com.mainframe.transpiler.ir.IrProgram;
import com.mainframe.transpiler.mapping.MappingFactory;
import com.mainframe.transpiler.mapping.MappingValidator;
import com.mainframe.transpiler.parser.CobolSourceParser;
import com.mainframe.transpiler.symbol.DataItem;
import com.mainframe.transpiler.symbol.SymbolTable;
import com.mainframe.transpiler.symbol.SymbolTableBuilder;
import com.mainframe.transpiler.translate.IrTranslator;

/**
 * Takes one program from source to generated unit, stage by stage, recording everything in its
 * {@link ProgramContext}. A program with a syntax or generation error or a blocking edge case ends
 * {@code ERRORED} and leaves no output; analysis still runs as far as it can so the report lists
 * every problem. Semantic errors are reported but only block the paragraphs they touch, which are
 * generated as units that raise when reached.
 */
class ProgramPipeline {
    private static final Logger log = LoggerFactory.getLogger(ProgramPipeline.class);

    private static final Pattern WORD = Pattern.compile("[A-Za-z0-9][A-Za-z0-9-]*");

    private final TranspilerConfig config;
    private final CobolSourceParser parser;
    private final CodeGenerator generator;
    private final AugmentationClient augmentation;
    private final MappingFactory mappingFactory = new MappingFactory();
    private final MappingValidator validator;
    /** Generated file to the source that produced it, for this run. */
    private final Map<Path, Path> outputOwners = new ConcurrentHashMap<>();

    ProgramPipeline(TranspilerConfig config, CodeGenerator generator, AugmentationClient augmentation) {
        this.config = config;
        this.parser = new CobolSourceParser(config.getSourceFormat(), config.getRightMargin(), config.getCopybookDirs());
        this.generator = generator;
        this.augmentation = augmentation;
        this.validator = new MappingValidator(config.getValidationStepLimit());
    }

    void run(ProgramContext ctx) {
        ProgramDiagnostics diagnostics = ctx.getDiagnostics();
        try {
            ctx.transition(ProgramState.PARSING);
            ctx.setParse(parser.parse(ctx.getSource()));
            diagnostics.getSyntaxErrors().addAll(ctx.getParse().getSyntaxErrors());
            if (ctx.getParse().isFatal()) {
                diagnostics.getGenerationErrors().add(
                        new GenerationError(ctx.programName(), ProgramState.PARSING.name(), ctx.getParse().getFatalReason()));
                ctx.transition(ProgramState.ERRORED);
                return;
            }

            ctx.transition(ProgramState.ANALYZING);
            ctx.setSymbols(new SymbolTableBuilder().build(ctx.getParse()));
            diagnostics.getSemanticErrors().addAll(ctx.getSymbols().getErrors());

            ctx.transition(ProgramState.STRUCTURING);
            ctx.setFlow(new ControlFlowResolver().resolve(ctx.getParse(), ctx.getSymbols()));
            diagnostics.getFlowWarnings().addAll(ctx.getFlow().getWarnings());
            diagnostics.getStructuringFailures().addAll(ctx.getFlow().getFailures());
            diagnostics.getSemanticErrors().addAll(ctx.getFlow().allErrors());
            ctx.setEdgeCases(new EdgeCaseDetector().detect(ctx.getParse(), ctx.getSymbols(), ctx.getFlow()));
            diagnostics.getEdgeCases().addAll(ctx.getEdgeCases().getEdgeCases());

            ctx.transition(ProgramState.TRANSLATING);
            ctx.setTranslation(new IrTranslator().translate(ctx.getParse(), ctx.getSymbols(), ctx.getFlow(), ctx.getEdgeCases()));
            diagnostics.getSemanticErrors().addAll(ctx.getTranslation().getErrors());

            if (diagnostics.hasErrors()) {
                log.warn("{} has {} error(s); no output is generated", ctx.getRelativePath(),
                        diagnostics.errorMessages().size());
                ctx.transition(ProgramState.ERRORED);
                return;
            }

            if (!ctx.getEdgeCases().needingAugmentation().isEmpty()) {
                ctx.transition(ProgramState.AWAITING_AUGMENTATION);
                augment(ctx);
            }

            if (diagnostics.hasSemanticErrors()) {
                log.warn("{} has {} semantic error(s); the affected paragraphs are generated blocked",
                        ctx.getRelativePath(), diagnostics.getSemanticErrors().size());
            }

            ctx.transition(ProgramState.GENERATING);
            IrProgram program = ctx.getTranslation().getProgram();
            Path outputDir = config.getOutputRoot().resolve(outputDirectory(ctx.getRelativePath()));
            Path target = outputDir.resolve(generator.fileName(program)).toAbsolutePath().normalize();
            Path owner = outputOwners.putIfAbsent(target, ctx.getRelativePath());
            if (owner != null) {
                log.error("{} would overwrite {}, already generated from {}", ctx.getRelativePath(), target, owner);
                diagnostics.getGenerationErrors().add(new GenerationError(ctx.programName(), ProgramState.GENERATING.name(),
                        "output " + target.getFileName() + " is already generated from " + owner));
                ctx.transition(ProgramState.ERRORED);
                return;
            }
            ctx.setOutput(generator.generate(program, ctx.hints(), outputDir));

            ctx.setMappings(mappingFactory.create(program, diagnostics.getEdgeCases(), ctx.getAugmentations()));
            if (config.isValidate()) {
                validator.validate(program, ctx.getMappings());
            }
            ctx.transition(ProgramState.DONE);
        } catch (TemplateRenderingException | IOException e) {
            log.error("Generation of {} failed: {}", ctx.getRelativePath(), e.getMessage());
            fail(ctx, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Internal error while processing {} in state {}", ctx.getRelativePath(), ctx.getState(), e);
            fail(ctx, "internal error: " + e);
        }
    }

    private static void fail(ProgramContext ctx, String message) {
        ctx.getDiagnostics().getGenerationErrors()
                .add(new GenerationError(ctx.programName(), ctx.getState().name(), message));
        if (!ctx.getState().isFinal()) {
            ctx.transition(ProgramState.ERRORED);
        }
    }

    private void augment(ProgramContext ctx) {
        for (EdgeCase edgeCase : ctx.getEdgeCases().needingAugmentation()) {
            AugmentationContext context = AugmentationContext.builder()
                    .kind(edgeCase.getCategory().name())
                    .program(ctx.programName())
                    .paragraph(edgeCase.getParagraph())
                    .symbolContext(symbolContext(edgeCase.getSnippet(), ctx.getSymbols()))
                    .build();
            String snippet = edgeCase.getSnippet() != null ? edgeCase.getSnippet() : edgeCase.getMessage();
            AugmentationResult result = augmentation.submit(snippet, context);
            ctx.getAugmentations().put(edgeCase.getId(), result);
            if (result.isSuccess()) {
                log.info("{} {}: augmentation hint recorded (confidence {})", ctx.getRelativePath(), edgeCase.getId(),
                        result.getConfidence());
            } else {
                ctx.getDiagnostics().getAugmentationErrors().add(result.getError());
                log.info("{} {}: augmentation {}; keeping the deterministic translation", ctx.getRelativePath(),
                        edgeCase.getId(), result.getError());
            }
        }
    }

    /**
     * Declarations of the data items a snippet names, in name order.
     */
    static Set<String> symbolContext(String snippet, SymbolTable symbols) {
        Set<String> out = new TreeSet<>();
        if (snippet == null) {
            return out;
        }
        Set<String> words = new TreeSet<>();
        Matcher m = WORD.matcher(snippet);
        while (m.find()) {
            words.add(m.group().toUpperCase(Locale.ROOT));
        }
        for (DataItem item : symbols.getItems()) {
            if (item.getName() != null && words.contains(item.getName().toUpperCase(Locale.ROOT))) {
                out.add(declaration(item));
            }
        }
        return out;
    }

    private static String declaration(DataItem item) {
        String text = String.format("%02d %s", item.getLevel(), item.getName());
        if (item.getPicture() != null) {
            text += " PIC " + item.getPicture().getRawPicture();
        }
        return text;
    }

    private static Path outputDirectory(Path relativePath) {
        Path parent = relativePath.getParent();
        return parent == null ? Path.of("") : parent;
    }
}
