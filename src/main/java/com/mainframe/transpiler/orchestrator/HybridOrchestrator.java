package com.mainframe.transpiler.orchestrator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.augment.AugmentationCache;
import com.mainframe.transpiler.augment.AugmentationClient;
import com.mainframe.transpiler.augment.AugmentationProvider;
import com.mainframe.transpiler.augment.DisabledAugmentationProvider;
import com.mainframe.transpiler.codegen.CodeGenerator;
import com.mainframe.transpiler.config.TranspilerConfig;
import com.mainframe.transpiler.diagnostics.ProgramDiagnostics;
import com.mainframe.transpiler.diagnostics.TranspilerException;
import com.mainframe.transpiler.mapping.FunctionalityMapping;
import com.mainframe.transpiler.mapping.MappingExporter;

/**
 * Runs the pipeline over every program under the source roots, {@code parallelism} programs at a
 * time. Programs share nothing but the code generator, the augmentation cache and the claims on
 * output files; a failure in one is recorded in its report and never affects the others.
 */
public class HybridOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(HybridOrchestrator.class);

    public static final String MAPPINGS_FILE_NAME = "mappings.json";

    /** Programs; copy members ({@code .cpy}) are only ever included. */
    static final Set<String> PROGRAM_EXTENSIONS = Set.of(".cobol", ".cbl", ".cob");

    private final TranspilerConfig config;
    private final AugmentationProvider provider;
    private final AugmentationCache cache;

    public HybridOrchestrator(TranspilerConfig config, AugmentationProvider provider) {
        this.config = config;
        this.provider = provider;
        this.cache = new AugmentationCache(config.getAugmentationCacheTtl());
    }

    public HybridOrchestrator(TranspilerConfig config) {
        this(config, new DisabledAugmentationProvider());
    }

    /**
     * Transpiles everything and waits for the result.
     */
    public RunReport run() throws IOException {
        return start().await();
    }

    /**
     * Starts transpiling every program and returns at once.
     */
    public TranspilationRun start() throws IOException {
        List<SourceFile> sources = discover();
        log.info("Transpiling {} program(s) with parallelism {}", sources.size(), config.getParallelism());

        CodeGenerator generator = new CodeGenerator(config.getTemplateSet());
        AugmentationClient augmentation = AugmentationClient.builder()
                .provider(provider)
                .cache(cache)
                .timeout(config.getAugmentationTimeout())
                .maxAttempts(config.getAugmentationMaxAttempts())
                .initialBackoff(config.getAugmentationInitialBackoff())
                .build();
        ProgramPipeline pipeline = new ProgramPipeline(config, generator, augmentation);

        AtomicBoolean cancelled = new AtomicBoolean();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, config.getParallelism()), workerThreads());
        List<Future<ProgramReport>> futures = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (SourceFile source : sources) {
            names.add(source.relativePath.toString());
            futures.add(executor.submit(() -> transpile(source, pipeline, cancelled)));
        }
        return new TranspilationRun(names, futures, cancelled, executor, augmentation, this::complete);
    }

    private ProgramReport transpile(SourceFile source, ProgramPipeline pipeline, AtomicBoolean cancelled) {
        if (cancelled.get()) {
            log.info("Skipping {}: run cancelled", source.relativePath);
            return ProgramReport.cancelled(source.relativePath.toString());
        }
        long started = System.nanoTime();
        ProgramContext ctx = new ProgramContext(source.path, source.relativePath);
        pipeline.run(ctx);
        ProgramReport report = report(ctx, (System.nanoTime() - started) / 1_000_000);
        log.info("{}: {}{}", source.relativePath, report.getStatus(),
                report.getOutput() != null ? " -> " + report.getOutput() : "");
        return report;
    }

    ProgramReport report(ProgramContext ctx, long elapsedMillis) {
        ProgramDiagnostics diagnostics = ctx.getDiagnostics();
        ProgramStatus status;
        if (ctx.getState() != ProgramState.DONE) {
            status = ProgramStatus.FAILED;
        } else if (diagnostics.hasEdgeCases() || diagnostics.hasSemanticErrors()) {
            status = ProgramStatus.SUCCESS_WITH_EDGE_CASES;
        } else {
            status = ProgramStatus.SUCCESS;
        }

        ProgramReport.ProgramReportBuilder report = ProgramReport.builder()
                .source(ctx.getRelativePath().toString())
                .status(status)
                .stages(ctx.getHistory())
                .errors(diagnostics.errorMessages())
                .elapsedMillis(elapsedMillis);
        if (ctx.getParse() != null) {
            report.programId(ctx.getParse().getProgramId());
        }
        if (ctx.getTranslation() != null) {
            report.unitName(ctx.getTranslation().getProgram().getUnitName());
        }
        if (ctx.getOutput() != null) {
            report.output(ctx.getOutput().toString());
        }
        diagnostics.getEdgeCases().forEach(e -> report.edgeCase(ProgramReport.EdgeCaseEntry.of(e)));
        diagnostics.getFlowWarnings().forEach(w -> report.warning(w.getKind() + " " + w.getParagraph() + ": " + w.getMessage()));
        ctx.getAugmentations().forEach((id, result) -> {
            if (result.isSuccess()) {
                report.augmentationHint(id, result.getHint());
            } else {
                report.augmentationError(id, result.getError());
            }
        });
        report.mappings(ctx.getMappings());
        if (config.isValidate() && !ctx.getMappings().isEmpty()) {
            report.mappingConfidence(ctx.getMappings().stream()
                    .mapToDouble(FunctionalityMapping::getConfidence)
                    .average()
                    .orElse(0.0));
        }
        return report.build();
    }

    private void complete(RunReport report) {
        log.info("Run finished: {} succeeded, {} with edge cases, {} failed, {} cancelled",
                report.count(ProgramStatus.SUCCESS), report.count(ProgramStatus.SUCCESS_WITH_EDGE_CASES),
                report.count(ProgramStatus.FAILED), report.count(ProgramStatus.CANCELLED));
        if (!config.isWriteReports()) {
            return;
        }
        try {
            Path written = report.write(config.getOutputRoot());
            log.info("Run report written to {}", written);
            new MappingExporter().write(report.getMappings(), config.getOutputRoot().resolve(MAPPINGS_FILE_NAME));
        } catch (IOException e) {
            throw new TranspilerException("Could not write the run report to " + config.getOutputRoot(), e);
        }
    }

    /**
     * Program files under the source roots, in path order within each root.
     */
    List<SourceFile> discover() throws IOException {
        List<SourceFile> out = new ArrayList<>();
        for (Path root : config.getSourceRoots()) {
            if (Files.isRegularFile(root)) {
                if (isProgram(root)) {
                    out.add(new SourceFile(root, root.getFileName()));
                }
                continue;
            }
            try (Stream<Path> files = Files.walk(root)) {
                List<Path> programs = files.filter(Files::isRegularFile)
                        .filter(HybridOrchestrator::isProgram)
                        .sorted()
                        .collect(Collectors.toList());
                for (Path program : programs) {
                    out.add(new SourceFile(program, root.relativize(program)));
                }
            }
        }
        return out;
    }

    static boolean isProgram(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && PROGRAM_EXTENSIONS.contains(name.substring(dot));
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "transpiler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    static final class SourceFile {
        final Path path;
        final Path relativePath;

        SourceFile(Path path, Path relativePath) {
            this.path = path;
            this.relativePath = relativePath;
        }
    }
}
