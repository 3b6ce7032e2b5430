package com.mainframe.transpiler.orchestrator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.augment.AugmentationClient;

/**
 * A run in progress. Cancelling it stops programs that have not started yet; a program already
 * running finishes normally, and its output appears whole or not at all.
 */
public class TranspilationRun {
    private static final Logger log = LoggerFactory.getLogger(TranspilationRun.class);

    private final List<String> sources;
    private final List<Future<ProgramReport>> programs;
    private final AtomicBoolean cancelled;
    private final ExecutorService executor;
    private final AugmentationClient augmentation;
    private final Consumer<RunReport> onComplete;
    private RunReport report;

    TranspilationRun(List<String> sources, List<Future<ProgramReport>> programs, AtomicBoolean cancelled,
                     ExecutorService executor, AugmentationClient augmentation, Consumer<RunReport> onComplete) {
        this.sources = sources;
        this.programs = programs;
        this.cancelled = cancelled;
        this.executor = executor;
        this.augmentation = augmentation;
        this.onComplete = onComplete;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Run cancelled; programs not yet started will be reported as CANCELLED");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Waits for every program and returns the report. Calling it again returns the same report.
     */
    public synchronized RunReport await() {
        if (report != null) {
            return report;
        }
        List<ProgramReport> reports = new ArrayList<>();
        try {
            for (int i = 0; i < programs.size(); i++) {
                reports.add(outcome(i));
            }
        } finally {
            executor.shutdown();
            augmentation.close();
        }
        report = new RunReport(List.copyOf(reports));
        onComplete.accept(report);
        return report;
    }

    private ProgramReport outcome(int index) {
        try {
            return programs.get(index).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return ProgramReport.cancelled(sources.get(index));
        } catch (ExecutionException e) {
            log.error("Program {} ended abnormally", sources.get(index), e.getCause());
            return ProgramReport.builder()
                    .source(sources.get(index))
                    .status(ProgramStatus.FAILED)
                    .error("internal error: " + e.getCause())
                    .build();
        }
    }
}
