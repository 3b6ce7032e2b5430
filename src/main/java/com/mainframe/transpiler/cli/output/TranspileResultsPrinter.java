package com.mainframe.transpiler.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.cli.model.TranspileOptions;
import com.mainframe.transpiler.cli.model.ValidatedTranspileOptions;
import com.mainframe.transpiler.orchestrator.HybridOrchestrator;
import com.mainframe.transpiler.orchestrator.ProgramReport;
import com.mainframe.transpiler.orchestrator.ProgramStatus;
import com.mainframe.transpiler.orchestrator.RunReport;

/**
 * Responsible only for printing CLI output for the "transpile" command.
 * No validation, no execution.
 */
public class TranspileResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(TranspileResultsPrinter.class);

    public void printBanner(TranspileOptions o, ValidatedTranspileOptions v) {
        log.info("=================================================");
        log.info("COBOL Transpiler");
        log.info("=================================================");
        log.info("Source Directories: {}", v.getSourceRoots());
        log.info("Copybook Directories: {}", v.getCopybookDirs().isEmpty() ? "None" : v.getCopybookDirs());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Target: {}", o.getTarget());
        log.info("Source Format: {} (right margin {})", o.getFormat(), o.getRightMargin());
        log.info("Parallelism: {}", v.getParallelism());
        log.info("Validation: {}", o.isValidate() ? "enabled" : "disabled");
        log.info("=================================================");
    }

    public void printSummary(RunReport report, ValidatedTranspileOptions v, boolean reportsWritten) {
        log.info("");
        log.info("=================================================");
        log.info(report.isSuccess() ? "TRANSPILATION SUCCESSFUL" : "TRANSPILATION FINISHED WITH FAILURES");
        log.info("=================================================");
        log.info("Programs: {}", report.getPrograms().size());
        log.info("  Succeeded: {}", report.count(ProgramStatus.SUCCESS));
        log.info("  Succeeded with edge cases: {}", report.count(ProgramStatus.SUCCESS_WITH_EDGE_CASES));
        log.info("  Failed: {}", report.count(ProgramStatus.FAILED));
        if (report.count(ProgramStatus.CANCELLED) > 0) {
            log.info("  Cancelled: {}", report.count(ProgramStatus.CANCELLED));
        }

        for (ProgramReport program : report.getPrograms()) {
            log.info("");
            log.info("{} [{}]", program.getSource(), program.getStatus());
            if (program.getOutput() != null) {
                log.info("  Output: {}", program.getOutput());
            }
            for (ProgramReport.EdgeCaseEntry edgeCase : program.getEdgeCases()) {
                log.info("  {} {} {} at {}: {}", edgeCase.getId(), edgeCase.getSeverity(), edgeCase.getCategory(),
                        edgeCase.getLocation(), edgeCase.getMessage());
            }
            for (String error : program.getErrors()) {
                log.error("  {}", error);
            }
            if (program.getMappingConfidence() != null) {
                log.info("  Mapping confidence: {}", String.format("%.2f", program.getMappingConfidence()));
            }
        }

        if (reportsWritten) {
            log.info("");
            log.info("Run report: {}", v.getNormalizedOutputDir().resolve(RunReport.FILE_NAME));
            log.info("Functionality mappings: {}", v.getNormalizedOutputDir().resolve(HybridOrchestrator.MAPPINGS_FILE_NAME));
        }
        log.info("=================================================");
    }
}
