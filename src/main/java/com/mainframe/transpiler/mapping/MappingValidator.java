package com.mainframe.transpiler.mapping;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.interp.ExecutionResult;
import com.mainframe.transpiler.interp.IrInterpreter;
import com.mainframe.transpiler.ir.IrProgram;

/**
 * Runs a program's IR once with empty files and no console input and records, on each mapping,
 * whether its paragraph was reached and how the run ended.
 */
public class MappingValidator {
    private static final Logger log = LoggerFactory.getLogger(MappingValidator.class);

    private final long stepLimit;

    public MappingValidator(long stepLimit) {
        this.stepLimit = stepLimit;
    }

    public MappingValidator() {
        this(IrInterpreter.DEFAULT_STEP_LIMIT);
    }

    public ExecutionResult validate(IrProgram program, List<FunctionalityMapping> mappings) {
        ExecutionResult run = IrInterpreter.builder()
                .program(program)
                .stepLimit(stepLimit)
                .build()
                .run();

        String prefix = program.getProgramId() + ".";
        for (FunctionalityMapping mapping : mappings) {
            if (!mapping.getFunctionalityId().startsWith(prefix)) {
                continue;
            }
            String paragraph = mapping.getFunctionalityId().substring(prefix.length());
            int count = run.getParagraphCounts().getOrDefault(paragraph, 0);
            if (count > 0) {
                mapping.addFinding("validation run executed the paragraph " + count + " time(s)");
            } else {
                mapping.addFinding("validation run did not reach the paragraph");
            }
            if (!run.isSucceeded()) {
                mapping.addFinding("validation run failed: " + run.getFailure());
            }
        }
        log.info("Validated {}: {} steps, {} of {} paragraphs reached{}", program.getUnitName(), run.getSteps(),
                run.executedParagraphs(), program.getParagraphs().size(),
                run.isSucceeded() ? "" : ", failed: " + run.getFailure());
        return run;
    }
}
