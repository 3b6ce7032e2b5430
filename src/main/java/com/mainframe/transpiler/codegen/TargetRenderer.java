package com.mainframe.transpiler.codegen;

import java.util.Map;

import com.mainframe.transpiler.codegen.model.UnitModel;
import com.mainframe.transpiler.ir.IrProgram;

/**
 * Renders the IR of one program into the model a target's templates lay out.
 */
public interface TargetRenderer {

    /** Template set under {@code /templates/}. */
    String templateSet();

    /** File extension of generated units, with the dot. */
    String extension();

    /**
     * @param hints augmentation hints by edge-case id; emitted as comments next to their statements
     */
    UnitModel render(IrProgram program, Map<String, String> hints);
}
