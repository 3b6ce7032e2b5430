package com.mainframe.transpiler.codegen.python;

import java.util.Map;

import com.mainframe.transpiler.codegen.TargetRenderer;
import com.mainframe.transpiler.codegen.model.UnitModel;
import com.mainframe.transpiler.ir.IrProgram;

/**
 * Renders a program as one Python module: a dataclass per group, a class for the program whose
 * methods are the paragraphs and ranges, and module-level helpers for the data rules.
 */
public class PythonRenderer implements TargetRenderer {

    @Override
    public String templateSet() {
        return "python";
    }

    @Override
    public String extension() {
        return ".py";
    }

    @Override
    public UnitModel render(IrProgram program, Map<String, String> hints) {
        return new PythonUnitRenderer(program, hints).render();
    }
}
