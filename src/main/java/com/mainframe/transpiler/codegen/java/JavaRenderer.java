package com.mainframe.transpiler.codegen.java;

import java.util.Map;

import com.mainframe.transpiler.codegen.TargetRenderer;
import com.mainframe.transpiler.codegen.model.UnitModel;
import com.mainframe.transpiler.ir.IrProgram;

/**
 * Renders a program as one Java class that depends on the JDK only. Records become nested static
 * classes, paragraphs and ranges become methods, and the data rules live in the nested
 * {@code Rt} helper the template supplies.
 */
public class JavaRenderer implements TargetRenderer {

    @Override
    public String templateSet() {
        return "java";
    }

    @Override
    public String extension() {
        return ".java";
    }

    @Override
    public UnitModel render(IrProgram program, Map<String, String> hints) {
        return new JavaUnitRenderer(program, hints).render();
    }
}
