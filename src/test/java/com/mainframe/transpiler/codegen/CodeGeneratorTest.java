package com.mainframe.transpiler.codegen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mainframe.transpiler.AnalyzedProgram;
import com.mainframe.transpiler.CobolSources;
import com.mainframe.transpiler.codegen.java.JavaRenderer;
import com.mainframe.transpiler.codegen.python.PythonRenderer;
import com.mainframe.transpiler.ir.IrProgram;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for rendering target source from IR.
 */
class CodeGeneratorTest {

    @TempDir
    Path tempDir;

    private static IrProgram program(String source, String fileName) {
        return AnalyzedProgram.of(source, fileName).program();
    }

    @Test
    void testRendererForTemplateSet() {
        assertThat(CodeGenerator.rendererFor("java")).isInstanceOf(JavaRenderer.class);
        assertThat(CodeGenerator.rendererFor("python")).isInstanceOf(PythonRenderer.class);
        assertThatThrownBy(() -> CodeGenerator.rendererFor("cobol"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown template set: cobol");
    }

    @Test
    void testJavaUnit() {
        CodeGenerator generator = new CodeGenerator();
        IrProgram program = program(CobolSources.CHOICE, "CHOICE.cbl");

        String source = generator.render(program, Map.of());

        assertThat(generator.fileName(program)).isEqualTo("Chooser.java");
        assertThat(source).contains("// Generated from CHOICE.cbl (PROGRAM-ID CHOOSER). Do not edit.");
        assertThat(source).contains("public class Chooser {");
        assertThat(source).contains("    // Paragraph MAIN-PARA");
        assertThat(source).contains("    void main_para() {");
        assertThat(source).contains("public static void main(String[] args)");
        assertThat(source).contains("} else {");
        assertThat(source).contains("System.out.println(\"CHOICE IS \" + ");
    }

    @Test
    void testPythonUnit() {
        CodeGenerator generator = new CodeGenerator("python");
        IrProgram program = program(CobolSources.CHOICE, "CHOICE.cbl");

        String source = generator.render(program, Map.of());

        assertThat(generator.fileName(program)).isEqualTo("Chooser.py");
        assertThat(source).contains("class Chooser:");
        assertThat(source).contains("def main_para(self):");
        assertThat(source).contains("else:");
        assertThat(source).contains("print(\"CHOICE IS \" + ");
        assertThat(source).doesNotContain("public class");
    }

    @Test
    void testRenderingIsDeterministic() {
        CodeGenerator generator = new CodeGenerator();

        String first = generator.render(program(CobolSources.FILE_COPY, "FILECOPY.cbl"), Map.of());
        String second = generator.render(program(CobolSources.FILE_COPY, "FILECOPY.cbl"), Map.of());

        assertThat(second).isEqualTo(first);
    }

    @Test
    void testEdgeCaseCommentCarriesHint() {
        CodeGenerator generator = new CodeGenerator();
        IrProgram program = program(CobolSources.CALLER, "CALLER.cbl");

        String plain = generator.render(program, Map.of());
        String hinted = generator.render(program, Map.of("EC-1", "Call the audit service here"));

        assertThat(plain).contains("// edge case EC-1").doesNotContain("hint:");
        assertThat(hinted).contains("// EC-1 hint: Call the audit service here");
    }

    @Test
    void testBlockedParagraphRaises() {
        String java = new CodeGenerator().render(program(CobolSources.EDGE_CASES, "EDGES.cbl"), Map.of());
        String python = new CodeGenerator("python").render(program(CobolSources.EDGE_CASES, "EDGES.cbl"), Map.of());

        assertThat(java).contains("throw new IllegalStateException(\"paragraph 100-MAIN was not translated: ");
        assertThat(python).contains("raise RuntimeError(");
        assertThat(python).contains("paragraph 100-MAIN was not translated");
    }

    @Test
    void testGenerateWritesUnit() throws IOException {
        CodeGenerator generator = new CodeGenerator();
        IrProgram program = program(CobolSources.CHOICE, "CHOICE.cbl");

        Path written = generator.generate(program, Map.of(), tempDir.resolve("out"));

        assertThat(written).isEqualTo(tempDir.resolve("out").resolve("Chooser.java"));
        assertThat(Files.readString(written)).isEqualTo(generator.render(program, Map.of()));
        try (var files = Files.list(tempDir.resolve("out"))) {
            assertThat(files).hasSize(1);
        }
    }
}
