package com.mainframe.transpiler.codegen;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.codegen.java.JavaRenderer;
import com.mainframe.transpiler.codegen.model.UnitModel;
import com.mainframe.transpiler.codegen.python.PythonRenderer;
import com.mainframe.transpiler.codegen.util.FileWriteUtil;
import com.mainframe.transpiler.ir.IrProgram;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Turns the IR of one program into target source: the target renderer builds the unit model,
 * the template set's {@code unit.ftl} lays it out. Output depends on the IR only, so rendering
 * the same program twice gives the same text.
 */
public class CodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(CodeGenerator.class);

    public static final String DEFAULT_TEMPLATE_SET = "java";

    private final TargetRenderer renderer;
    private final Configuration freemarkerConfig;

    public CodeGenerator(TargetRenderer renderer) {
        this.renderer = renderer;
        this.freemarkerConfig = createFreemarkerConfig();
    }

    public CodeGenerator(String templateSet) {
        this(rendererFor(templateSet));
    }

    public CodeGenerator() {
        this(DEFAULT_TEMPLATE_SET);
    }

    public static TargetRenderer rendererFor(String templateSet) {
        switch (templateSet) {
            case "java":
                return new JavaRenderer();
            case "python":
                return new PythonRenderer();
            default:
                throw new IllegalArgumentException("Unknown template set: " + templateSet);
        }
    }

    public TargetRenderer getRenderer() {
        return renderer;
    }

    /**
     * File name of the unit generated for {@code program}.
     */
    public String fileName(IrProgram program) {
        return program.getUnitName() + renderer.extension();
    }

    public String render(IrProgram program, Map<String, String> hints) {
        UnitModel unit = renderer.render(program, hints);
        String templateName = renderer.templateSet() + "/unit.ftl";
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(Map.of("unit", unit), out);
            log.debug("Rendered {} with {}: {} paragraphs, {} ranges", program.getUnitName(), templateName,
                    unit.getParagraphs().size(), unit.getRegions().size());
            return out.toString();
        } catch (TemplateException | IOException e) {
            throw new TemplateRenderingException(templateName, e);
        }
    }

    /**
     * Renders {@code program} and writes it into {@code outputDir}, replacing any earlier version
     * in one move.
     *
     * @return the written file
     */
    public Path generate(IrProgram program, Map<String, String> hints, Path outputDir) throws IOException {
        String source = render(program, hints);
        Path target = outputDir.resolve(fileName(program));
        FileWriteUtil.atomicWriteString(target, source);
        log.info("Generated {}", target);
        return target;
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setNumberFormat("computer");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }
}
