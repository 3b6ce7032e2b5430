package com.mainframe.transpiler.codegen;

import com.mainframe.transpiler.diagnostics.TranspilerException;

/**
 * A template could not be loaded or processed. Wraps FreeMarker's {@code TemplateException} and
 * the {@code IOException} of template loading.
 */
public class TemplateRenderingException extends TranspilerException {

    private final String templateName;

    public TemplateRenderingException(String templateName, Throwable cause) {
        super("Failed to render template " + templateName + ": " + cause.getMessage(), cause);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
