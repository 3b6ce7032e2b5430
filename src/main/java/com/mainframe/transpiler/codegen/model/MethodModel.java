package com.mainframe.transpiler.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class MethodModel {
    String name;

    /** Parameter list with its parentheses. */
    @Builder.Default
    String parameters = "()";

    /** Return type for Java; ignored by targets without declared types. */
    @Builder.Default
    String returnType = "void";

    @Singular("comment")
    List<String> comments;

    @Singular("line")
    List<String> body;
}
