package com.mainframe.transpiler.codegen.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A group of the record layout rendered as a type: its member declarations and the bodies of the
 * image, load and initialize operations every group type has.
 */
@Value
@Builder
public class TypeModel {
    String name;
    String cobolName;

    /** Display length of the group's image. */
    int length;

    @Singular
    List<String> fields;

    @Singular("constructorLine")
    List<String> constructor;

    @Singular("imageLine")
    List<String> image;

    @Singular("loadLine")
    List<String> load;

    @Singular("initializeLine")
    List<String> initialize;

    /** RENAMES accessors declared on the record. */
    @Singular
    List<MethodModel> accessors;

    @Singular("nestedType")
    List<TypeModel> nested;
}
