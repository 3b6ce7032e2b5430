package com.mainframe.transpiler.augment;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * What a provider is told about a snippet besides its text.
 */
@Value
@Builder
public class AugmentationContext {
    /** Edge-case category of the snippet. */
    String kind;

    String program;
    String paragraph;

    /** Declarations of the data items the snippet refers to, one per entry. */
    @Singular("symbol")
    List<String> symbolContext;
}
