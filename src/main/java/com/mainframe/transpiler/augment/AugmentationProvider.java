package com.mainframe.transpiler.augment;

/**
 * Something that can suggest how to translate a construct the deterministic pipeline could only
 * approximate. Implementations may block; the client bounds each call with a timeout.
 */
public interface AugmentationProvider {

    AugmentationResult submit(String snippet, AugmentationContext context);
}
