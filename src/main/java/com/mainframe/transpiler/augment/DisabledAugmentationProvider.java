package com.mainframe.transpiler.augment;

/**
 * Provider used when none is configured. Every request is answered {@code UNAVAILABLE}.
 */
public class DisabledAugmentationProvider implements AugmentationProvider {

    @Override
    public AugmentationResult submit(String snippet, AugmentationContext context) {
        return AugmentationResult.failure(AugmentationError.UNAVAILABLE);
    }
}
