package com.mainframe.transpiler.augment;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either a hint with the provider's confidence in it, or the reason there is none.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AugmentationResult {
    String hint;
    double confidence;
    AugmentationError error;

    public static AugmentationResult success(String hint, double confidence) {
        return new AugmentationResult(hint, confidence, null);
    }

    public static AugmentationResult failure(AugmentationError error) {
        return new AugmentationResult(null, 0.0, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * A success whose hint is blank or whose confidence lies outside [0, 1] is not usable.
     */
    public boolean isWellFormed() {
        return isSuccess() && hint != null && !hint.isBlank() && confidence >= 0.0 && confidence <= 1.0;
    }
}
