package com.mainframe.transpiler.augment;

/**
 * Why an augmentation request produced no hint.
 */
public enum AugmentationError {
    /** No provider is configured, or the provider refused the request. */
    UNAVAILABLE,

    /** The provider did not answer within the configured timeout on any attempt. */
    TIMEOUT,

    /** The provider answered with something that is not a usable hint. */
    INVALID_RESPONSE
}
