package com.grabber.core.retry;

/**
 * What the diagnostic text of a failed attempt says about the cause.
 */
public record FailureClassification(boolean ipBlocked, boolean authRejected) {

    public static final FailureClassification NONE = new FailureClassification(false, false);
}
