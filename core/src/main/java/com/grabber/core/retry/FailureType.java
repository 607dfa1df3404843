package com.grabber.core.retry;

/**
 * Why a backend gave up on a URL.
 */
public enum FailureType {
    NONE,
    TRANSIENT,
    ACCESS_BLOCKED,
    AUTHENTICATION,
    CONFIGURATION,
    TIMEOUT,
    DEADLINE,
    CANCELLED
}
