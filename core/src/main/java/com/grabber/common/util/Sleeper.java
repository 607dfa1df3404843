package com.grabber.common.util;

/**
 * Blocking wait used by pacing and backoff, swappable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
