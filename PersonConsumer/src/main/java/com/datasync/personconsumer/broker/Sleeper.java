package com.datasync.personconsumer.broker;

/**
 * Waits between connection attempts. Replaced in tests to observe the
 * backoff schedule without waiting on the wall clock.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
