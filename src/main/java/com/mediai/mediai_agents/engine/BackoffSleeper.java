package com.mediai.mediai_agents.engine;

/**
 * Blocking wait between connection attempts. Swapped out in tests to observe the waits.
 */
@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD_SLEEP = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
