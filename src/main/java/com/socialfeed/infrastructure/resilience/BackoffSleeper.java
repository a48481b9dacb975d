package com.socialfeed.infrastructure.resilience;

@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD_SLEEP = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
