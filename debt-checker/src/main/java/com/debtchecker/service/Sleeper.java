package com.debtchecker.service;

import java.time.Duration;

/**
 * Backoff sleep between retries. Swapped out in tests so retries run instantly.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
