package com.workspacepilot.orchestrator.run;

import java.time.Duration;

/**
 * Suspends the polling thread between status checks.
 * Swapped for a clock-advancing fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
}
