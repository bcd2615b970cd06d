package com.workspacepilot.orchestrator.run;

import com.workspacepilot.orchestrator.backend.Backend;
import com.workspacepilot.orchestrator.model.RemoteRun;
import com.workspacepilot.orchestrator.model.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Waits for a remote run to reach a terminal status.
 *
 * States:
 *   any non-terminal status → poll again after {@code pollInterval}
 *   APPLIED                 → return the run
 *   ERRORED                 → {@link RunFailedException}
 *   CANCELED / FORCE_CANCELED / DISCARDED → return the run, logged as a warning;
 *                             the caller decides what that means
 *
 * The deadline is checked before every poll, so a run that never finishes
 * is polled at most {@code ceil(timeout / pollInterval) + 1} times. A failed
 * status fetch ends the wait immediately with {@link RunPollException}.
 *
 * Holds no per-run state; one tracker serves every workspace.
 */
public class RunTracker {

    private static final Logger log = LoggerFactory.getLogger(RunTracker.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_TIMEOUT       = Duration.ofMinutes(30);

    private final Backend  backend;
    private final Duration pollInterval;
    private final Duration defaultTimeout;
    private final Clock    clock;
    private final Sleeper  sleeper;
    private final Counter  polls;

    public RunTracker(Backend backend, Duration pollInterval, Duration defaultTimeout,
                      Clock clock, Sleeper sleeper, MeterRegistry meterRegistry) {
        this.backend        = backend;
        this.pollInterval   = pollInterval;
        this.defaultTimeout = defaultTimeout;
        this.clock          = clock;
        this.sleeper        = sleeper;
        this.polls          = meterRegistry.counter("workspacepilot.run.polls");
    }

    /** Wait using the configured default timeout. */
    public RemoteRun awaitTerminal(String runId) throws InterruptedException {
        return awaitTerminal(runId, defaultTimeout);
    }

    /**
     * Poll until the run is terminal or {@code timeout} has elapsed.
     *
     * @throws RunTimeoutException  deadline passed while the run was still in progress
     * @throws RunFailedException   the run ended ERRORED
     * @throws RunPollException     the status could not be fetched
     * @throws InterruptedException the waiting thread was interrupted
     */
    public RemoteRun awaitTerminal(String runId, Duration timeout) throws InterruptedException {
        Instant start = clock.instant();
        log.info("Waiting for run {} to complete (timeout {}s)", runId, timeout.toSeconds());

        while (true) {
            Duration elapsed = Duration.between(start, clock.instant());
            if (elapsed.compareTo(timeout) > 0) {
                throw new RunTimeoutException(runId, elapsed.toSeconds());
            }

            RemoteRun run;
            try {
                polls.increment();
                run = backend.getRun(runId);
            } catch (RuntimeException e) {
                throw new RunPollException(runId, e);
            }

            RunStatus status = run.status();
            log.info("Run {} status: {}", runId, status.wireName());

            if (status.isTerminal()) {
                if (status == RunStatus.ERRORED) {
                    throw new RunFailedException(runId, status);
                }
                if (status == RunStatus.APPLIED) {
                    log.info("Run {} completed successfully", runId);
                } else {
                    log.warn("Run {} ended with status: {}", runId, status.wireName());
                }
                return run;
            }

            sleeper.sleep(pollInterval);
        }
    }
}
