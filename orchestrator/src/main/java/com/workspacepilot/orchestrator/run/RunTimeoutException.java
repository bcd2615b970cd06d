package com.workspacepilot.orchestrator.run;

/**
 * The run was still in progress when the polling deadline passed.
 */
public class RunTimeoutException extends RuntimeException {

    private final String runId;
    private final long   elapsedSeconds;

    public RunTimeoutException(String runId, long elapsedSeconds) {
        super("Run " + runId + " timed out after " + elapsedSeconds + " seconds");
        this.runId          = runId;
        this.elapsedSeconds = elapsedSeconds;
    }

    public String getRunId()          { return runId; }
    public long   getElapsedSeconds() { return elapsedSeconds; }
}
