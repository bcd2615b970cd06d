package com.workspacepilot.orchestrator.run;

/**
 * Fetching the run status failed; says nothing about the run itself.
 */
public class RunPollException extends RuntimeException {

    private final String runId;

    public RunPollException(String runId, Throwable cause) {
        super("Failed to poll run " + runId + ": " + cause.getMessage(), cause);
        this.runId = runId;
    }

    public String getRunId() { return runId; }
}
