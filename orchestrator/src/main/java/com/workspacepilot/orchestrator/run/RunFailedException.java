package com.workspacepilot.orchestrator.run;

import com.workspacepilot.orchestrator.model.RunStatus;

/**
 * The remote run reached the ERRORED state.
 */
public class RunFailedException extends RuntimeException {

    private final String    runId;
    private final RunStatus status;

    public RunFailedException(String runId, RunStatus status) {
        super("Run " + runId + " failed with status: " + status.wireName());
        this.runId  = runId;
        this.status = status;
    }

    public String    getRunId()  { return runId; }
    public RunStatus getStatus() { return status; }
}
