package com.workspacepilot.orchestrator.model;

/** A remote run as last observed: its opaque id and status. */
public record RemoteRun(String id, RunStatus status) {

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** True only for APPLIED; canceled and discarded runs are terminal but not successful. */
    public boolean isApplied() {
        return status == RunStatus.APPLIED;
    }
}
