package com.workspacepilot.orchestrator.service;

import com.workspacepilot.orchestrator.backend.Backend;
import com.workspacepilot.orchestrator.model.ActionType;
import com.workspacepilot.orchestrator.run.RunTracker;
import org.springframework.stereotype.Component;

/**
 * APPLY: dependencies first, stop at the first failure.
 *
 * A workspace whose dependency failed to apply must not be applied on top
 * of it, so later workspaces in the plan are never attempted.
 */
@Component
public class ApplyWorkspacesStrategy extends SequentialRunStrategy {

    static final String RUN_MESSAGE = "Apply triggered by WorkspacePilot";

    public ApplyWorkspacesStrategy(Backend backend, RunTracker runTracker, WorkspaceAttempts attempts) {
        super(backend, runTracker, attempts);
    }

    @Override
    public ActionType action()       { return ActionType.APPLY; }

    @Override
    protected String runMessage()    { return RUN_MESSAGE; }

    @Override
    protected boolean isDestroy()    { return false; }

    @Override
    protected boolean stopOnFailure() { return true; }
}
