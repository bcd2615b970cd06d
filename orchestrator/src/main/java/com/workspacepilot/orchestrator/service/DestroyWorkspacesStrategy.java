package com.workspacepilot.orchestrator.service;

import com.workspacepilot.orchestrator.backend.Backend;
import com.workspacepilot.orchestrator.model.ActionType;
import com.workspacepilot.orchestrator.run.RunTracker;
import org.springframework.stereotype.Component;

/**
 * DESTROY: dependents first (the resolver already reversed the plan), keep
 * going after a failure so every reachable workspace is torn down.
 */
@Component
public class DestroyWorkspacesStrategy extends SequentialRunStrategy {

    static final String RUN_MESSAGE = "Destroy triggered by WorkspacePilot";

    public DestroyWorkspacesStrategy(Backend backend, RunTracker runTracker, WorkspaceAttempts attempts) {
        super(backend, runTracker, attempts);
    }

    @Override
    public ActionType action()       { return ActionType.DESTROY; }

    @Override
    protected String runMessage()    { return RUN_MESSAGE; }

    @Override
    protected boolean isDestroy()    { return true; }

    @Override
    protected boolean stopOnFailure() { return false; }
}
