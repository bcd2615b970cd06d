package com.workspacepilot.orchestrator.service;

import com.workspacepilot.orchestrator.backend.Backend;
import com.workspacepilot.orchestrator.model.ActionType;
import com.workspacepilot.orchestrator.model.OperationResult;
import com.workspacepilot.orchestrator.model.OrchestrationContext;
import com.workspacepilot.orchestrator.model.WorkspaceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;

/** DELETE: every workspace in parallel, one remote call each. */
@Component
public class DeleteWorkspacesStrategy extends ParallelWorkspaceStrategy {

    private static final Logger log = LoggerFactory.getLogger(DeleteWorkspacesStrategy.class);

    private final Backend backend;

    public DeleteWorkspacesStrategy(Backend backend, ExecutorService workspaceWorkers, WorkspaceAttempts attempts) {
        super(workspaceWorkers, attempts);
        this.backend = backend;
    }

    @Override
    public ActionType action() {
        return ActionType.DELETE;
    }

    @Override
    protected OperationResult runOne(OrchestrationContext ctx, WorkspaceNode node) {
        backend.deleteWorkspace(ctx.organization(), node.name());
        log.info("Workspace deleted: {}", node.name());
        return OperationResult.succeeded(node.name());
    }
}
