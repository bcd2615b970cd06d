package com.workspacepilot.orchestrator.service;

import com.workspacepilot.orchestrator.backend.Backend;
import com.workspacepilot.orchestrator.model.ActionType;
import com.workspacepilot.orchestrator.model.OperationResult;
import com.workspacepilot.orchestrator.model.OrchestrationContext;
import com.workspacepilot.orchestrator.model.WorkspaceNode;
import com.workspacepilot.orchestrator.model.WorkspaceOptions;
import com.workspacepilot.orchestrator.model.WorkspaceRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;

/**
 * CREATE: every workspace in parallel.
 *
 * Per workspace: create it, attach the shared variable set if one is
 * configured, then create its variables in declaration order. A failing
 * step skips the remaining steps of that workspace only.
 */
@Component
public class CreateWorkspacesStrategy extends ParallelWorkspaceStrategy {

    private static final Logger log = LoggerFactory.getLogger(CreateWorkspacesStrategy.class);

    private final Backend backend;

    public CreateWorkspacesStrategy(Backend backend, ExecutorService workspaceWorkers, WorkspaceAttempts attempts) {
        super(workspaceWorkers, attempts);
        this.backend = backend;
    }

    @Override
    public ActionType action() {
        return ActionType.CREATE;
    }

    @Override
    protected OperationResult runOne(OrchestrationContext ctx, WorkspaceNode node) {
        String name = node.name();
        WorkspaceOptions options = node.options();

        WorkspaceRef ref = backend.createWorkspace(ctx.organization(), name, options);
        log.info("Workspace created: {} ({})", name, ref.id());

        if (options.hasVariableSet()) {
            backend.attachVariableSet(options.variableSetId(), ref.id());
            log.info("Variable set {} attached to workspace {}", options.variableSetId(), name);
        }

        if (options.hasVariables()) {
            backend.createVariables(ref.id(), options.variables());
            log.info("{} variable(s) created for workspace {}", options.variables().size(), name);
        }

        return OperationResult.succeeded(name, ref.id(), ref.url());
    }
}
