package com.workspacepilot.orchestrator.service;

import com.workspacepilot.orchestrator.model.ActionType;
import com.workspacepilot.orchestrator.model.ExecutionPlan;
import com.workspacepilot.orchestrator.model.OperationResult;
import com.workspacepilot.orchestrator.model.OrchestrationContext;
import com.workspacepilot.orchestrator.model.WorkspaceConfiguration;

import java.util.List;

/**
 * How one action is carried out across the workspaces of a plan.
 *
 * Implementations return exactly one result per workspace they attempt, in
 * plan order, and never throw for a per-workspace failure. Whether a
 * failure stops the remaining workspaces is the strategy's decision.
 */
public interface ExecutionStrategy {

    /** The action this strategy handles; one strategy per action. */
    ActionType action();

    List<OperationResult> execute(OrchestrationContext ctx, WorkspaceConfiguration config, ExecutionPlan plan);
}
