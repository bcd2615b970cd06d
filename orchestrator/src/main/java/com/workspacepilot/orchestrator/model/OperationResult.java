package com.workspacepilot.orchestrator.model;

/**
 * Outcome of one attempted workspace within one invocation.
 *
 * Workspaces skipped because an apply stopped early have no result at all.
 */
public record OperationResult(
        String  workspace,
        boolean success,
        String  workspaceId,    // null when the remote id was never learned
        String  workspaceUrl,   // only known after create
        String  error           // null on success
) {
    public static OperationResult succeeded(String workspace, String workspaceId, String workspaceUrl) {
        return new OperationResult(workspace, true, workspaceId, workspaceUrl, null);
    }

    public static OperationResult succeeded(String workspace) {
        return succeeded(workspace, null, null);
    }

    public static OperationResult failed(String workspace, String error) {
        return new OperationResult(workspace, false, null, null, error);
    }
}
