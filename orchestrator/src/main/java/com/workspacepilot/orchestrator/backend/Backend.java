package com.workspacepilot.orchestrator.backend;

import com.workspacepilot.orchestrator.model.RemoteRun;
import com.workspacepilot.orchestrator.model.WorkspaceOptions;
import com.workspacepilot.orchestrator.model.WorkspaceRef;

import java.util.Map;

/**
 * The remote provisioning service the orchestrator drives.
 *
 * Every method makes exactly one logical remote call (createVariables makes
 * one per variable) and either succeeds or throws {@link BackendException}.
 * Implementations never retry; the caller treats a failure as terminal for
 * the workspace it belongs to.
 */
public interface Backend {

    /** Create a workspace; options are interpreted by the implementation. */
    WorkspaceRef createWorkspace(String organization, String name, WorkspaceOptions options);

    /** Look up an existing workspace by name. */
    WorkspaceRef getWorkspace(String organization, String name);

    void deleteWorkspace(String organization, String name);

    void attachVariableSet(String variableSetId, String workspaceId);

    /** Create each variable in the map's iteration order, stopping at the first failure. */
    void createVariables(String workspaceId, Map<String, Object> variables);

    /** Queue a run; the returned status is whatever the backend reports straight away. */
    RemoteRun createRun(String workspaceId, String message, boolean isDestroy, boolean autoApply);

    /** Fetch the current status of a run. */
    RemoteRun getRun(String runId);
}
