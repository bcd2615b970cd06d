package com.workspacepilot.orchestrator.model;

/**
 * Remote identity of a workspace.
 *
 * @param id  backend id, e.g. "ws-3fX9..."
 * @param url browser URL; null when the backend did not return one
 */
public record WorkspaceRef(String id, String url) {}
