package com.workspacepilot.orchestrator.model;

import java.util.List;
import java.util.Objects;

/**
 * One named workspace in a configuration together with the names of the
 * workspaces it depends on.
 *
 * Names are case-sensitive. Whether every entry of {@code dependsOn} exists
 * is checked by the resolver, not here.
 */
public record WorkspaceNode(String name, List<String> dependsOn, WorkspaceOptions options) {

    public WorkspaceNode {
        Objects.requireNonNull(name, "name");
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        options   = options == null ? WorkspaceOptions.defaults() : options;
    }

    public static WorkspaceNode of(String name, String... dependsOn) {
        return new WorkspaceNode(name, List.of(dependsOn), WorkspaceOptions.defaults());
    }
}
