package com.workspacepilot.orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed configuration: the requested action plus every declared workspace.
 *
 * Declaration order is preserved; the resolver uses it as the outer loop of
 * its traversal, which makes the resulting plan deterministic.
 */
public final class WorkspaceConfiguration {

    private final ActionType action;
    private final Map<String, WorkspaceNode> workspaces;

    public WorkspaceConfiguration(ActionType action, List<WorkspaceNode> nodes) {
        this.action = Objects.requireNonNull(action, "action");
        Map<String, WorkspaceNode> byName = new LinkedHashMap<>();
        for (WorkspaceNode node : nodes) {
            if (byName.putIfAbsent(node.name(), node) != null) {
                throw new IllegalArgumentException("Duplicate workspace name: " + node.name());
            }
        }
        this.workspaces = Collections.unmodifiableMap(byName);
    }

    public static WorkspaceConfiguration of(ActionType action, WorkspaceNode... nodes) {
        return new WorkspaceConfiguration(action, List.of(nodes));
    }

    public ActionType action() { return action; }

    /** Workspace names in declaration order. */
    public List<String> workspaceNames() {
        return new ArrayList<>(workspaces.keySet());
    }

    public List<WorkspaceNode> nodes() {
        return List.copyOf(workspaces.values());
    }

    public boolean contains(String name) {
        return workspaces.containsKey(name);
    }

    /** @throws IllegalArgumentException if the name is not declared */
    public WorkspaceNode node(String name) {
        WorkspaceNode node = workspaces.get(name);
        if (node == null) {
            throw new IllegalArgumentException("Workspace not declared: " + name);
        }
        return node;
    }

    public int size() { return workspaces.size(); }
}
