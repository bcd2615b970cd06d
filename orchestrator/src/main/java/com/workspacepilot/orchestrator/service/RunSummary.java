package com.workspacepilot.orchestrator.service;

import com.workspacepilot.orchestrator.model.ActionType;
import com.workspacepilot.orchestrator.model.OperationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * What an invocation produced, in the shape the command line reports it.
 *
 * The primary workspace is the first successful one that has a remote id;
 * for a single-workspace configuration it is simply that workspace.
 */
public record RunSummary(ActionType action, List<OperationResult> results) {

    public RunSummary {
        results = List.copyOf(results);
    }

    public List<OperationResult> successful() {
        return results.stream().filter(OperationResult::success).toList();
    }

    public List<OperationResult> failed() {
        return results.stream().filter(r -> !r.success()).toList();
    }

    public Optional<OperationResult> primary() {
        return results.stream()
                .filter(r -> r.success() && r.workspaceId() != null)
                .findFirst();
    }

    /** 0 when every attempted workspace succeeded, 1 otherwise. */
    public int exitCode() {
        return failed().isEmpty() ? 0 : 1;
    }

    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        lines.add("=".repeat(50));
        lines.add("Action: " + action.wireName());
        lines.add("Total workspaces: " + results.size());
        lines.add("Successful: " + successful().size());
        lines.add("Failed: " + failed().size());
        lines.add("=".repeat(50));
        if (!successful().isEmpty()) {
            lines.add("Successful workspaces:");
            successful().forEach(r -> lines.add("   - " + r.workspace()
                    + (r.workspaceId() != null ? " (" + r.workspaceId() + ")" : "")));
        }
        if (!failed().isEmpty()) {
            lines.add("Failed workspaces:");
            failed().forEach(r -> lines.add("   - " + r.workspace() + ": " + r.error()));
        }
        primary().ifPresent(p -> {
            lines.add("workspace-id: " + p.workspaceId());
            if (p.workspaceUrl() != null) lines.add("workspace-url: " + p.workspaceUrl());
        });
        return lines;
    }
}
