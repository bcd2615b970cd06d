package com.workspacepilot.orchestrator.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request and response bodies for /runs.
 */
public final class RunPayload {

    private RunPayload() {}

    public record CreateRequest(CreateData data) {}

    public record CreateData(String type, CreateAttributes attributes, Relationships relationships) {}

    public record CreateAttributes(
            String message,
            @JsonProperty("auto-apply") boolean autoApply,
            @JsonProperty("is-destroy") boolean destroy
    ) {}

    public record Relationships(WorkspaceLink workspace) {}

    public record WorkspaceLink(ResourceId data) {}

    public record ResourceId(String type, String id) {}

    /** Build the body for a run against one workspace. */
    public static CreateRequest create(String workspaceId, String message, boolean isDestroy, boolean autoApply) {
        return new CreateRequest(new CreateData("runs",
                new CreateAttributes(message, autoApply, isDestroy),
                new Relationships(new WorkspaceLink(new ResourceId("workspaces", workspaceId)))));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Response(Data data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(String id, Attributes attributes) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Attributes(String status) {}
}
