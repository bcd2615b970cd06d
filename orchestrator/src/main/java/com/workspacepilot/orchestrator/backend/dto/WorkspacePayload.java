package com.workspacepilot.orchestrator.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request and response bodies for /organizations/{org}/workspaces.
 */
public final class WorkspacePayload {

    private WorkspacePayload() {}

    // ------------------------------------------------------------------
    // POST body
    // ------------------------------------------------------------------

    public record CreateRequest(CreateData data) {}

    public record CreateData(String type, CreateAttributes attributes) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CreateAttributes(
            String name,
            @JsonProperty("auto-apply")        boolean autoApply,
            @JsonProperty("terraform-version") String terraformVersion,
            @JsonProperty("execution-mode")    String executionMode,
            @JsonProperty("vcs-repo")          VcsRepo vcsRepo
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record VcsRepo(
            String identifier,
            @JsonProperty("oauth-token-id") String oauthTokenId,
            String branch
    ) {}

    // ------------------------------------------------------------------
    // Response
    // ------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Response(Data data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(String id, String type, Attributes attributes) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Attributes(String name, @JsonProperty("html-url") String htmlUrl) {}
}
