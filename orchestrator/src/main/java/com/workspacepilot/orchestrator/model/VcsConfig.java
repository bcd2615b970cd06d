package com.workspacepilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * VCS repository linked to a workspace at creation time.
 *
 * @param repository   repository identifier, e.g. "org/infra-network"
 * @param branch       branch to track; null means the repository default
 * @param oauthTokenId OAuth client token the backend uses to read the repository
 */
public record VcsConfig(
        String repository,
        String branch,
        @JsonProperty("oauth-token-id") String oauthTokenId
) {}
