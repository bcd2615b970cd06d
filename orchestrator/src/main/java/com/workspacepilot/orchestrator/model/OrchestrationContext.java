package com.workspacepilot.orchestrator.model;

import java.util.Objects;

/**
 * Per-invocation state handed explicitly to the engine instead of being held
 * globally, so the whole engine can run against a fake backend.
 *
 * @param organization organization that owns every workspace in the configuration
 */
public record OrchestrationContext(String organization) {
    public OrchestrationContext {
        Objects.requireNonNull(organization, "organization");
    }
}
