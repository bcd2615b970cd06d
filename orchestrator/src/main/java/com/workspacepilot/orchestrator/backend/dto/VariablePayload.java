package com.workspacepilot.orchestrator.backend.dto;

/**
 * POST body for /workspaces/{id}/vars. Values are always sent as strings.
 */
public record VariablePayload(Data data) {

    public record Data(String type, Attributes attributes) {}

    public record Attributes(String key, String value, String category, boolean hcl, boolean sensitive) {}

    /** A plain, non-sensitive Terraform variable. */
    public static VariablePayload terraform(String key, Object value) {
        return new VariablePayload(new Data("vars",
                new Attributes(key, String.valueOf(value), "terraform", false, false)));
    }
}
