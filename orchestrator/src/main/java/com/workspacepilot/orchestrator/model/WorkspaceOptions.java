package com.workspacepilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-workspace options carried through the engine untouched.
 *
 * Only the backend interprets these; the orchestration core looks at
 * {@link #variableSetId()} and {@link #variables()} solely to decide which
 * create steps to run.
 *
 * @param autoApply        null means the backend default (false)
 * @param terraformVersion null means the backend default ("latest")
 * @param executionMode    null means the backend default (remote)
 * @param vcs              optional VCS link
 * @param variableSetId    shared variable set to attach after creation
 * @param variables        workspace variables, created in declaration order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkspaceOptions(
        @JsonProperty("auto-apply")        Boolean autoApply,
        @JsonProperty("terraform-version") String terraformVersion,
        @JsonProperty("execution-mode")    ExecutionMode executionMode,
        VcsConfig vcs,
        @JsonProperty("variable-set-id")   String variableSetId,
        Map<String, Object> variables
) {
    public WorkspaceOptions {
        variables = variables == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static WorkspaceOptions defaults() {
        return new WorkspaceOptions(null, null, null, null, null, null);
    }

    public boolean hasVariableSet() {
        return variableSetId != null && !variableSetId.isBlank();
    }

    public boolean hasVariables() {
        return !variables.isEmpty();
    }
}
