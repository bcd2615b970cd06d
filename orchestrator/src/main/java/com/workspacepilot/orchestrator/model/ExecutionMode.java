package com.workspacepilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Where the remote backend executes runs for a workspace. */
public enum ExecutionMode {
    REMOTE,
    LOCAL,
    AGENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionMode fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
