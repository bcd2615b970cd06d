package com.workspacepilot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The lifecycle operation a configuration asks for.
 *
 * CREATE and DELETE have no ordering requirement and fan out in parallel.
 * APPLY walks the dependency graph forwards (dependencies first), DESTROY
 * walks it backwards (dependents first).
 */
public enum ActionType {
    CREATE,
    DELETE,
    APPLY,
    DESTROY;

    /** True for actions whose execution order must respect dependencies. */
    public boolean isOrdered() {
        return this == APPLY || this == DESTROY;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse the lower-case action name used in configuration files.
     *
     * @throws IllegalArgumentException for an unknown name; the message lists the valid ones
     */
    @JsonCreator
    public static ActionType fromWireName(String value) {
        return Arrays.stream(values())
                .filter(a -> a.wireName().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid action: " + value + ". Must be one of: " + validNames()));
    }

    public static String validNames() {
        return Arrays.stream(values()).map(ActionType::wireName).collect(Collectors.joining(", "));
    }
}
