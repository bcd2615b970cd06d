package com.workspacepilot.orchestrator.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Status of a remote run as reported by the backend.
 *
 * Transitions (happy path):
 *   PENDING → PLAN_QUEUED → PLANNING → PLANNED → … → APPLY_QUEUED → APPLYING → APPLIED
 *
 * APPLIED, ERRORED, CANCELED, FORCE_CANCELED and DISCARDED are terminal.
 * A wire value this enum does not know maps to UNKNOWN and is treated as
 * still in progress.
 */
public enum RunStatus {
    PENDING,
    PLAN_QUEUED,
    PLANNING,
    PLANNED,
    COST_ESTIMATING,
    COST_ESTIMATED,
    POLICY_CHECKING,
    POLICY_OVERRIDE,
    POLICY_SOFT_FAILED,
    POLICY_CHECKED,
    CONFIRMED,
    APPLY_QUEUED,
    APPLYING,
    APPLIED,
    DISCARDED,
    ERRORED,
    CANCELED,
    FORCE_CANCELED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == APPLIED || this == ERRORED || this == CANCELED
            || this == FORCE_CANCELED || this == DISCARDED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunStatus fromWireName(String value) {
        if (value == null) return UNKNOWN;
        return Arrays.stream(values())
                .filter(s -> s.wireName().equals(value))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
