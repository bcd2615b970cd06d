package com.workspacepilot.orchestrator.config;

/**
 * A configuration that cannot be executed at all.
 *
 * Always raised before any remote call is made; it is a precondition
 * failure for the whole invocation, never a per-workspace outcome.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
