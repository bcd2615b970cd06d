package com.workspacepilot.orchestrator.config;

/**
 * Thrown by {@link ConfigurationLoader} when the document itself is unusable:
 * unparsable YAML, a missing or unknown action, or no workspaces.
 */
public class InvalidConfigurationException extends ConfigurationException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
