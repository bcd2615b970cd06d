package com.workspacepilot.orchestrator.dependency;

import com.workspacepilot.orchestrator.config.ConfigurationException;

public class SelfDependencyException extends ConfigurationException {

    private final String workspace;

    public SelfDependencyException(String workspace) {
        super("Workspace '" + workspace + "' cannot depend on itself");
        this.workspace = workspace;
    }

    public String getWorkspace() { return workspace; }
}
