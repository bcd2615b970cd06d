package com.workspacepilot.orchestrator.dependency;

import com.workspacepilot.orchestrator.config.ConfigurationException;

/**
 * A workspace lists a dependency that is not declared in the same configuration.
 */
public class UnknownDependencyException extends ConfigurationException {

    private final String workspace;
    private final String dependency;

    public UnknownDependencyException(String workspace, String dependency) {
        super("Workspace '" + workspace + "' depends on '" + dependency
              + "', but '" + dependency + "' is not defined in the configuration");
        this.workspace  = workspace;
        this.dependency = dependency;
    }

    public String getWorkspace()  { return workspace; }
    public String getDependency() { return dependency; }
}
