package com.workspacepilot.orchestrator.dependency;

import com.workspacepilot.orchestrator.config.ConfigurationException;

import java.util.List;

/**
 * The dependency relation contains a cycle.
 *
 * {@link #getCycle()} starts at the first repeated workspace and ends with
 * it again, e.g. [a, b, c, a].
 */
public class DependencyCycleException extends ConfigurationException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() { return cycle; }
}
