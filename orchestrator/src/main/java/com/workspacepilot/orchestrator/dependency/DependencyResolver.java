package com.workspacepilot.orchestrator.dependency;

import com.workspacepilot.orchestrator.model.ActionType;
import com.workspacepilot.orchestrator.model.ExecutionPlan;
import com.workspacepilot.orchestrator.model.WorkspaceConfiguration;
import com.workspacepilot.orchestrator.model.WorkspaceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a configuration into the order in which its workspaces are visited.
 *
 * <ul>
 *   <li>CREATE / DELETE: declaration order; nothing depends on anything at run time.</li>
 *   <li>APPLY: topological order, every workspace after all of its dependencies.</li>
 *   <li>DESTROY: the APPLY order reversed, every workspace before its dependents.</li>
 * </ul>
 *
 * The sort is a depth-first traversal with three colours. The outer loop and
 * each dependency list are walked in declaration order, so a given
 * configuration always resolves to the same plan.
 *
 * Stateless; one instance is shared by every invocation.
 */
@Component
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private enum Mark { IN_PROGRESS, DONE }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    /**
     * Reject a configuration that can never be executed.
     *
     * Self dependencies and unknown dependencies are rejected for every
     * action. Cycles only matter for ordered actions and are found by a
     * trial resolution.
     *
     * @throws SelfDependencyException    a workspace lists itself
     * @throws UnknownDependencyException a dependency is not declared
     * @throws DependencyCycleException   APPLY/DESTROY only
     */
    public void validate(WorkspaceConfiguration config) {
        for (WorkspaceNode node : config.nodes()) {
            for (String dep : node.dependsOn()) {
                if (dep.equals(node.name())) {
                    throw new SelfDependencyException(node.name());
                }
                if (!config.contains(dep)) {
                    throw new UnknownDependencyException(node.name(), dep);
                }
            }
        }
        if (config.action().isOrdered()) {
            resolveExecutionOrder(config);
        }
    }

    // ------------------------------------------------------------------
    // Resolution
    // ------------------------------------------------------------------

    /**
     * @throws UnknownDependencyException a dependency is not declared (ordered actions)
     * @throws DependencyCycleException   the relation is cyclic (ordered actions)
     */
    public ExecutionPlan resolveExecutionOrder(WorkspaceConfiguration config) {
        ActionType action = config.action();
        List<String> order = switch (action) {
            case CREATE, DELETE -> config.workspaceNames();
            case APPLY          -> topologicalOrder(config);
            case DESTROY        -> reversed(topologicalOrder(config));
        };
        ExecutionPlan plan = new ExecutionPlan(action, order);
        log.debug("Resolved plan: {}", plan);
        return plan;
    }

    private List<String> topologicalOrder(WorkspaceConfiguration config) {
        Map<String, Mark> marks = new HashMap<>();
        List<String> path   = new ArrayList<>();
        List<String> sorted = new ArrayList<>(config.size());

        for (String name : config.workspaceNames()) {
            if (marks.get(name) != Mark.DONE) {
                visit(config, name, marks, path, sorted);
            }
        }
        return sorted;
    }

    private void visit(WorkspaceConfiguration config, String name,
                       Map<String, Mark> marks, List<String> path, List<String> sorted) {
        Mark mark = marks.get(name);
        if (mark == Mark.DONE) return;
        if (mark == Mark.IN_PROGRESS) {
            // The path holds every node on the current branch; the cycle is
            // the suffix starting at the first occurrence of this node.
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(name), path.size()));
            cycle.add(name);
            throw new DependencyCycleException(cycle);
        }

        marks.put(name, Mark.IN_PROGRESS);
        path.add(name);

        for (String dep : config.node(name).dependsOn()) {
            if (!config.contains(dep)) {
                throw new UnknownDependencyException(name, dep);
            }
            visit(config, dep, marks, path, sorted);
        }

        path.remove(path.size() - 1);
        marks.put(name, Mark.DONE);
        sorted.add(name);
    }

    private static List<String> reversed(List<String> order) {
        List<String> copy = new ArrayList<>(order);
        Collections.reverse(copy);
        return copy;
    }
}
