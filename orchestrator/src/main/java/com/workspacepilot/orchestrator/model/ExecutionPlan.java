package com.workspacepilot.orchestrator.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The ordered workspace names one invocation will visit.
 *
 * For APPLY this is a topological order of the dependency graph, for DESTROY
 * its exact reverse. For CREATE and DELETE the order only fixes the order in
 * which results are reported.
 */
public record ExecutionPlan(ActionType action, List<String> order) {

    public ExecutionPlan {
        order = List.copyOf(order);
        Set<String> seen = new HashSet<>();
        for (String name : order) {
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate workspace in plan: " + name);
            }
        }
    }

    public int size() { return order.size(); }

    @Override
    public String toString() {
        return action.wireName() + " " + String.join(" -> ", order);
    }
}
