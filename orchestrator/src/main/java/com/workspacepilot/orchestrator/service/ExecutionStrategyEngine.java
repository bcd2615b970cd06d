package com.workspacepilot.orchestrator.service;

import com.workspacepilot.orchestrator.model.ActionType;
import com.workspacepilot.orchestrator.model.ExecutionPlan;
import com.workspacepilot.orchestrator.model.OperationResult;
import com.workspacepilot.orchestrator.model.OrchestrationContext;
import com.workspacepilot.orchestrator.model.WorkspaceConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a resolved plan to the strategy registered for its action.
 *
 * Spring collects every {@link ExecutionStrategy} bean and passes the list
 * here; exactly one strategy per {@link ActionType} is required.
 */
@Component
public class ExecutionStrategyEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionStrategyEngine.class);

    private final Map<ActionType, ExecutionStrategy> strategies = new EnumMap<>(ActionType.class);

    public ExecutionStrategyEngine(List<ExecutionStrategy> allStrategies) {
        for (ExecutionStrategy strategy : allStrategies) {
            ExecutionStrategy previous = strategies.put(strategy.action(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Two strategies registered for action "
                        + strategy.action().wireName() + ": "
                        + previous.getClass().getSimpleName() + ", " + strategy.getClass().getSimpleName());
            }
            log.debug("Registered {} for action {}", strategy.getClass().getSimpleName(), strategy.action().wireName());
        }
        for (ActionType action : ActionType.values()) {
            if (!strategies.containsKey(action)) {
                throw new IllegalStateException("No strategy registered for action " + action.wireName());
            }
        }
    }

    public List<OperationResult> execute(OrchestrationContext ctx, WorkspaceConfiguration config, ExecutionPlan plan) {
        if (plan.action() != config.action()) {
            throw new IllegalArgumentException("Plan was resolved for " + plan.action().wireName()
                    + " but configuration requests " + config.action().wireName());
        }
        return strategies.get(plan.action()).execute(ctx, config, plan);
    }
}
