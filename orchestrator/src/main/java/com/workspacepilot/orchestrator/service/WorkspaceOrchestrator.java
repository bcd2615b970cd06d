package com.workspacepilot.orchestrator.service;

import com.workspacepilot.orchestrator.config.ConfigurationException;
import com.workspacepilot.orchestrator.dependency.DependencyResolver;
import com.workspacepilot.orchestrator.model.ExecutionPlan;
import com.workspacepilot.orchestrator.model.OperationResult;
import com.workspacepilot.orchestrator.model.OrchestrationContext;
import com.workspacepilot.orchestrator.model.WorkspaceConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for one invocation: validate, resolve, dispatch.
 *
 * Steps:
 *  1. Validate the dependency relation (self, unknown, and for apply/destroy cycles)
 *  2. Resolve the execution plan for the configured action
 *  3. Hand the plan to the strategy for that action
 *  4. Return its results unchanged
 *
 * Only {@link ConfigurationException} escapes, and always before the
 * backend has been called. Remote failures are reported in the results.
 * No state is kept between invocations.
 */
@Service
public class WorkspaceOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceOrchestrator.class);

    private final DependencyResolver      resolver;
    private final ExecutionStrategyEngine engine;
    private final OrchestrationContext    context;

    public WorkspaceOrchestrator(DependencyResolver resolver,
                                 ExecutionStrategyEngine engine,
                                 OrchestrationContext context) {
        this.resolver = resolver;
        this.engine   = engine;
        this.context  = context;
    }

    /**
     * @throws ConfigurationException the configuration cannot be executed; nothing was touched
     */
    public List<OperationResult> execute(WorkspaceConfiguration config) {
        resolver.validate(config);
        ExecutionPlan plan = resolver.resolveExecutionOrder(config);

        log.info("Action: {}", config.action().wireName());
        log.info("Workspaces to process: {}", String.join(", ", plan.order()));

        return engine.execute(context, config, plan);
    }
}
