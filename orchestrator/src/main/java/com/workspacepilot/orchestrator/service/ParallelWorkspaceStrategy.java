package com.workspacepilot.orchestrator.service;

import com.workspacepilot.orchestrator.model.ExecutionPlan;
import com.workspacepilot.orchestrator.model.OperationResult;
import com.workspacepilot.orchestrator.model.OrchestrationContext;
import com.workspacepilot.orchestrator.model.WorkspaceConfiguration;
import com.workspacepilot.orchestrator.model.WorkspaceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Fan-out / fan-in over the worker pool for actions whose workspaces are
 * independent of each other.
 *
 * Every workspace is submitted before any result is awaited, and every
 * future is joined whether or not others failed. Results come back in
 * dispatch order, not completion order.
 */
abstract class ParallelWorkspaceStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(ParallelWorkspaceStrategy.class);

    private final ExecutorService   workers;
    private final WorkspaceAttempts attempts;

    protected ParallelWorkspaceStrategy(ExecutorService workers, WorkspaceAttempts attempts) {
        this.workers  = workers;
        this.attempts = attempts;
    }

    /** The remote steps for one workspace; may throw, never shared across workspaces. */
    protected abstract OperationResult runOne(OrchestrationContext ctx, WorkspaceNode node);

    @Override
    public List<OperationResult> execute(OrchestrationContext ctx, WorkspaceConfiguration config, ExecutionPlan plan) {
        log.info("Running {} on {} workspace(s) in parallel...", action().wireName(), plan.size());

        List<CompletableFuture<OperationResult>> inFlight = new ArrayList<>(plan.size());
        for (String name : plan.order()) {
            WorkspaceNode node = config.node(name);
            inFlight.add(CompletableFuture.supplyAsync(
                    () -> attempts.attempt(action(), name, () -> runOne(ctx, node)),
                    workers));
        }

        List<OperationResult> results = new ArrayList<>(inFlight.size());
        for (CompletableFuture<OperationResult> future : inFlight) {
            results.add(future.join());
        }
        return results;
    }
}
