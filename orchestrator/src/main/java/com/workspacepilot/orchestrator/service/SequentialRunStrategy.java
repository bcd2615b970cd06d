package com.workspacepilot.orchestrator.service;

import com.workspacepilot.orchestrator.backend.Backend;
import com.workspacepilot.orchestrator.model.ExecutionPlan;
import com.workspacepilot.orchestrator.model.OperationResult;
import com.workspacepilot.orchestrator.model.OrchestrationContext;
import com.workspacepilot.orchestrator.model.RemoteRun;
import com.workspacepilot.orchestrator.model.WorkspaceConfiguration;
import com.workspacepilot.orchestrator.model.WorkspaceRef;
import com.workspacepilot.orchestrator.run.RunTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one remote run per workspace, strictly one after another, in plan order.
 *
 * Per workspace: look up its id, queue an auto-applying run, wait for the
 * run to finish. Workspace N+1 is not touched until workspace N's wait has
 * ended, successfully or not.
 *
 * A run that ends CANCELED, FORCE_CANCELED or DISCARDED is a failure here,
 * exactly like an ERRORED run: it counts towards {@link #stopOnFailure()}.
 */
abstract class SequentialRunStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(SequentialRunStrategy.class);

    private final Backend           backend;
    private final RunTracker        runTracker;
    private final WorkspaceAttempts attempts;

    protected SequentialRunStrategy(Backend backend, RunTracker runTracker, WorkspaceAttempts attempts) {
        this.backend    = backend;
        this.runTracker = runTracker;
        this.attempts   = attempts;
    }

    /** Message attached to every run this strategy queues. */
    protected abstract String runMessage();

    protected abstract boolean isDestroy();

    /** True: the first failure ends the invocation. False: record it and move on. */
    protected abstract boolean stopOnFailure();

    @Override
    public List<OperationResult> execute(OrchestrationContext ctx, WorkspaceConfiguration config, ExecutionPlan plan) {
        log.info("Running {} on {} workspace(s) sequentially: {}",
                action().wireName(), plan.size(), String.join(" -> ", plan.order()));

        List<OperationResult> results = new ArrayList<>(plan.size());
        for (String name : plan.order()) {
            OperationResult result = attempts.attempt(action(), name, () -> runOne(ctx, name));
            results.add(result);

            if (!result.success()) {
                if (stopOnFailure()) {
                    log.error("Stopping {} due to failure in workspace: {}", action().wireName(), name);
                    break;
                }
                log.warn("Failed to {} workspace {}, continuing with remaining workspaces...",
                        action().wireName(), name);
            }
        }
        return results;
    }

    private OperationResult runOne(OrchestrationContext ctx, String name) throws InterruptedException {
        WorkspaceRef ref = backend.getWorkspace(ctx.organization(), name);
        RemoteRun run = backend.createRun(ref.id(), runMessage(), isDestroy(), true);
        log.info("Run {} created for workspace {}", run.id(), name);

        RemoteRun finished = runTracker.awaitTerminal(run.id());
        if (!finished.isApplied()) {
            return new OperationResult(name, false, ref.id(), ref.url(),
                    "Run " + finished.id() + " ended with status " + finished.status().wireName());
        }

        log.info("Workspace {} finished {}", name, action().wireName());
        return OperationResult.succeeded(name, ref.id(), ref.url());
    }
}
