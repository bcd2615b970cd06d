package com.workspacepilot.orchestrator.service;

import com.workspacepilot.orchestrator.model.ActionType;
import com.workspacepilot.orchestrator.model.OperationResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;

/**
 * Runs one per-workspace attempt so that nothing escapes it.
 *
 * Every attempt:
 * <ul>
 *   <li>carries {@code action} and {@code workspace} in the MDC, so every log
 *       line written by the backend or tracker on this thread is tagged;</li>
 *   <li>is timed and counted:
 *       <pre>
 *   workspacepilot.workspace.operations{action, outcome="success|failure"}
 *   workspacepilot.workspace.duration{action}
 *       </pre></li>
 *   <li>turns any exception into a failed {@link OperationResult}.</li>
 * </ul>
 */
@Component
public class WorkspaceAttempts {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceAttempts.class);

    private final MeterRegistry meterRegistry;

    public WorkspaceAttempts(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public OperationResult attempt(ActionType action, String workspace, Callable<OperationResult> body) {
        MDC.put("action",    action.wireName());
        MDC.put("workspace", workspace);
        Timer.Sample sample = Timer.start(meterRegistry);
        OperationResult result;
        try {
            result = body.call();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while running {} for workspace {}", action.wireName(), workspace);
            result = OperationResult.failed(workspace, "Interrupted while waiting for workspace " + workspace);
        } catch (Exception e) {
            String message = describe(e);
            log.error("Failed to {} workspace {}: {}", action.wireName(), workspace, message);
            log.debug("Failure detail for workspace {}", workspace, e);
            result = OperationResult.failed(workspace, message);
        } finally {
            sample.stop(meterRegistry.timer("workspacepilot.workspace.duration", "action", action.wireName()));
            MDC.remove("action");
            MDC.remove("workspace");
        }
        meterRegistry.counter("workspacepilot.workspace.operations",
                "action", action.wireName(),
                "outcome", result.success() ? "success" : "failure").increment();
        return result;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
