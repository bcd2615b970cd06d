package com.workspacepilot.orchestrator.config;

import com.workspacepilot.orchestrator.backend.Backend;
import com.workspacepilot.orchestrator.backend.TfeBackend;
import com.workspacepilot.orchestrator.model.OrchestrationContext;
import com.workspacepilot.orchestrator.run.RunTracker;
import com.workspacepilot.orchestrator.run.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the engine's collaborators from {@code workspacepilot.*} properties.
 *
 * The backend and the organization are built here once and injected into
 * the strategies and the orchestrator, never looked up globally.
 */
@Configuration
public class OrchestratorConfiguration {

    @Bean
    @ConditionalOnMissingBean
    MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    Backend backend(@Value("${workspacepilot.tfe.hostname:app.terraform.io}") String hostname,
                    @Value("${workspacepilot.tfe.token}") String token,
                    @Value("${workspacepilot.tfe.connect-timeout:10s}") Duration connectTimeout,
                    @Value("${workspacepilot.tfe.request-timeout:120s}") Duration requestTimeout,
                    ObjectMapper objectMapper) {
        return new TfeBackend(hostname, token, objectMapper, connectTimeout, requestTimeout);
    }

    @Bean
    OrchestrationContext orchestrationContext(@Value("${workspacepilot.tfe.organization}") String organization) {
        return new OrchestrationContext(organization);
    }

    @Bean
    RunTracker runTracker(Backend backend,
                          @Value("${workspacepilot.run.poll-interval:5s}") Duration pollInterval,
                          @Value("${workspacepilot.run.timeout:30m}") Duration timeout,
                          MeterRegistry meterRegistry) {
        return new RunTracker(backend, pollInterval, timeout, Clock.systemUTC(), Sleeper.THREAD, meterRegistry);
    }

    // One thread per in-flight workspace: every create/delete of a plan starts at once.
    @Bean(destroyMethod = "shutdown")
    ExecutorService workspaceWorkers() {
        return Executors.newCachedThreadPool();
    }
}
