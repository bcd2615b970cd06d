package com.workspacepilot.orchestrator;

import com.workspacepilot.orchestrator.config.ConfigurationLoader;
import com.workspacepilot.orchestrator.config.InvalidConfigurationException;
import com.workspacepilot.orchestrator.dependency.SelfDependencyException;
import com.workspacepilot.orchestrator.model.ActionType;
import com.workspacepilot.orchestrator.model.OperationResult;
import com.workspacepilot.orchestrator.model.WorkspaceConfiguration;
import com.workspacepilot.orchestrator.model.WorkspaceNode;
import com.workspacepilot.orchestrator.service.WorkspaceOrchestrator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrchestratorRunnerTest {

    @Mock ConfigurationLoader   loader;
    @Mock WorkspaceOrchestrator orchestrator;

    static final WorkspaceConfiguration CONFIG =
            WorkspaceConfiguration.of(ActionType.CREATE, WorkspaceNode.of("network"));

    @Test
    void run_noConfigFile_exitTwo() {
        OrchestratorRunner runner = new OrchestratorRunner(loader, orchestrator, "");

        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(2);
        verifyNoInteractions(loader, orchestrator);
    }

    @Test
    void run_argumentOverridesProperty() {
        when(loader.load(Path.of("cli.yml"))).thenReturn(CONFIG);
        when(orchestrator.execute(CONFIG)).thenReturn(List.of(OperationResult.succeeded("network", "ws-1", null)));
        OrchestratorRunner runner = new OrchestratorRunner(loader, orchestrator, "property.yml");

        runner.run("cli.yml");

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void run_workspaceFailure_exitOne() {
        when(loader.load(any())).thenReturn(CONFIG);
        when(orchestrator.execute(CONFIG)).thenReturn(List.of(OperationResult.failed("network", "HTTP 500")));
        OrchestratorRunner runner = new OrchestratorRunner(loader, orchestrator, "workspaces.yml");

        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    void run_invalidFile_exitOneWithoutExecuting() {
        when(loader.load(any())).thenThrow(new InvalidConfigurationException("Configuration must specify at least one workspace"));
        OrchestratorRunner runner = new OrchestratorRunner(loader, orchestrator, "workspaces.yml");

        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(1);
        verifyNoInteractions(orchestrator);
    }

    @Test
    void run_validationError_exitOne() {
        when(loader.load(any())).thenReturn(CONFIG);
        when(orchestrator.execute(CONFIG)).thenThrow(new SelfDependencyException("network"));
        OrchestratorRunner runner = new OrchestratorRunner(loader, orchestrator, "workspaces.yml");

        runner.run();

        assertThat(runner.getExitCode()).isEqualTo(1);
    }
}
