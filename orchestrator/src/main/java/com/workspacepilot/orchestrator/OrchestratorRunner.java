package com.workspacepilot.orchestrator;

import com.workspacepilot.orchestrator.config.ConfigurationException;
import com.workspacepilot.orchestrator.config.ConfigurationLoader;
import com.workspacepilot.orchestrator.model.OperationResult;
import com.workspacepilot.orchestrator.model.WorkspaceConfiguration;
import com.workspacepilot.orchestrator.service.RunSummary;
import com.workspacepilot.orchestrator.service.WorkspaceOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one invocation at startup and records the process exit code.
 *
 * The configuration file comes from the first argument, or from
 * {@code workspacepilot.config-file} when no argument is given.
 *
 * To run:
 *   WORKSPACEPILOT_TFE_TOKEN=... WORKSPACEPILOT_TFE_ORGANIZATION=acme \
 *     java -jar workspacepilot-orchestrator.jar workspaces.yml
 */
@Component
public class OrchestratorRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorRunner.class);

    private final ConfigurationLoader   loader;
    private final WorkspaceOrchestrator orchestrator;
    private final String                defaultConfigFile;

    private int exitCode = 0;

    public OrchestratorRunner(ConfigurationLoader loader,
                              WorkspaceOrchestrator orchestrator,
                              @Value("${workspacepilot.config-file:}") String defaultConfigFile) {
        this.loader            = loader;
        this.orchestrator      = orchestrator;
        this.defaultConfigFile = defaultConfigFile;
    }

    @Override
    public void run(String... args) {
        String configFile = args.length > 0 ? args[0] : defaultConfigFile;
        if (configFile == null || configFile.isBlank()) {
            log.error("No configuration file given; pass it as the first argument or set workspacepilot.config-file");
            exitCode = 2;
            return;
        }

        try {
            WorkspaceConfiguration config = loader.load(Path.of(configFile));
            List<OperationResult> results = orchestrator.execute(config);

            RunSummary summary = new RunSummary(config.action(), results);
            summary.lines().forEach(log::info);
            if (summary.exitCode() != 0) {
                log.warn("{} workspace(s) failed", summary.failed().size());
            } else {
                log.info("All operations completed successfully!");
            }
            exitCode = summary.exitCode();
        } catch (ConfigurationException e) {
            log.error("Action failed: {}", e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
