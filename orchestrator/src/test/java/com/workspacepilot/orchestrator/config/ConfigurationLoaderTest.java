package com.workspacepilot.orchestrator.config;

import com.workspacepilot.orchestrator.model.ActionType;
import com.workspacepilot.orchestrator.model.ExecutionMode;
import com.workspacepilot.orchestrator.model.WorkspaceConfiguration;
import com.workspacepilot.orchestrator.model.WorkspaceNode;
import com.workspacepilot.orchestrator.model.WorkspaceOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigurationLoaderTest {

    final ConfigurationLoader loader = new ConfigurationLoader();

    @Test
    void parse_fullDocument_keepsOrderAndOptions() {
        WorkspaceConfiguration config = loader.parse("""
                action: apply
                workspaces:
                  network:
                    auto-apply: true
                    terraform-version: 1.6.0
                    execution-mode: local
                    variable-set-id: varset-1
                    vcs:
                      repository: acme/network
                      branch: main
                      oauth-token-id: ot-1
                  app:
                    dependsOn: [network]
                    variables:
                      region: eu-west-1
                      replicas: 3
                      public: false
                  monitoring:
                """);

        assertThat(config.action()).isEqualTo(ActionType.APPLY);
        assertThat(config.workspaceNames()).containsExactly("network", "app", "monitoring");

        WorkspaceOptions network = config.node("network").options();
        assertThat(network.autoApply()).isTrue();
        assertThat(network.terraformVersion()).isEqualTo("1.6.0");
        assertThat(network.executionMode()).isEqualTo(ExecutionMode.LOCAL);
        assertThat(network.variableSetId()).isEqualTo("varset-1");
        assertThat(network.vcs().repository()).isEqualTo("acme/network");
        assertThat(network.vcs().oauthTokenId()).isEqualTo("ot-1");

        WorkspaceNode app = config.node("app");
        assertThat(app.dependsOn()).containsExactly("network");
        assertThat(app.options().variables()).containsKeys("region", "replicas", "public");
        assertThat(app.options().variables().keySet()).containsExactly("region", "replicas", "public");
        assertThat(app.options().variables().get("replicas")).isEqualTo(3);

        WorkspaceNode monitoring = config.node("monitoring");
        assertThat(monitoring.dependsOn()).isEmpty();
        assertThat(monitoring.options().hasVariables()).isFalse();
    }

    @Test
    void load_readsFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("workspaces.yml");
        Files.writeString(file, "action: destroy\nworkspaces:\n  network: {}\n");

        WorkspaceConfiguration config = loader.load(file);

        assertThat(config.action()).isEqualTo(ActionType.DESTROY);
        assertThat(config.workspaceNames()).containsExactly("network");
    }

    @Test
    void load_missingFile_isConfigurationError(@TempDir Path dir) {
        assertThatThrownBy(() -> loader.load(dir.resolve("nope.yml")))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("nope.yml");
    }

    @Test
    void parse_missingAction_rejected() {
        assertThatThrownBy(() -> loader.parse("workspaces:\n  network: {}\n"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessage("Configuration must specify an action (create, delete, apply, or destroy)");
    }

    @Test
    void parse_unknownAction_listsValidOnes() {
        assertThatThrownBy(() -> loader.parse("action: plan\nworkspaces:\n  network: {}\n"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessage("Invalid action: plan. Must be one of: create, delete, apply, destroy");
    }

    @Test
    void parse_noWorkspaces_rejected() {
        assertThatThrownBy(() -> loader.parse("action: create\nworkspaces: {}\n"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessage("Configuration must specify at least one workspace");
        assertThatThrownBy(() -> loader.parse("action: create\n"))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void parse_brokenYaml_rejected() {
        assertThatThrownBy(() -> loader.parse("action: [create\nworkspaces:"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageStartingWith("Failed to parse YAML configuration");
    }

    @Test
    void parse_workspaceDeclaredTwice_rejected() {
        assertThatThrownBy(() -> loader.parse("""
                action: apply
                workspaces:
                  a: {}
                  b:
                    dependsOn: [a]
                  a:
                    dependsOn: [b]
                """))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageStartingWith("Failed to parse YAML configuration")
                .hasMessageContaining("Duplicate field 'a'");
    }

    @Test
    void parse_dependsOnNotAList_rejected() {
        assertThatThrownBy(() -> loader.parse("action: apply\nworkspaces:\n  app:\n    dependsOn: network\n"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("dependsOn must be a list");
    }

    @Test
    void parse_badExecutionMode_rejected() {
        assertThatThrownBy(() -> loader.parse("action: create\nworkspaces:\n  app:\n    execution-mode: cloud\n"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Workspace 'app' has invalid options");
    }

    @Test
    void parse_unknownKeysIgnored() {
        WorkspaceConfiguration config = loader.parse(
                "action: create\nworkspaces:\n  app:\n    description: ignored\n");

        assertThat(config.node("app").options()).isEqualTo(WorkspaceOptions.defaults());
    }
}
