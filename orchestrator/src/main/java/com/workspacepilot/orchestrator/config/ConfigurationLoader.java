package com.workspacepilot.orchestrator.config;

import com.workspacepilot.orchestrator.model.ActionType;
import com.workspacepilot.orchestrator.model.WorkspaceConfiguration;
import com.workspacepilot.orchestrator.model.WorkspaceNode;
import com.workspacepilot.orchestrator.model.WorkspaceOptions;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the YAML workspace document:
 * <pre>
 * action: apply
 * workspaces:
 *   network:
 *     terraform-version: 1.6.0
 *   app:
 *     dependsOn: [network]
 *     variables:
 *       region: eu-west-1
 * </pre>
 *
 * Workspace declaration order is kept. Everything other than
 * {@code dependsOn} is bound to {@link WorkspaceOptions}; unknown keys are
 * ignored.
 */
@Component
public class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    // A repeated key (e.g. the same workspace declared twice) is a parse error, not last-one-wins.
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory())
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

    public WorkspaceConfiguration load(Path file) {
        log.info("Loading workspace configuration from {}", file);
        try {
            return parse(Files.readString(file));
        } catch (IOException e) {
            throw new InvalidConfigurationException("Failed to read configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws InvalidConfigurationException unparsable YAML, a repeated key, missing or unknown action, no workspaces
     */
    public WorkspaceConfiguration parse(String document) {
        JsonNode root;
        try {
            root = yaml.readTree(document);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException("Failed to parse YAML configuration: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidConfigurationException("Failed to parse YAML configuration: document is not a mapping");
        }

        JsonNode actionNode = root.get("action");
        if (actionNode == null || actionNode.isNull() || actionNode.asText().isBlank()) {
            throw new InvalidConfigurationException(
                    "Configuration must specify an action (create, delete, apply, or destroy)");
        }
        ActionType action;
        try {
            action = ActionType.fromWireName(actionNode.asText());
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(e.getMessage(), e);
        }

        JsonNode workspaces = root.get("workspaces");
        if (workspaces == null || !workspaces.isObject() || workspaces.isEmpty()) {
            throw new InvalidConfigurationException("Configuration must specify at least one workspace");
        }

        List<WorkspaceNode> nodes = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = workspaces.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            nodes.add(toNode(field.getKey(), field.getValue()));
        }
        log.debug("Parsed {} workspace(s) for action {}", nodes.size(), action.wireName());
        return new WorkspaceConfiguration(action, nodes);
    }

    private WorkspaceNode toNode(String name, JsonNode body) {
        if (body == null || body.isNull()) {
            return new WorkspaceNode(name, List.of(), WorkspaceOptions.defaults());
        }
        if (!body.isObject()) {
            throw new InvalidConfigurationException("Workspace '" + name + "' must be a mapping");
        }

        List<String> dependsOn = new ArrayList<>();
        JsonNode deps = body.get("dependsOn");
        if (deps != null && !deps.isNull()) {
            if (!deps.isArray()) {
                throw new InvalidConfigurationException("Workspace '" + name + "': dependsOn must be a list");
            }
            for (JsonNode dep : deps) {
                if (!dep.isTextual()) {
                    throw new InvalidConfigurationException(
                            "Workspace '" + name + "': dependsOn entries must be workspace names");
                }
                dependsOn.add(dep.asText());
            }
        }

        try {
            WorkspaceOptions options = yaml.treeToValue(body, WorkspaceOptions.class);
            return new WorkspaceNode(name, dependsOn, options);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidConfigurationException(
                    "Workspace '" + name + "' has invalid options: " + e.getMessage(), e);
        }
    }
}
