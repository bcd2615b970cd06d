package com.workspacepilot.orchestrator.backend;

import com.workspacepilot.orchestrator.backend.dto.ErrorPayload;
import com.workspacepilot.orchestrator.backend.dto.RunPayload;
import com.workspacepilot.orchestrator.backend.dto.VariablePayload;
import com.workspacepilot.orchestrator.backend.dto.WorkspacePayload;
import com.workspacepilot.orchestrator.model.ExecutionMode;
import com.workspacepilot.orchestrator.model.RemoteRun;
import com.workspacepilot.orchestrator.model.RunStatus;
import com.workspacepilot.orchestrator.model.VcsConfig;
import com.workspacepilot.orchestrator.model.WorkspaceOptions;
import com.workspacepilot.orchestrator.model.WorkspaceRef;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link Backend} for the Terraform Enterprise / Terraform Cloud v2 API.
 *
 * Speaks JSON:API over java.net.http.HttpClient with a bearer token. Each
 * call checks for the one status code the API documents as success and
 * turns anything else into a {@link BackendException} whose message is
 * built from the response's errors[] block.
 *
 * Calls block; the orchestrator invokes them from its worker pool (create,
 * delete) or from the caller thread (apply, destroy).
 */
public class TfeBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(TfeBackend.class);

    private static final String CONTENT_TYPE = "application/vnd.api+json";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       token;
    private final Duration     requestTimeout;

    public TfeBackend(String hostname, String token, ObjectMapper objectMapper,
                      Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(connectTimeout).build(),
             hostname, token, objectMapper, requestTimeout);
    }

    TfeBackend(HttpClient http, String hostname, String token,
               ObjectMapper objectMapper, Duration requestTimeout) {
        this.http           = http;
        this.baseUrl        = "https://" + hostname + "/api/v2";
        this.token          = token;
        this.json           = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    // ------------------------------------------------------------------
    // Workspaces
    // ------------------------------------------------------------------

    @Override
    public WorkspaceRef createWorkspace(String organization, String name, WorkspaceOptions options) {
        ExecutionMode mode = options.executionMode() == null ? ExecutionMode.REMOTE : options.executionMode();
        VcsConfig vcs = options.vcs();
        WorkspacePayload.VcsRepo vcsRepo = null;
        if (vcs != null) {
            log.info("Configuring VCS for workspace '{}': repository={} branch={}",
                    name, vcs.repository(), vcs.branch() == null ? "default" : vcs.branch());
            vcsRepo = new WorkspacePayload.VcsRepo(vcs.repository(), vcs.oauthTokenId(), vcs.branch());
        }
        var request = new WorkspacePayload.CreateRequest(new WorkspacePayload.CreateData("workspaces",
                new WorkspacePayload.CreateAttributes(
                        name,
                        Boolean.TRUE.equals(options.autoApply()),
                        options.terraformVersion() == null ? "latest" : options.terraformVersion(),
                        mode.wireName(),
                        vcsRepo)));

        log.info("Creating workspace '{}' in organization '{}'", name, organization);
        String body = send(post("/organizations/" + segment(organization) + "/workspaces", toJson(request)),
                201, "Failed to create workspace");
        return toRef(parse(body, WorkspacePayload.Response.class, "Failed to create workspace"),
                "Failed to create workspace");
    }

    @Override
    public WorkspaceRef getWorkspace(String organization, String name) {
        log.info("Getting workspace {}/{}", organization, name);
        String body = send(request("/organizations/" + segment(organization) + "/workspaces/" + segment(name)).GET().build(),
                200, "Failed to get workspace");
        return toRef(parse(body, WorkspacePayload.Response.class, "Failed to get workspace"),
                "Failed to get workspace");
    }

    @Override
    public void deleteWorkspace(String organization, String name) {
        log.info("Deleting workspace {}/{}", organization, name);
        send(request("/organizations/" + segment(organization) + "/workspaces/" + segment(name)).DELETE().build(),
                204, "Failed to delete workspace");
    }

    // ------------------------------------------------------------------
    // Variables
    // ------------------------------------------------------------------

    @Override
    public void attachVariableSet(String variableSetId, String workspaceId) {
        log.info("Attaching variable set {} to workspace {}", variableSetId, workspaceId);
        String body = toJson(Map.of("data", List.of(Map.of("type", "workspaces", "id", workspaceId))));
        send(post("/varsets/" + segment(variableSetId) + "/relationships/workspaces", body),
                204, "Failed to attach variable set");
    }

    @Override
    public void createVariables(String workspaceId, Map<String, Object> variables) {
        log.debug("Creating {} variables for workspace {}", variables.size(), workspaceId);
        for (Map.Entry<String, Object> entry : variables.entrySet()) {
            String body = toJson(VariablePayload.terraform(entry.getKey(), entry.getValue()));
            send(post("/workspaces/" + segment(workspaceId) + "/vars", body),
                    201, "Failed to create variable '" + entry.getKey() + "'");
            log.debug("Created variable {}", entry.getKey());
        }
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    @Override
    public RemoteRun createRun(String workspaceId, String message, boolean isDestroy, boolean autoApply) {
        log.info("Creating run for workspace {} (destroy={}, autoApply={}): {}",
                workspaceId, isDestroy, autoApply, message);
        String body = send(post("/runs", toJson(RunPayload.create(workspaceId, message, isDestroy, autoApply))),
                201, "Failed to create run");
        return toRun(parse(body, RunPayload.Response.class, "Failed to create run"), "Failed to create run");
    }

    @Override
    public RemoteRun getRun(String runId) {
        String body = send(request("/runs/" + segment(runId)).GET().build(), 200, "Failed to get run status");
        return toRun(parse(body, RunPayload.Response.class, "Failed to get run status"), "Failed to get run status");
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + token)
                .header("Content-Type",  CONTENT_TYPE)
                .header("Accept",        CONTENT_TYPE);
    }

    /** Percent-encode one path segment; a space or '/' in a name stays inside its segment. */
    static String segment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private HttpRequest post(String path, String jsonBody) {
        return request(path).POST(HttpRequest.BodyPublishers.ofString(jsonBody)).build();
    }

    /** Send and return the body; any status other than {@code expected} is an error. */
    private String send(HttpRequest req, int expected, String failurePrefix) {
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(failurePrefix + ": interrupted", e);
        } catch (Exception e) {
            throw new BackendException(failurePrefix + ": " + e.getMessage(), e);
        }
        if (resp.statusCode() != expected) {
            String message = formatError(resp.statusCode(), resp.body());
            log.error("{} ({} {}): {}", failurePrefix, req.method(), req.uri(), message);
            throw new BackendException(resp.statusCode(), failurePrefix + ": " + message);
        }
        return resp.body();
    }

    /**
     * "HTTP 422: detail one, detail two" from the errors[] block, or a fixed
     * explanation for the common statuses when the body has none.
     */
    String formatError(int statusCode, String body) {
        ErrorPayload errors = null;
        if (body != null && !body.isBlank()) {
            try {
                errors = json.readValue(body, ErrorPayload.class);
            } catch (JsonProcessingException e) {
                log.debug("Error body is not a JSON:API document: {}", e.getOriginalMessage());
            }
        }
        if (errors != null && errors.errors() != null && !errors.errors().isEmpty()) {
            return "HTTP " + statusCode + ": " + errors.errors().stream()
                    .map(e -> e.detail() != null ? e.detail() : e.title() != null ? e.title() : "Unknown error")
                    .collect(Collectors.joining(", "));
        }
        return switch (statusCode) {
            case 401 -> "HTTP 401: Unauthorized - Invalid TFE token";
            case 404 -> "HTTP 404: Organization not found";
            case 422 -> "HTTP 422: Unprocessable Entity - Check workspace name and organization";
            default  -> "HTTP " + statusCode + ": Request failed";
        };
    }

    private WorkspaceRef toRef(WorkspacePayload.Response resp, String failurePrefix) {
        if (resp.data() == null || resp.data().id() == null) {
            throw new BackendException(failurePrefix + ": No response data from TFE API", null);
        }
        return new WorkspaceRef(resp.data().id(),
                resp.data().attributes() == null ? null : resp.data().attributes().htmlUrl());
    }

    private RemoteRun toRun(RunPayload.Response resp, String failurePrefix) {
        if (resp.data() == null || resp.data().id() == null) {
            throw new BackendException(failurePrefix + ": No response data from TFE API", null);
        }
        return new RemoteRun(resp.data().id(),
                resp.data().attributes() == null ? RunStatus.UNKNOWN
                        : RunStatus.fromWireName(resp.data().attributes().status()));
    }

    private <T> T parse(String body, Class<T> type, String failurePrefix) {
        try {
            T value = json.readValue(body, type);
            if (value == null) {
                throw new BackendException(failurePrefix + ": No response data from TFE API", null);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new BackendException(failurePrefix + ": unreadable response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new BackendException("JSON serialization failed", e);
        }
    }
}
