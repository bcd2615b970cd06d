package com.workspacepilot.orchestrator.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * JSON:API error document returned with non-2xx responses.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorPayload(List<Entry> errors) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(String status, String title, String detail) {}
}
