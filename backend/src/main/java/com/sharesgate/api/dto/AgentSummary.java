package com.sharesgate.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record AgentSummary(
        @JsonProperty("agent_name") String agentName,
        @JsonProperty("subject_address") String subjectAddress,
        @JsonProperty("created_at") Instant createdAt
) {
}
