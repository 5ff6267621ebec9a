package com.sharesgate.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AgentDetailResponse(
        @JsonProperty("agent_name") String agentName,
        @JsonProperty("subject_address") String subjectAddress,
        @JsonProperty("invite_url") String inviteUrl,
        String bio,
        @JsonProperty("chain_type") String chainType,
        boolean success
) {
}
