package com.sharesgate.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AgentListResponse(
        List<AgentSummary> agents,
        long total,
        int page,
        @JsonProperty("page_size") int pageSize
) {
}
