package com.sharesgate.api.dto;

/**
 * GET /agents/{agent_name}: {@code agent} is null when no agent has that name.
 */
public record AgentResponse(AgentSummary agent, boolean success) {
}
