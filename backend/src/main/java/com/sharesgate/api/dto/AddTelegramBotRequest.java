package com.sharesgate.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * POST /add_tg_bot body. {@code chain_type} defaults to the configured default chain.
 */
public record AddTelegramBotRequest(
        @NotBlank @JsonProperty("bot_token") String botToken,
        @NotBlank @JsonProperty("chat_group_id") String chatGroupId,
        @NotBlank @JsonProperty("subject_address") String subjectAddress,
        @NotBlank @JsonProperty("agent_name") String agentName,
        @NotBlank @JsonProperty("invite_url") String inviteUrl,
        String bio,
        @JsonProperty("chain_type") String chainType
) {
}
