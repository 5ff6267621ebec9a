package com.sharesgate.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * POST /verify-signature body. {@code challenge} is the Telegram user id the wallet signed.
 */
public record ChallengeRequest(
        @NotBlank String challenge,
        @NotBlank @JsonProperty("chat_id") String chatId,
        @NotBlank String signature,
        @NotBlank String user,
        @JsonProperty("chain_type") String chainType
) {
}
