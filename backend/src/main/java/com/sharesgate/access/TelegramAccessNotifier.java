package com.sharesgate.access;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sharesgate.domain.Community;
import com.sharesgate.domain.GateDecision;
import com.sharesgate.domain.PermissionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Telegram Bot API {@code restrictChatMember} with the community's own bot token.
 * The token goes into the request path verbatim and is never logged.
 */
@Slf4j
public class TelegramAccessNotifier implements AccessNotifier {

    private static final String[] PERMISSIONS = {
            "can_send_messages",
            "can_send_audios",
            "can_send_documents",
            "can_send_photos",
            "can_send_videos",
            "can_send_video_notes",
            "can_send_voice_notes",
            "can_send_polls",
            "can_send_other_messages",
            "can_add_web_page_previews"
    };

    private final WebClient webClient;
    private final TelegramProperties properties;
    private final ObjectMapper objectMapper;

    public TelegramAccessNotifier(WebClient.Builder builder, TelegramProperties properties, ObjectMapper objectMapper) {
        this.webClient = builder.build();
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void apply(GateDecision decision) {
        Community community = decision.community();
        long userId = parseUserId(decision.externalIdentity());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", community.getChatGroupId());
        body.put("user_id", userId);
        body.put("permissions", permissionsFor(decision.permission()));
        body.put("use_independent_chat_permissions", true);

        String response;
        try {
            response = webClient.post()
                    .uri(URI.create(properties.getApiBaseUrl() + "/bot" + community.getBotToken() + "/restrictChatMember"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(properties.getRequestTimeout());
        } catch (WebClientResponseException e) {
            throw new AccessNotifierException("restrictChatMember rejected for chat " + community.getChatGroupId()
                    + ": " + e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            throw new AccessNotifierException("restrictChatMember failed for chat " + community.getChatGroupId()
                    + ": " + e.getMessage(), e);
        }
        requireOk(response, community);
        log.info("Set {} permissions for user {} in chat {} ({})",
                decision.permission(), userId, community.getChatGroupId(), community.getAgentName());
    }

    static Map<String, Boolean> permissionsFor(PermissionState state) {
        boolean allowed = state == PermissionState.FULL;
        Map<String, Boolean> permissions = new LinkedHashMap<>();
        for (String permission : PERMISSIONS) {
            permissions.put(permission, allowed);
        }
        return permissions;
    }

    private void requireOk(String response, Community community) {
        if (response == null) {
            throw new AccessNotifierException("restrictChatMember returned no body for chat " + community.getChatGroupId());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new AccessNotifierException("restrictChatMember returned invalid JSON for chat " + community.getChatGroupId(), e);
        }
        if (!root.path("ok").asBoolean(false)) {
            throw new AccessNotifierException("restrictChatMember not ok for chat " + community.getChatGroupId()
                    + ": " + root.path("description").asText("no description"));
        }
    }

    private static long parseUserId(String externalIdentity) {
        try {
            return Long.parseLong(externalIdentity == null ? "" : externalIdentity.trim());
        } catch (NumberFormatException e) {
            throw new AccessNotifierException("Invalid Telegram user id: " + externalIdentity, e);
        }
    }
}
