package com.sharesgate.api.controller;

import com.sharesgate.access.CommunityRegistration;
import com.sharesgate.access.CommunityService;
import com.sharesgate.api.dto.AddTelegramBotRequest;
import com.sharesgate.api.dto.AgentDetailResponse;
import com.sharesgate.api.dto.AgentListResponse;
import com.sharesgate.api.dto.AgentResponse;
import com.sharesgate.api.dto.AgentSummary;
import com.sharesgate.api.dto.ErrorBody;
import com.sharesgate.api.dto.SuccessResponse;
import com.sharesgate.domain.Community;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Community (agent) registration and listing: POST /add_tg_bot, GET /agents, GET /agents/{name}, GET /agent/detail/{name}.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AgentController {

    private static final int MAX_PAGE_SIZE = 100;

    private final CommunityService communityService;

    @PostMapping("/add_tg_bot")
    public ResponseEntity<SuccessResponse> addTelegramBot(@Valid @RequestBody AddTelegramBotRequest request) {
        try {
            communityService.register(new CommunityRegistration(
                    request.agentName(),
                    request.bio(),
                    request.inviteUrl(),
                    request.botToken(),
                    request.chatGroupId(),
                    request.subjectAddress(),
                    request.chainType()));
        } catch (DuplicateKeyException e) {
            log.info("Rejected duplicate agent name {}", request.agentName());
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(SuccessResponse.failed("Agent name already registered: " + request.agentName()));
        }
        return ResponseEntity.ok(SuccessResponse.ok());
    }

    @GetMapping("/agents")
    public ResponseEntity<?> listAgents(@RequestParam(name = "page", defaultValue = "1") int page,
                                        @RequestParam(name = "page_size", defaultValue = "10") int pageSize) {
        if (page < 1 || pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PAGINATION", "Invalid pagination parameters"));
        }
        Page<Community> result = communityService.list(page, pageSize);
        return ResponseEntity.ok(new AgentListResponse(
                result.getContent().stream().map(AgentController::toSummary).toList(),
                result.getTotalElements(),
                page,
                pageSize));
    }

    @GetMapping("/agents/{agent_name}")
    public ResponseEntity<AgentResponse> getAgent(@PathVariable("agent_name") String agentName) {
        AgentSummary agent = communityService.findByAgentName(agentName).map(AgentController::toSummary).orElse(null);
        return ResponseEntity.ok(new AgentResponse(agent, true));
    }

    @GetMapping("/agent/detail/{agent_name}")
    public ResponseEntity<?> getAgentDetail(@PathVariable("agent_name") String agentName) {
        return communityService.findByAgentName(agentName)
                .<ResponseEntity<?>>map(c -> ResponseEntity.ok(new AgentDetailResponse(
                        c.getAgentName(), c.getSubjectAddress(), c.getInviteUrl(), c.getBio(), c.getChainType(), true)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of("AGENT_NOT_FOUND", "Agent not found: " + agentName)));
    }

    private static AgentSummary toSummary(Community c) {
        return new AgentSummary(c.getAgentName(), c.getSubjectAddress(), c.getCreatedAt());
    }
}
