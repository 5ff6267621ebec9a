package com.sharesgate.api.controller;

import com.sharesgate.access.CommunityRegistration;
import com.sharesgate.access.CommunityService;
import com.sharesgate.domain.Community;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentControllerTest {

    private static final String REGISTRATION = """
            {"bot_token":"1:tok","chat_group_id":"-100","subject_address":"0xBB","agent_name":"agent-1",
             "invite_url":"https://t.me/+x","bio":"hello"}
            """;

    private CommunityService communityService;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        communityService = mock(CommunityService.class);
        webTestClient = WebTestClient.bindToController(new AgentController(communityService))
                .controllerAdvice(new ValidationExceptionHandler())
                .build();
    }

    @Test
    void addTelegramBot_registersCommunity() {
        webTestClient.post().uri("/add_tg_bot")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(REGISTRATION)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true);

        ArgumentCaptor<CommunityRegistration> registration = ArgumentCaptor.forClass(CommunityRegistration.class);
        verify(communityService).register(registration.capture());
        assertThat(registration.getValue().agentName()).isEqualTo("agent-1");
        assertThat(registration.getValue().subjectAddress()).isEqualTo("0xBB");
        assertThat(registration.getValue().chainType()).isNull();
    }

    @Test
    void addTelegramBot_duplicateName_returns409() {
        when(communityService.register(any())).thenThrow(new DuplicateKeyException("E11000"));

        webTestClient.post().uri("/add_tg_bot")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(REGISTRATION)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.success").isEqualTo(false);
    }

    @Test
    void addTelegramBot_missingBotToken_returns400() {
        webTestClient.post().uri("/add_tg_bot")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"chat_group_id\":\"-100\",\"subject_address\":\"0xBB\",\"agent_name\":\"a\",\"invite_url\":\"u\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");

        verify(communityService, never()).register(any());
    }

    @Test
    void listAgents_returnsPageWithTotals() {
        Community community = community("agent-1");
        when(communityService.list(2, 5)).thenReturn(new PageImpl<>(List.of(community), PageRequest.of(1, 5), 6));

        webTestClient.get().uri("/agents?page=2&page_size=5")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total").isEqualTo(6)
                .jsonPath("$.page").isEqualTo(2)
                .jsonPath("$.page_size").isEqualTo(5)
                .jsonPath("$.agents[0].agent_name").isEqualTo("agent-1")
                .jsonPath("$.agents[0].subject_address").isEqualTo("bb");
    }

    @Test
    void listAgents_invalidPagination_returns400() {
        webTestClient.get().uri("/agents?page=0")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_PAGINATION");
        webTestClient.get().uri("/agents?page_size=101")
                .exchange()
                .expectStatus().isBadRequest();

        verify(communityService, never()).list(anyInt(), anyInt());
    }

    @Test
    void getAgent_missing_returnsNullAgent() {
        when(communityService.findByAgentName("ghost")).thenReturn(Optional.empty());

        webTestClient.get().uri("/agents/ghost")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.agent").isEmpty()
                .jsonPath("$.success").isEqualTo(true);
    }

    @Test
    void getAgentDetail_found_returnsDetail() {
        when(communityService.findByAgentName("agent-1")).thenReturn(Optional.of(community("agent-1")));

        webTestClient.get().uri("/agent/detail/agent-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.agent_name").isEqualTo("agent-1")
                .jsonPath("$.invite_url").isEqualTo("https://t.me/+x")
                .jsonPath("$.chain_type").isEqualTo("monad")
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.bot_token").doesNotExist();
    }

    @Test
    void getAgentDetail_missing_returns404() {
        when(communityService.findByAgentName("ghost")).thenReturn(Optional.empty());

        webTestClient.get().uri("/agent/detail/ghost")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("AGENT_NOT_FOUND");
    }

    private static Community community(String name) {
        Community community = new Community();
        community.setAgentName(name);
        community.setSubjectAddress("bb");
        community.setChainType("monad");
        community.setInviteUrl("https://t.me/+x");
        community.setBio("hello");
        community.setBotToken("1:tok");
        community.setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
        return community;
    }
}
