package com.sharesgate.api.controller;

import com.sharesgate.access.AccessPolicy;
import com.sharesgate.access.GateCheckRequest;
import com.sharesgate.access.GateCheckResult;
import com.sharesgate.access.GateCheckResult.Status;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SignatureControllerTest {

    private static final String BODY = """
            {"challenge":"777","chat_id":"-100123","signature":"0xabc","user":"0xAA","chain_type":"monad"}
            """;

    private AccessPolicy accessPolicy;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        accessPolicy = mock(AccessPolicy.class);
        webTestClient = WebTestClient.bindToController(new SignatureController(accessPolicy))
                .controllerAdvice(new ValidationExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("granted check returns 200 success")
    void verifySignature_granted_ok() {
        when(accessPolicy.verifyAndGrant(any())).thenReturn(GateCheckResult.of(Status.GRANTED, null));

        webTestClient.post().uri("/verify-signature")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.error").doesNotExist();

        ArgumentCaptor<GateCheckRequest> request = ArgumentCaptor.forClass(GateCheckRequest.class);
        verify(accessPolicy).verifyAndGrant(request.capture());
        assertThat(request.getValue().chatId()).isEqualTo("-100123");
        assertThat(request.getValue().chainType()).isEqualTo("monad");
        assertThat(request.getValue().user()).isEqualTo("0xAA");
    }

    @Test
    void verifySignature_noShares_isStillSuccess() {
        when(accessPolicy.verifyAndGrant(any())).thenReturn(GateCheckResult.of(Status.NO_SHARES, null));

        webTestClient.post().uri("/verify-signature")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true);
    }

    @Test
    void verifySignature_mismatch_returns200WithFailure() {
        when(accessPolicy.verifyAndGrant(any())).thenReturn(GateCheckResult.of(Status.ADDRESS_MISMATCH, "Signature was not produced by 0xAA"));

        webTestClient.post().uri("/verify-signature")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error").isEqualTo("Signature was not produced by 0xAA");
    }

    @Test
    void verifySignature_unknownCommunity_returns400() {
        when(accessPolicy.verifyAndGrant(any())).thenReturn(GateCheckResult.of(Status.COMMUNITY_NOT_FOUND, "No community"));

        webTestClient.post().uri("/verify-signature")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false);
    }

    @Test
    void verifySignature_notifierFailure_returns500() {
        when(accessPolicy.verifyAndGrant(any())).thenReturn(GateCheckResult.of(Status.NOTIFIER_FAILED, "Failed to set chat permissions"));

        webTestClient.post().uri("/verify-signature")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Failed to set chat permissions");
    }

    @Test
    void verifySignature_missingField_returns400WithoutCheck() {
        webTestClient.post().uri("/verify-signature")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"challenge\":\"777\",\"signature\":\"0xabc\",\"user\":\"0xAA\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR")
                .jsonPath("$.message").value(m -> assertThat((String) m).startsWith("chat_id"));

        verify(accessPolicy, never()).verifyAndGrant(any());
    }

    @Test
    void verifySignature_unexpectedError_returns500ErrorBody() {
        when(accessPolicy.verifyAndGrant(any())).thenThrow(new IllegalStateException("boom"));

        webTestClient.post().uri("/verify-signature")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(BODY)
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INTERNAL_ERROR")
                .jsonPath("$.success").isEqualTo(false);
    }
}
