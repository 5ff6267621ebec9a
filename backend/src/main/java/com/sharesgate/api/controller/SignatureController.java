package com.sharesgate.api.controller;

import com.sharesgate.access.AccessPolicy;
import com.sharesgate.access.GateCheckRequest;
import com.sharesgate.access.GateCheckResult;
import com.sharesgate.api.dto.ChallengeRequest;
import com.sharesgate.api.dto.SuccessResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * POST /verify-signature: synchronous gate check. The check blocks on chain and Telegram calls,
 * so it runs on the bounded-elastic scheduler instead of the event loop.
 */
@RestController
@RequiredArgsConstructor
public class SignatureController {

    private final AccessPolicy accessPolicy;

    @PostMapping("/verify-signature")
    public Mono<ResponseEntity<SuccessResponse>> verifySignature(@Valid @RequestBody ChallengeRequest request) {
        GateCheckRequest check = new GateCheckRequest(
                request.challenge().trim(), request.signature().trim(), request.user().trim(), request.chatId().trim(), request.chainType());
        return Mono.fromCallable(() -> accessPolicy.verifyAndGrant(check))
                .subscribeOn(Schedulers.boundedElastic())
                .map(SignatureController::toResponse);
    }

    static ResponseEntity<SuccessResponse> toResponse(GateCheckResult result) {
        return switch (result.status()) {
            case GRANTED, NO_SHARES -> ResponseEntity.ok(SuccessResponse.ok());
            case UNSUPPORTED_CHAIN, COMMUNITY_NOT_FOUND -> ResponseEntity.badRequest().body(SuccessResponse.failed(result.message()));
            case VERIFICATION_FAILED, ADDRESS_MISMATCH, BALANCE_UNAVAILABLE -> ResponseEntity.ok(SuccessResponse.failed(result.message()));
            case NOTIFIER_FAILED -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(SuccessResponse.failed(result.message()));
        };
    }
}
