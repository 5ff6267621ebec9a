package com.sharesgate.access;

import com.sharesgate.access.GateCheckResult.Status;
import com.sharesgate.common.Addresses;
import com.sharesgate.domain.Community;
import com.sharesgate.domain.GateDecision;
import com.sharesgate.domain.PermissionState;
import com.sharesgate.domain.ShareBalanceTransitionEvent;
import com.sharesgate.domain.UserMappingRepository;
import com.sharesgate.ingestion.adapter.ChainAdapter;
import com.sharesgate.ingestion.adapter.ChainAdapterRegistry;
import com.sharesgate.ingestion.adapter.RpcException;
import com.sharesgate.ingestion.adapter.SignatureVerificationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Turns ledger transitions and verified gate checks into permission changes.
 * On the ledger path notifier failures are logged; on the gate-check path they are reported to the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AccessPolicy {

    private final ChainAdapterRegistry chainAdapterRegistry;
    private final CommunityService communityService;
    private final UserMappingRepository userMappingRepository;
    private final AccessNotifier accessNotifier;
    private final AccessProperties accessProperties;

    @EventListener
    public void onShareBalanceTransition(ShareBalanceTransitionEvent event) {
        Optional<Community> community = communityService.findBySubject(event.subject(), event.chainType());
        if (community.isEmpty()) {
            log.info("No community registered for subject {} on {}; skipping {} for {}",
                    event.subject(), event.chainType(), event.kind(), event.trader());
            return;
        }
        PermissionState permission = event.kind() == ShareBalanceTransitionEvent.Kind.GATE
                ? PermissionState.NONE
                : PermissionState.FULL;
        try {
            accessNotifier.apply(new GateDecision(event.externalIdentity(), community.get(), permission));
        } catch (AccessNotifierException e) {
            log.warn("Failed to {} {} in {}: {}", event.kind(), event.trader(), community.get().getAgentName(), e.getMessage());
        }
    }

    /**
     * Verifies the signature, records the identity mapping, checks the live balance and grants access to holders.
     * Nothing is written unless the signer matches the claimed user.
     */
    public GateCheckResult verifyAndGrant(GateCheckRequest request) {
        String chainType = request.chainType() == null || request.chainType().isBlank()
                ? accessProperties.getDefaultChainType()
                : request.chainType().trim();
        Optional<ChainAdapter> adapter = chainAdapterRegistry.find(chainType);
        if (adapter.isEmpty()) {
            return GateCheckResult.of(Status.UNSUPPORTED_CHAIN, "Unsupported chain type: " + chainType);
        }
        Optional<Community> community = communityService.findByChat(request.chatId(), chainType);
        if (community.isEmpty()) {
            return GateCheckResult.of(Status.COMMUNITY_NOT_FOUND, "No community registered for chat " + request.chatId() + " on " + chainType);
        }

        String signer;
        try {
            signer = adapter.get().verifySignature(request.challenge(), request.signature());
        } catch (SignatureVerificationException e) {
            log.info("Signature verification failed for {} on {}: {}", request.user(), chainType, e.getMessage());
            return GateCheckResult.of(Status.VERIFICATION_FAILED, e.getMessage());
        }
        if (!signer.equals(Addresses.normalize(request.user()))) {
            log.info("Signer {} does not match claimed user {} on {}", signer, request.user(), chainType);
            return GateCheckResult.of(Status.ADDRESS_MISMATCH, "Signature was not produced by " + request.user());
        }

        userMappingRepository.upsertIdentity(signer, chainType, request.challenge());

        BigInteger balance;
        try {
            balance = adapter.get().getShareBalance(community.get().getSubjectAddress(), signer);
        } catch (RpcException | IllegalArgumentException e) {
            log.warn("Balance query failed for {} in {}: {}", signer, community.get().getAgentName(), e.getMessage());
            return GateCheckResult.of(Status.BALANCE_UNAVAILABLE, "Failed to query share balance");
        }
        if (balance.signum() <= 0) {
            log.info("User {} holds no shares of {}; access not granted", signer, community.get().getSubjectAddress());
            return GateCheckResult.of(Status.NO_SHARES, null);
        }

        try {
            accessNotifier.apply(new GateDecision(request.challenge(), community.get(), PermissionState.FULL));
        } catch (AccessNotifierException e) {
            log.error("Failed to grant access to {} in {}", signer, community.get().getAgentName(), e);
            return GateCheckResult.of(Status.NOTIFIER_FAILED, "Failed to set chat permissions");
        }
        return GateCheckResult.of(Status.GRANTED, null);
    }
}
