package com.sharesgate.api.controller;

import com.sharesgate.api.dto.UserSharesResponse;
import com.sharesgate.common.Addresses;
import com.sharesgate.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /users/{user_address}/shares/{chain_type}: ledger balances, not a live chain query.
 */
@RestController
@RequiredArgsConstructor
public class UserSharesController {

    private final LedgerService ledgerService;

    @GetMapping("/users/{user_address}/shares/{chain_type}")
    public ResponseEntity<UserSharesResponse> getUserShares(@PathVariable("user_address") String userAddress,
                                                            @PathVariable("chain_type") String chainType) {
        String user = Addresses.normalize(userAddress);
        List<UserSharesResponse.SubjectShare> shares = ledgerService.findHoldings(user, chainType).stream()
                .map(b -> new UserSharesResponse.SubjectShare(b.getSubject(), b.getShareAmount().toPlainString()))
                .toList();
        return ResponseEntity.ok(new UserSharesResponse(user, shares, chainType));
    }
}
