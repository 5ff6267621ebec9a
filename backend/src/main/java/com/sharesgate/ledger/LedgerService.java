package com.sharesgate.ledger;

import com.sharesgate.common.Addresses;
import com.sharesgate.domain.AppliedTradeEvent;
import com.sharesgate.domain.AppliedTradeEventRepository;
import com.sharesgate.domain.ShareBalance;
import com.sharesgate.domain.ShareBalanceRepository;
import com.sharesgate.domain.ShareBalanceTransitionEvent;
import com.sharesgate.domain.ShareBalanceTransitionEvent.Kind;
import com.sharesgate.domain.TradeEvent;
import com.sharesgate.domain.UserMapping;
import com.sharesgate.domain.UserMappingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Applies trade events to the share ledger. Each event is one unit of work: idempotency marker, balance update
 * and gated-flag update commit together, and the access transition is published only after the commit.
 * Replaying an event (same chain, tx id and sequence) is a no-op.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LedgerService {

    private final ShareBalanceRepository shareBalanceRepository;
    private final UserMappingRepository userMappingRepository;
    private final AppliedTradeEventRepository appliedTradeEventRepository;
    private final TransactionOperations ledgerTransactionOperations;
    private final ApplicationEventPublisher applicationEventPublisher;

    public LedgerResult apply(TradeEvent event) {
        LedgerResult result;
        try {
            result = ledgerTransactionOperations.execute(status -> applyInTransaction(event));
        } catch (DuplicateKeyException e) {
            log.debug("Trade event {} already applied", event.eventKey());
            return LedgerResult.duplicate();
        }
        if (result == null) {
            throw new IllegalStateException("Ledger transaction returned no result for " + event.eventKey());
        }
        result.transitionIfAny().ifPresent(applicationEventPublisher::publishEvent);
        return result;
    }

    /** Ledger entries of one trader on one chain, ordered by subject. */
    public List<ShareBalance> findHoldings(String trader, String chainType) {
        return shareBalanceRepository.findByTraderAndChainTypeOrderBySubjectAsc(Addresses.normalize(trader), chainType);
    }

    private LedgerResult applyInTransaction(TradeEvent event) {
        appliedTradeEventRepository.insert(AppliedTradeEvent.of(event, Instant.now()));
        BigDecimal amount = new BigDecimal(event.amount());
        return event.buy() ? applyBuy(event, amount) : applySell(event, amount);
    }

    private LedgerResult applyBuy(TradeEvent event, BigDecimal amount) {
        BigDecimal balance = shareBalanceRepository.addShares(event.trader(), event.subject(), event.chainType(), amount);
        log.info("Trader {} bought {} share(s) of subject {} on {}, balance {}",
                event.trader(), amount, event.subject(), event.chainType(), balance);
        ShareBalanceTransitionEvent transition = null;
        if (balance.signum() > 0) {
            Optional<UserMapping> mapping = userMappingRepository.findByAddressAndChainType(event.trader(), event.chainType());
            if (mapping.isPresent() && mapping.get().isGated()) {
                transition = transition(Kind.UNGATE, event, mapping.get(), balance);
            }
        }
        return LedgerResult.applied(balance, transition);
    }

    private LedgerResult applySell(TradeEvent event, BigDecimal amount) {
        Optional<BigDecimal> after = shareBalanceRepository.subtractShares(event.trader(), event.subject(), event.chainType(), amount);
        if (after.isEmpty()) {
            log.warn("Ignoring sell of {} share(s) of subject {} by {} on {}: no ledger entry",
                    amount, event.subject(), event.trader(), event.chainType());
            return LedgerResult.noPosition();
        }
        BigDecimal balance = after.get();
        if (balance.signum() < 0) {
            log.warn("Sell of {} share(s) of subject {} by {} on {} would leave {}; clamping to zero",
                    amount, event.subject(), event.trader(), event.chainType(), balance);
            shareBalanceRepository.resetShares(event.trader(), event.subject(), event.chainType());
            balance = BigDecimal.ZERO;
        }
        log.info("Trader {} sold {} share(s) of subject {} on {}, balance {}",
                event.trader(), amount, event.subject(), event.chainType(), balance);
        ShareBalanceTransitionEvent transition = null;
        if (balance.signum() == 0) {
            Optional<UserMapping> mapping = userMappingRepository.findByAddressAndChainType(event.trader(), event.chainType());
            if (mapping.isPresent()) {
                userMappingRepository.markGated(event.trader(), event.chainType());
                transition = transition(Kind.GATE, event, mapping.get(), balance);
            }
        }
        return LedgerResult.applied(balance, transition);
    }

    private static ShareBalanceTransitionEvent transition(Kind kind, TradeEvent event, UserMapping mapping, BigDecimal balance) {
        return new ShareBalanceTransitionEvent(kind, event.chainType(), event.trader(), event.subject(),
                mapping.getExternalIdentity(), balance);
    }
}
