package com.sharesgate.domain;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Atomic balance updates on (trader, subject, chainType).
 */
public interface ShareBalanceRepositoryCustom {

    /**
     * Adds {@code amount}, creating the entry at zero first when absent.
     *
     * @return the balance after the update
     */
    BigDecimal addShares(String trader, String subject, String chainType, BigDecimal amount);

    /**
     * Subtracts {@code amount} from an existing entry.
     *
     * @return the balance after the update, or empty when no entry exists
     */
    Optional<BigDecimal> subtractShares(String trader, String subject, String chainType, BigDecimal amount);

    /** Sets an existing entry to exactly zero. */
    void resetShares(String trader, String subject, String chainType);
}
