package com.sharesgate.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Marker for a trade event already applied to the ledger. The id is {@link TradeEvent#eventKey()},
 * so a second insert for the same event fails with a duplicate key.
 */
@Document(collection = "applied_trade_events")
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AppliedTradeEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String chainType;
    private String txId;
    private long sequence;
    private Instant appliedAt;

    public static AppliedTradeEvent of(TradeEvent event, Instant appliedAt) {
        return new AppliedTradeEvent(event.eventKey(), event.chainType(), event.txId(), event.sequence(), appliedAt);
    }
}
