package com.sharesgate.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Net shares of one subject held by one trader on one chain (collection "trades").
 * Addresses are normalized (lower-case, no 0x). {@code shareAmount} is stored as Decimal128.
 */
@Document(collection = "trades")
@CompoundIndex(name = "trader_subject_chain", def = "{'trader': 1, 'subject': 1, 'chainType': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ShareBalance {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String trader;
    private String subject;
    private String chainType;
    private BigDecimal shareAmount;
    private Instant createdAt;
    private Instant updatedAt;
}
