package com.sharesgate.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Links an on-chain address to a community identity (Telegram user id) on one chain.
 * {@code gated} is set when the ledger drops the user's balance of any subject to zero and is never cleared.
 */
@Document(collection = "user_mappings")
@CompoundIndex(name = "address_chain", def = "{'address': 1, 'chainType': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class UserMapping {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String address;
    private String chainType;
    private String externalIdentity;
    private boolean gated;
    private Instant createdAt;
    private Instant updatedAt;
}
