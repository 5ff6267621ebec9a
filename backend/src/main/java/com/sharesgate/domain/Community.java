package com.sharesgate.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A gated Telegram community registered for one subject (agent) on one chain.
 * Keyed by agent name; {@code botToken} must be a bot with admin rights in {@code chatGroupId}.
 */
@Document(collection = "telegram_bots")
@CompoundIndexes({
        @CompoundIndex(name = "subject_chain", def = "{'subjectAddress': 1, 'chainType': 1}"),
        @CompoundIndex(name = "chat_chain", def = "{'chatGroupId': 1, 'chainType': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Community {

    @Id
    @EqualsAndHashCode.Include
    private String agentName;
    private String bio;
    private String inviteUrl;
    private String botToken;
    private String chatGroupId;
    private String subjectAddress;
    private String chainType;
    private Instant createdAt;
}
