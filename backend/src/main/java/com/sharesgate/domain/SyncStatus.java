package com.sharesgate.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Sync checkpoint per chain. Block-height chains only use {@code lastPosition};
 * cursor chains also keep the opaque cursor in {@code cursorMetadata}.
 */
@Document(collection = "sync_status")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class SyncStatus {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String chainType;
    private long lastPosition;
    private String cursorMetadata;
    private Instant updatedAt;
}
