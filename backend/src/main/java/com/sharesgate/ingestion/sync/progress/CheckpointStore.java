package com.sharesgate.ingestion.sync.progress;

import com.sharesgate.domain.Checkpoint;
import com.sharesgate.domain.SyncStatus;
import com.sharesgate.domain.SyncStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Reads and writes the per-chain sync checkpoint in sync_status.
 * Block positions never move backwards; cursor checkpoints are replaced as given.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CheckpointStore {

    private final SyncStatusRepository syncStatusRepository;

    public Optional<Checkpoint> find(String chainType) {
        return syncStatusRepository.findByChainType(chainType).map(CheckpointStore::toCheckpoint);
    }

    /**
     * Returns the stored checkpoint, or stores and returns {@code initial} when the chain has none yet.
     */
    public Checkpoint loadOrInitialize(String chainType, Checkpoint initial) {
        Optional<Checkpoint> stored = find(chainType);
        if (stored.isPresent()) {
            return stored.get();
        }
        SyncStatus status = new SyncStatus();
        status.setChainType(chainType);
        write(status, initial);
        log.info("Initialized checkpoint for {} at {}", chainType, initial.describe());
        return initial;
    }

    /**
     * @throws IllegalStateException when a block checkpoint would move backwards
     */
    public void advance(String chainType, Checkpoint next) {
        SyncStatus status = syncStatusRepository.findByChainType(chainType).orElseGet(() -> {
            SyncStatus created = new SyncStatus();
            created.setChainType(chainType);
            return created;
        });
        if (!next.hasCursor() && status.getId() != null && next.position() < status.getLastPosition()) {
            throw new IllegalStateException("Checkpoint for " + chainType + " would move backwards from "
                    + status.getLastPosition() + " to " + next.position());
        }
        write(status, next);
        log.debug("Checkpoint for {} advanced to {}", chainType, next.describe());
    }

    private void write(SyncStatus status, Checkpoint checkpoint) {
        status.setLastPosition(checkpoint.position());
        status.setCursorMetadata(checkpoint.cursorToken());
        status.setUpdatedAt(Instant.now());
        syncStatusRepository.save(status);
    }

    private static Checkpoint toCheckpoint(SyncStatus status) {
        return new Checkpoint(status.getLastPosition(), status.getCursorMetadata());
    }
}
