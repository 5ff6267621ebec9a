package com.sharesgate.ingestion.sync;

import com.sharesgate.common.RetryPolicy;
import com.sharesgate.domain.Checkpoint;
import com.sharesgate.domain.TradeEvent;
import com.sharesgate.ingestion.adapter.ChainAdapter;
import com.sharesgate.ingestion.adapter.SyncBatch;
import com.sharesgate.ingestion.config.SyncProperties;
import com.sharesgate.ingestion.sync.progress.CheckpointStore;
import com.sharesgate.ledger.LedgerResult;
import com.sharesgate.ledger.LedgerService;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Endless sync loop for one chain: fetch a batch after the checkpoint, apply each event to the ledger,
 * then advance the checkpoint. A failed fetch leaves the checkpoint untouched and waits the retry interval;
 * a failed event is logged and skipped; a failed checkpoint write keeps the in-memory checkpoint so the
 * batch is fetched again (the ledger drops the repeats).
 */
@Slf4j
public class ChainSyncWorker implements Runnable {

    private final ChainAdapter adapter;
    private final CheckpointStore checkpointStore;
    private final LedgerService ledgerService;
    private final SyncProperties properties;
    private final RetryPolicy fetchRetryPolicy;
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile boolean cancelled;
    private volatile Thread runner;
    private Checkpoint checkpoint;
    private int consecutiveFailures;

    public ChainSyncWorker(ChainAdapter adapter, CheckpointStore checkpointStore, LedgerService ledgerService,
                           SyncProperties properties) {
        this.adapter = adapter;
        this.checkpointStore = checkpointStore;
        this.ledgerService = ledgerService;
        this.properties = properties;
        this.fetchRetryPolicy = new RetryPolicy(properties.getRetryInterval(), properties.getRetryBackoffMultiplier(),
                properties.getMaxRetryInterval(), 0.0, Integer.MAX_VALUE);
    }

    public String chainName() {
        return adapter.name();
    }

    @Override
    public void run() {
        runner = Thread.currentThread();
        log.info("Sync worker started for {}", adapter.name());
        try {
            while (!cancelled) {
                Duration wait;
                try {
                    wait = runIteration();
                } catch (RuntimeException e) {
                    log.error("Sync iteration failed for {}", adapter.name(), e);
                    wait = nextRetryDelay();
                }
                if (!pause(wait)) {
                    break;
                }
            }
        } finally {
            stopped.countDown();
            log.info("Sync worker stopped for {}", adapter.name());
        }
    }

    /**
     * One fetch-apply-advance step.
     *
     * @return how long to wait before the next step
     */
    Duration runIteration() {
        if (checkpoint == null) {
            checkpoint = checkpointStore.loadOrInitialize(adapter.name(), adapter.initialCheckpoint());
            log.info("Starting sync for {} from {}", adapter.name(), checkpoint.describe());
        }
        SyncBatch batch;
        try {
            batch = adapter.fetchNextBatch(checkpoint);
        } catch (RuntimeException e) {
            Duration delay = nextRetryDelay();
            log.warn("Failed to fetch events for {} after {}: {}; retrying in {}",
                    adapter.name(), checkpoint.describe(), e.getMessage(), delay);
            return delay;
        }
        consecutiveFailures = 0;

        for (TradeEvent event : batch.events()) {
            if (cancelled) {
                return Duration.ZERO;
            }
            applyEvent(event);
        }

        if (!batch.next().equals(checkpoint)) {
            try {
                checkpointStore.advance(adapter.name(), batch.next());
                checkpoint = batch.next();
            } catch (RuntimeException e) {
                log.warn("Failed to update checkpoint for {} to {}: {}", adapter.name(), batch.next().describe(), e.getMessage());
            }
        }
        if (batch.caughtUp()) {
            log.debug("{} caught up at {}, waiting {}", adapter.name(), checkpoint.describe(), properties.getIdleInterval());
            return properties.getIdleInterval();
        }
        return properties.getPacingInterval();
    }

    Checkpoint currentCheckpoint() {
        return checkpoint;
    }

    /** Stops the loop after the current event; interrupts a pending wait. */
    public void cancel() {
        cancelled = true;
        Thread t = runner;
        if (t != null) {
            t.interrupt();
        }
    }

    public boolean awaitStop(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void applyEvent(TradeEvent event) {
        try {
            LedgerResult result = ledgerService.apply(event);
            if (result.outcome() == LedgerResult.Outcome.DUPLICATE) {
                log.debug("Skipped already applied event {}", event.eventKey());
            }
        } catch (RuntimeException e) {
            log.error("Error processing trade event {} on {}", event.eventKey(), adapter.name(), e);
        }
    }

    private Duration nextRetryDelay() {
        return fetchRetryPolicy.delay(consecutiveFailures++);
    }

    private boolean pause(Duration wait) {
        if (cancelled) {
            return false;
        }
        if (wait.isZero() || wait.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(wait.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
