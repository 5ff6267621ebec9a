package com.sharesgate.ingestion.sync;

import com.sharesgate.config.AsyncConfig;
import com.sharesgate.ingestion.adapter.ChainAdapter;
import com.sharesgate.ingestion.adapter.ChainAdapterRegistry;
import com.sharesgate.ingestion.config.SyncProperties;
import com.sharesgate.ingestion.sync.progress.CheckpointStore;
import com.sharesgate.ledger.LedgerService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts one {@link ChainSyncWorker} per enabled chain on application ready and stops them on shutdown.
 * Workers share nothing but the database, so one chain failing never stalls another.
 */
@Component
@Slf4j
public class ChainSyncRunner {

    private final ChainAdapterRegistry chainAdapterRegistry;
    private final CheckpointStore checkpointStore;
    private final LedgerService ledgerService;
    private final SyncProperties syncProperties;
    private final ThreadPoolTaskExecutor syncExecutor;
    private final List<ChainSyncWorker> workers = new ArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    public ChainSyncRunner(ChainAdapterRegistry chainAdapterRegistry,
                           CheckpointStore checkpointStore,
                           LedgerService ledgerService,
                           SyncProperties syncProperties,
                           @Qualifier(AsyncConfig.SYNC_EXECUTOR) ThreadPoolTaskExecutor syncExecutor) {
        this.chainAdapterRegistry = chainAdapterRegistry;
        this.checkpointStore = checkpointStore;
        this.ledgerService = ledgerService;
        this.syncProperties = syncProperties;
        this.syncExecutor = syncExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!syncProperties.isEnabled()) {
            log.info("Chain sync disabled (sharesgate.sync.enabled=false)");
            return;
        }
        startWorkers();
    }

    void startWorkers() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        for (ChainAdapter adapter : chainAdapterRegistry.all()) {
            ChainSyncWorker worker = new ChainSyncWorker(adapter, checkpointStore, ledgerService, syncProperties);
            try {
                syncExecutor.execute(worker);
            } catch (TaskRejectedException e) {
                log.error("No sync thread available for {} (pool size {})", adapter.name(), syncExecutor.getMaxPoolSize(), e);
                continue;
            }
            synchronized (workers) {
                workers.add(worker);
            }
        }
        log.info("Sync workers started for chains: {}", workers().stream().map(ChainSyncWorker::chainName).toList());
    }

    @PreDestroy
    public void stop() {
        List<ChainSyncWorker> running;
        synchronized (workers) {
            running = List.copyOf(workers);
        }
        running.forEach(ChainSyncWorker::cancel);
        for (ChainSyncWorker worker : running) {
            try {
                if (!worker.awaitStop(syncProperties.getShutdownTimeout())) {
                    log.warn("Sync worker for {} did not stop within {}", worker.chainName(), syncProperties.getShutdownTimeout());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while stopping sync workers");
                return;
            }
        }
    }

    List<ChainSyncWorker> workers() {
        synchronized (workers) {
            return List.copyOf(workers);
        }
    }
}
