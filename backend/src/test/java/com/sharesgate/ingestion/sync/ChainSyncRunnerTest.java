package com.sharesgate.ingestion.sync;

import com.sharesgate.domain.Checkpoint;
import com.sharesgate.ingestion.adapter.ChainAdapter;
import com.sharesgate.ingestion.adapter.ChainAdapterRegistry;
import com.sharesgate.ingestion.adapter.SyncBatch;
import com.sharesgate.ingestion.config.SyncProperties;
import com.sharesgate.ingestion.sync.progress.CheckpointStore;
import com.sharesgate.ledger.LedgerService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChainSyncRunnerTest {

    private ThreadPoolTaskExecutor executor;
    private CheckpointStore checkpointStore;
    private SyncProperties properties;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("sync-test-");
        executor.initialize();
        checkpointStore = mock(CheckpointStore.class);
        when(checkpointStore.loadOrInitialize(anyString(), any())).thenReturn(Checkpoint.ofBlock(0));
        properties = new SyncProperties();
        properties.setShutdownTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void onApplicationReady_disabled_startsNothing() {
        properties.setEnabled(false);
        ChainSyncRunner runner = runner(adapter("monad"));

        runner.onApplicationReady();

        assertThat(runner.workers()).isEmpty();
    }

    @Test
    void startWorkers_runsOneWorkerPerAdapterAndStopsOnShutdown() throws Exception {
        ChainAdapter monad = adapter("monad");
        ChainSyncRunner runner = runner(monad);

        runner.onApplicationReady();
        runner.onApplicationReady();

        assertThat(runner.workers()).extracting(ChainSyncWorker::chainName).containsExactly("monad");
        verify(monad, timeout(5000)).fetchNextBatch(Checkpoint.ofBlock(0));

        runner.stop();

        assertThat(runner.workers().get(0).awaitStop(Duration.ZERO)).isTrue();
    }

    @Test
    void startWorkers_noFreeThread_skipsExtraChain() {
        ChainSyncRunner runner = runner(adapter("monad"), adapter("sui"));

        runner.startWorkers();

        assertThat(runner.workers()).extracting(ChainSyncWorker::chainName).containsExactly("monad");
        runner.stop();
    }

    private ChainSyncRunner runner(ChainAdapter... adapters) {
        ChainAdapterRegistry registry = new ChainAdapterRegistry(List.of(adapters));
        return new ChainSyncRunner(registry, checkpointStore, mock(LedgerService.class), properties, executor);
    }

    private static ChainAdapter adapter(String name) {
        ChainAdapter adapter = mock(ChainAdapter.class);
        when(adapter.name()).thenReturn(name);
        when(adapter.initialCheckpoint()).thenReturn(Checkpoint.ofBlock(0));
        when(adapter.fetchNextBatch(any())).thenReturn(SyncBatch.caughtUp(Checkpoint.ofBlock(0)));
        return adapter;
    }
}
