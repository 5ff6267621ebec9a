package com.sharesgate.ingestion.adapter;

import com.sharesgate.domain.Checkpoint;
import com.sharesgate.domain.TradeEvent;

import java.util.List;

/**
 * One fetch result: events in chain order, the checkpoint to store once they are applied,
 * and whether the chain head has been reached.
 */
public record SyncBatch(List<TradeEvent> events, Checkpoint next, boolean caughtUp) {

    public SyncBatch {
        events = List.copyOf(events);
    }

    public static SyncBatch caughtUp(Checkpoint at) {
        return new SyncBatch(List.of(), at, true);
    }
}
