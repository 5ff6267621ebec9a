package com.sharesgate.ingestion.adapter;

import com.sharesgate.domain.Checkpoint;

import java.math.BigInteger;

/**
 * Per-chain capability set used by the sync engine and the gate check.
 * Implementations are stateless apart from their RPC wiring and may be called from several threads.
 */
public interface ChainAdapter {

    /** Stable chain identifier ("monad", "sui"); stored with every ledger row. */
    String name();

    /** Where a chain with no stored checkpoint starts. */
    Checkpoint initialCheckpoint();

    /**
     * Fetches the trade events after {@code from}. Never returns a checkpoint behind {@code from}.
     *
     * @throws RpcException when the chain cannot be reached or answers with an error
     */
    SyncBatch fetchNextBatch(Checkpoint from);

    /**
     * Recovers the address that signed {@code challenge}.
     *
     * @return the normalized signer address
     */
    String verifySignature(String challenge, String signature) throws SignatureVerificationException;

    /**
     * Live on-chain balance of {@code subject} shares held by {@code user}.
     *
     * @throws IllegalArgumentException when an address is not valid for this chain
     * @throws RpcException             when the chain query fails
     */
    BigInteger getShareBalance(String subject, String user);
}
