package com.sharesgate.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.sharesgate.common.Addresses;
import com.sharesgate.domain.Checkpoint;
import com.sharesgate.domain.TradeEvent;
import com.sharesgate.ingestion.adapter.ChainAdapter;
import com.sharesgate.ingestion.adapter.JsonRpcCaller;
import com.sharesgate.ingestion.adapter.ResponseTooLargeException;
import com.sharesgate.ingestion.adapter.RpcException;
import com.sharesgate.ingestion.adapter.SignatureVerificationException;
import com.sharesgate.ingestion.adapter.SyncBatch;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * EVM shares contract: block-window log scanning, personal_sign recovery and the sharesBalance view.
 * Windows are inclusive on both ends, so the last block of one window is scanned again as the first block
 * of the next; the ledger drops the repeated events by key. A window whose logs are too large is halved until
 * it fits or covers a single block.
 */
@Slf4j
public class EvmChainAdapter implements ChainAdapter {

    static final String SHARES_BALANCE_SELECTOR = Hash.sha3String("sharesBalance(address,address)").substring(0, 10);

    private final String name;
    private final String contractAddress;
    private final long startBlock;
    private final int batchBlockSize;
    private final JsonRpcCaller rpc;
    private final EvmSignatureVerifier signatureVerifier;

    public EvmChainAdapter(String name, String sharesContract, long startBlock, int batchBlockSize,
                           JsonRpcCaller rpc, EvmSignatureVerifier signatureVerifier) {
        if (!Addresses.isHex(sharesContract, 40)) {
            throw new IllegalStateException("Invalid shares contract address for " + name + ": " + sharesContract);
        }
        if (startBlock < 0) {
            throw new IllegalStateException("Invalid start block for " + name + ": " + startBlock);
        }
        if (batchBlockSize < 1) {
            throw new IllegalStateException("batchBlockSize must be positive, got " + batchBlockSize);
        }
        this.name = name;
        this.contractAddress = Addresses.withPrefix(sharesContract);
        this.startBlock = startBlock;
        this.batchBlockSize = batchBlockSize;
        this.rpc = rpc;
        this.signatureVerifier = signatureVerifier;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Checkpoint initialCheckpoint() {
        return Checkpoint.ofBlock(startBlock);
    }

    @Override
    public SyncBatch fetchNextBatch(Checkpoint from) {
        long head = blockNumber();
        long fromBlock = from.position();
        if (fromBlock >= head) {
            log.debug("{} synced to head {}", name, head);
            return SyncBatch.caughtUp(from);
        }
        long toBlock = Math.min(fromBlock + batchBlockSize, head);
        List<TradeEvent> events;
        while (true) {
            try {
                events = fetchTrades(fromBlock, toBlock);
                break;
            } catch (ResponseTooLargeException e) {
                if (toBlock == fromBlock) {
                    throw e;
                }
                long narrowed = fromBlock + (toBlock - fromBlock) / 2;
                log.warn("{} logs for blocks {} to {} too large, retrying blocks {} to {}: {}",
                        name, fromBlock, toBlock, fromBlock, narrowed, e.getMessage());
                toBlock = narrowed;
            }
        }
        log.info("Found {} trade event(s) in blocks {} to {} for {}", events.size(), fromBlock, toBlock, name);
        return new SyncBatch(events, Checkpoint.ofBlock(toBlock), toBlock >= head);
    }

    @Override
    public String verifySignature(String challenge, String signature) throws SignatureVerificationException {
        return signatureVerifier.recoverAddress(challenge, signature);
    }

    @Override
    public BigInteger getShareBalance(String subject, String user) {
        requireAddress(subject, "subject");
        requireAddress(user, "user");
        String data = SHARES_BALANCE_SELECTOR + Addresses.toWord(subject) + Addresses.toWord(user);
        JsonNode result = rpc.call("eth_call", List.of(Map.of("to", contractAddress, "data", data), "latest"));
        String hex = EvmTradeLogDecoder.strip0x(result.asText(""));
        if (hex.isEmpty()) {
            throw new RpcException("sharesBalance returned no data from " + contractAddress);
        }
        try {
            return new BigInteger(hex, 16);
        } catch (NumberFormatException e) {
            throw new RpcException("sharesBalance returned invalid data: " + result.asText(), e);
        }
    }

    private long blockNumber() {
        return EvmTradeLogDecoder.hexToLong(rpc.call("eth_blockNumber", List.of()).asText(""));
    }

    private List<TradeEvent> fetchTrades(long fromBlock, long toBlock) {
        Map<String, Object> filter = Map.of(
                "address", contractAddress,
                "topics", List.of(EvmTradeLogDecoder.TRADE_TOPIC),
                "fromBlock", toHex(fromBlock),
                "toBlock", toHex(toBlock));
        JsonNode logs = rpc.call("eth_getLogs", List.of(filter));
        if (!logs.isArray()) {
            throw new RpcException("eth_getLogs result is not an array");
        }
        List<TradeEvent> events = new ArrayList<>(logs.size());
        for (JsonNode entry : logs) {
            try {
                EvmTradeLogDecoder.decode(name, entry).ifPresent(events::add);
            } catch (RpcException e) {
                log.warn("Skipping undecodable Trade log in tx {} on {}: {}",
                        entry.path("transactionHash").asText("?"), name, e.getMessage());
            }
        }
        events.sort(Comparator.comparingLong(TradeEvent::position).thenComparingLong(TradeEvent::sequence));
        return events;
    }

    private static void requireAddress(String address, String field) {
        if (!Addresses.isHex(address, 40)) {
            throw new IllegalArgumentException("Invalid " + field + " address: " + address);
        }
    }

    private static String toHex(long block) {
        return "0x" + Long.toHexString(block);
    }
}
