package com.sharesgate.ingestion.adapter.sui;

import com.fasterxml.jackson.databind.JsonNode;
import com.sharesgate.common.Addresses;
import com.sharesgate.domain.Checkpoint;
import com.sharesgate.domain.TradeEvent;
import com.sharesgate.ingestion.adapter.ChainAdapter;
import com.sharesgate.ingestion.adapter.JsonRpcCaller;
import com.sharesgate.ingestion.adapter.RpcException;
import com.sharesgate.ingestion.adapter.SignatureVerificationException;
import com.sharesgate.ingestion.adapter.SyncBatch;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sui shares_trading module: cursor-paged event queries, Ed25519 personal-message verification
 * and the get_shares_balance view through devInspect.
 */
@Slf4j
public class SuiChainAdapter implements ChainAdapter {

    private static final String MODULE = "shares_trading";
    private static final String INSPECT_SENDER = "0x0";

    private final String name;
    private final String packageId;
    private final String sharesTradingObjectId;
    private final String startCursor;
    private final int pageLimit;
    private final JsonRpcCaller rpc;
    private final SuiSignatureVerifier signatureVerifier;

    public SuiChainAdapter(String name, String packageId, String sharesTradingObjectId, String startCursor,
                           int pageLimit, JsonRpcCaller rpc, SuiSignatureVerifier signatureVerifier) {
        if (packageId == null || packageId.isBlank()) {
            throw new IllegalStateException("Sui package id is required for " + name);
        }
        if (sharesTradingObjectId == null || sharesTradingObjectId.isBlank()) {
            throw new IllegalStateException("Sui shares trading object id is required for " + name);
        }
        this.name = name;
        this.packageId = Addresses.withPrefix(packageId);
        this.sharesTradingObjectId = Addresses.withPrefix(sharesTradingObjectId);
        this.startCursor = startCursor;
        this.pageLimit = Math.max(1, pageLimit);
        this.rpc = rpc;
        this.signatureVerifier = signatureVerifier;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Checkpoint initialCheckpoint() {
        SuiEventCursor cursor = SuiEventCursor.parse(startCursor);
        return cursor == null ? new Checkpoint(0L, null) : Checkpoint.ofCursor(cursor.numericSurrogate(), cursor.toToken());
    }

    @Override
    public SyncBatch fetchNextBatch(Checkpoint from) {
        SuiEventCursor cursor = SuiEventCursor.parse(from.cursorToken());
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", Map.of("MoveEventType", tradeEventType()));
        params.put("cursor", cursor == null ? null : cursor.toParam());
        params.put("limit", pageLimit);
        params.put("descending_order", false);
        JsonNode page = rpc.call("suix_queryEvents", params);

        JsonNode data = page.path("data");
        if (!data.isArray()) {
            throw new RpcException("suix_queryEvents result has no data array");
        }
        List<TradeEvent> events = new ArrayList<>(data.size());
        for (JsonNode event : data) {
            try {
                events.add(decode(event));
            } catch (RpcException | IllegalArgumentException e) {
                log.warn("Skipping undecodable Sui Trade event {} on {}: {}", event.path("id"), name, e.getMessage());
            }
        }
        boolean hasNextPage = page.path("hasNextPage").asBoolean(false);
        SuiEventCursor next = SuiEventCursor.fromNode(page.path("nextCursor"));
        Checkpoint nextCheckpoint = next == null ? from : Checkpoint.ofCursor(next.numericSurrogate(), next.toToken());
        if (!events.isEmpty()) {
            log.info("Found {} trade event(s) for {} after cursor {}", events.size(), name, cursor);
        }
        return new SyncBatch(events, nextCheckpoint, !hasNextPage);
    }

    @Override
    public String verifySignature(String challenge, String signature) throws SignatureVerificationException {
        return signatureVerifier.recoverAddress(challenge, signature);
    }

    @Override
    public BigInteger getShareBalance(String subject, String user) {
        requireAddress(subject, "subject");
        requireAddress(user, "user");
        Map<String, Object> moveCall = new LinkedHashMap<>();
        moveCall.put("packageObjectId", packageId);
        moveCall.put("module", MODULE);
        moveCall.put("function", "get_shares_balance");
        moveCall.put("arguments", List.of(sharesTradingObjectId, Addresses.withPrefix(subject), Addresses.withPrefix(user)));
        JsonNode result = rpc.call("sui_devInspectTransactionBlock",
                List.of(INSPECT_SENDER, Map.of("kind", "moveCall", "data", moveCall)));
        return parseReturnValue(result.path("results").path(0).path("returnValues").path(0));
    }

    private String tradeEventType() {
        return packageId + "::" + MODULE + "::Trade";
    }

    private TradeEvent decode(JsonNode event) {
        JsonNode parsed = event.path("parsedJson");
        JsonNode id = event.path("id");
        String txDigest = id.path("txDigest").asText("");
        if (txDigest.isEmpty() || !parsed.isObject()) {
            throw new RpcException("Sui event without id or parsedJson");
        }
        String trader = requireText(parsed, "trader");
        String subject = requireText(parsed, "subject");
        boolean buy = parsed.path("is_buy").asBoolean(false);
        BigInteger amount = new BigInteger(requireText(parsed, "amount"));
        long eventSeq = Long.parseLong(id.path("eventSeq").asText("0"));
        long surrogate = new SuiEventCursor(txDigest, String.valueOf(eventSeq)).numericSurrogate();
        return new TradeEvent(name, Addresses.normalize(trader), Addresses.normalize(subject), buy, amount,
                txDigest, eventSeq, surrogate);
    }

    /**
     * devInspect return values are {@code [bcsBytes, typeTag]}; u64 is 8 bytes little-endian.
     * A bare number is accepted as well.
     */
    static BigInteger parseReturnValue(JsonNode value) {
        if (value.isIntegralNumber()) {
            return value.bigIntegerValue();
        }
        JsonNode bytes = value.path(0);
        if (value.isArray() && bytes.isArray() && bytes.size() > 0) {
            BigInteger result = BigInteger.ZERO;
            for (int i = bytes.size() - 1; i >= 0; i--) {
                result = result.shiftLeft(8).or(BigInteger.valueOf(bytes.get(i).asInt() & 0xff));
            }
            return result;
        }
        throw new RpcException("Cannot parse get_shares_balance return value: " + value);
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            throw new RpcException("Sui Trade event missing " + field);
        }
        return value.asText();
    }

    private static void requireAddress(String address, String field) {
        String normalized = Addresses.normalize(address);
        if (normalized == null || normalized.isEmpty() || normalized.length() > 64
                || !Addresses.isHex(normalized, normalized.length())) {
            throw new IllegalArgumentException("Invalid " + field + " address: " + address);
        }
    }
}
