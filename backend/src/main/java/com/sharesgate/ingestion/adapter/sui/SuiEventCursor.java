package com.sharesgate.ingestion.adapter.sui;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sharesgate.ingestion.adapter.RpcException;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sui event id used as a query cursor: {@code {"txDigest": ..., "eventSeq": ...}}.
 * Stored checkpoints carry it as JSON text.
 */
@Slf4j
public record SuiEventCursor(String txDigest, String eventSeq) {

    /** Base58 of 32 zero bytes; paired with a legacy stored value when the stored cursor is not JSON. */
    static final String PLACEHOLDER_DIGEST = "11111111111111111111111111111111";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int SURROGATE_HEX_DIGITS = 15;

    /**
     * Reads a stored cursor. Text that is not a JSON object with both fields becomes a placeholder cursor
     * whose {@code eventSeq} is the stored text, so a damaged checkpoint never stops the worker.
     *
     * @return null for a null or blank token (start from the first event)
     */
    public static SuiEventCursor parse(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        String trimmed = token.trim();
        if (trimmed.startsWith("{")) {
            try {
                SuiEventCursor cursor = fromNode(MAPPER.readTree(trimmed));
                if (cursor != null) {
                    return cursor;
                }
            } catch (JsonProcessingException e) {
                log.debug("Stored Sui cursor is not valid JSON, using placeholder: {}", e.getOriginalMessage());
            }
        }
        return new SuiEventCursor(PLACEHOLDER_DIGEST, trimmed);
    }

    /** @return null when the node is not an event id */
    public static SuiEventCursor fromNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode digest = node.get("txDigest");
        JsonNode seq = node.get("eventSeq");
        if (digest == null || seq == null || !digest.isValueNode() || !seq.isValueNode()) {
            return null;
        }
        return new SuiEventCursor(digest.asText(), seq.asText());
    }

    public Map<String, Object> toParam() {
        Map<String, Object> param = new LinkedHashMap<>();
        param.put("txDigest", txDigest);
        param.put("eventSeq", eventSeq);
        return param;
    }

    public String toToken() {
        try {
            return MAPPER.writeValueAsString(toParam());
        } catch (JsonProcessingException e) {
            throw new RpcException("Cannot serialize Sui cursor", e);
        }
    }

    /**
     * Display-only number for the checkpoint row: the leading hex digits of the digest (at most 15), else 0.
     */
    public long numericSurrogate() {
        if (txDigest == null) {
            return 0L;
        }
        int end = 0;
        while (end < txDigest.length() && end < SURROGATE_HEX_DIGITS && Character.digit(txDigest.charAt(end), 16) >= 0) {
            end++;
        }
        return end == 0 ? 0L : Long.parseLong(txDigest.substring(0, end), 16);
    }
}
