package com.sharesgate.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.sharesgate.common.Addresses;
import com.sharesgate.domain.TradeEvent;
import com.sharesgate.ingestion.adapter.RpcException;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Decodes {@code Trade(address trader, address subject, bool isBuy, uint256 shareAmount, uint256 ethAmount,
 * uint256 protocolEthAmount, uint256 subjectEthAmount, uint256 supply)} logs. All fields are non-indexed,
 * so they sit in the data section as 32-byte words.
 */
public final class EvmTradeLogDecoder {

    public static final String TRADE_EVENT_SIGNATURE =
            "Trade(address,address,bool,uint256,uint256,uint256,uint256,uint256)";
    public static final String TRADE_TOPIC = Hash.sha3String(TRADE_EVENT_SIGNATURE);

    private static final int WORD_HEX = 64;
    private static final int REQUIRED_WORDS = 4;

    private EvmTradeLogDecoder() {
    }

    /**
     * @return the trade, or empty when the log was removed by a reorg
     * @throws RpcException when the log is not a well-formed Trade log
     */
    public static Optional<TradeEvent> decode(String chainType, JsonNode log) {
        if (log.path("removed").asBoolean(false)) {
            return Optional.empty();
        }
        String data = strip0x(log.path("data").asText(""));
        if (data.length() < REQUIRED_WORDS * WORD_HEX) {
            throw new RpcException("Trade log data too short: " + data.length() / 2 + " bytes");
        }
        String trader = Addresses.normalize(word(data, 0).substring(24));
        String subject = Addresses.normalize(word(data, 1).substring(24));
        boolean buy = new BigInteger(word(data, 2), 16).signum() != 0;
        BigInteger amount = new BigInteger(word(data, 3), 16);
        String txHash = Addresses.normalize(log.path("transactionHash").asText(null));
        if (txHash == null || txHash.isEmpty()) {
            throw new RpcException("Trade log without transactionHash");
        }
        long logIndex = hexToLong(log.path("logIndex").asText("0x0"));
        long blockNumber = hexToLong(log.path("blockNumber").asText("0x0"));
        return Optional.of(new TradeEvent(chainType, trader, subject, buy, amount, txHash, logIndex, blockNumber));
    }

    static long hexToLong(String hex) {
        String digits = strip0x(hex);
        if (digits.isEmpty()) {
            return 0L;
        }
        try {
            return new BigInteger(digits, 16).longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new RpcException("Invalid hex quantity: " + hex, e);
        }
    }

    static String strip0x(String hex) {
        if (hex == null) {
            return "";
        }
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

    private static String word(String data, int index) {
        return data.substring(index * WORD_HEX, (index + 1) * WORD_HEX);
    }
}
