package com.sharesgate.ingestion.adapter.evm;

import com.sharesgate.ingestion.adapter.SignatureVerificationException;
import com.sharesgate.ingestion.adapter.SignatureVerificationException.Reason;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Recovers the signer of an EIP-191 personal message from a 65-byte r||s||v signature.
 * <p>
 * ECDSA recovery cannot tell a corrupted signature from a valid one by another key: a tampered r or s
 * usually still recovers a well-formed address, just not the signer's. Only out-of-range values fail with
 * {@link Reason#RECOVERY_FAILED}. A recovered address is therefore never proof on its own; callers must
 * compare it against the claimed user before trusting it, as {@code AccessPolicy.verifyAndGrant} does.
 */
public class EvmSignatureVerifier {

    private static final int SIGNATURE_LENGTH = 65;

    public String recoverAddress(String challenge, String signature) throws SignatureVerificationException {
        byte[] bytes = decodeHex(signature);
        if (bytes.length != SIGNATURE_LENGTH) {
            throw new SignatureVerificationException(Reason.MALFORMED_SIGNATURE,
                    "Signature must be 65 bytes, got " + bytes.length);
        }
        byte v = bytes[64];
        if (v < 27) {
            v += 27;
        }
        Sign.SignatureData signatureData = new Sign.SignatureData(
                v,
                Arrays.copyOfRange(bytes, 0, 32),
                Arrays.copyOfRange(bytes, 32, 64));
        BigInteger publicKey;
        try {
            publicKey = Sign.signedPrefixedMessageToKey(challenge.getBytes(StandardCharsets.UTF_8), signatureData);
        } catch (SignatureException | RuntimeException e) {
            throw new SignatureVerificationException(Reason.RECOVERY_FAILED, "Recovery failed: " + e.getMessage(), e);
        }
        return Keys.getAddress(publicKey);
    }

    private static byte[] decodeHex(String signature) throws SignatureVerificationException {
        if (signature == null) {
            throw new SignatureVerificationException(Reason.MALFORMED_SIGNATURE, "Signature is required");
        }
        String hex = EvmTradeLogDecoder.strip0x(signature.trim());
        try {
            return HexFormat.of().parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new SignatureVerificationException(Reason.MALFORMED_SIGNATURE, "Invalid signature hex: " + e.getMessage(), e);
        }
    }
}
