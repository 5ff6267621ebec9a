package com.sharesgate.ingestion.adapter.sui;

import com.sharesgate.ingestion.adapter.SignatureVerificationException;
import com.sharesgate.ingestion.adapter.SignatureVerificationException.Reason;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.util.encoders.Hex;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * Verifies Sui wallet personal-message signatures ({@code flag || sig || pubkey}, base64) for the Ed25519 scheme
 * and derives the signer address as {@code blake2b256(flag || pubkey)}.
 * The signed digest is {@code blake2b256(intent || bcs(message))} with the PersonalMessage intent {@code [3, 0, 0]}.
 */
public class SuiSignatureVerifier {

    static final byte ED25519_FLAG = 0x00;
    static final byte[] PERSONAL_MESSAGE_INTENT = {3, 0, 0};

    private static final int SIGNATURE_LENGTH = 64;
    private static final int PUBLIC_KEY_LENGTH = 32;
    private static final int SERIALIZED_LENGTH = 1 + SIGNATURE_LENGTH + PUBLIC_KEY_LENGTH;

    public String recoverAddress(String challenge, String signature) throws SignatureVerificationException {
        byte[] serialized = decodeBase64(signature);
        if (serialized.length == 0) {
            throw new SignatureVerificationException(Reason.MALFORMED_SIGNATURE, "Signature is empty");
        }
        if (serialized[0] != ED25519_FLAG) {
            throw new SignatureVerificationException(Reason.MALFORMED_SIGNATURE,
                    "Unsupported signature scheme flag: " + (serialized[0] & 0xff));
        }
        if (serialized.length != SERIALIZED_LENGTH) {
            throw new SignatureVerificationException(Reason.MALFORMED_SIGNATURE,
                    "Ed25519 signature must be " + SERIALIZED_LENGTH + " bytes, got " + serialized.length);
        }
        byte[] sig = Arrays.copyOfRange(serialized, 1, 1 + SIGNATURE_LENGTH);
        byte[] publicKey = Arrays.copyOfRange(serialized, 1 + SIGNATURE_LENGTH, SERIALIZED_LENGTH);
        byte[] digest = personalMessageDigest(challenge.getBytes(StandardCharsets.UTF_8));

        boolean valid;
        try {
            Ed25519Signer verifier = new Ed25519Signer();
            verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
            verifier.update(digest, 0, digest.length);
            valid = verifier.verifySignature(sig);
        } catch (RuntimeException e) {
            throw new SignatureVerificationException(Reason.RECOVERY_FAILED, "Recovery failed: " + e.getMessage(), e);
        }
        if (!valid) {
            throw new SignatureVerificationException(Reason.RECOVERY_FAILED, "Signature does not match the challenge");
        }
        return addressOf(publicKey);
    }

    /** Normalized (lower-case, no 0x) Sui address for an Ed25519 public key. */
    public static String addressOf(byte[] publicKey) {
        byte[] input = new byte[1 + publicKey.length];
        input[0] = ED25519_FLAG;
        System.arraycopy(publicKey, 0, input, 1, publicKey.length);
        return Hex.toHexString(blake2b256(input));
    }

    static byte[] personalMessageDigest(byte[] message) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(PERSONAL_MESSAGE_INTENT);
        writeUleb128(out, message.length);
        out.writeBytes(message);
        return blake2b256(out.toByteArray());
    }

    private static void writeUleb128(ByteArrayOutputStream out, int value) {
        int remaining = value;
        while ((remaining & ~0x7f) != 0) {
            out.write((remaining & 0x7f) | 0x80);
            remaining >>>= 7;
        }
        out.write(remaining);
    }

    private static byte[] blake2b256(byte[] input) {
        Blake2bDigest digest = new Blake2bDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[32];
        digest.doFinal(out, 0);
        return out;
    }

    private static byte[] decodeBase64(String signature) throws SignatureVerificationException {
        if (signature == null) {
            throw new SignatureVerificationException(Reason.MALFORMED_SIGNATURE, "Signature is required");
        }
        try {
            return Base64.getDecoder().decode(signature.trim());
        } catch (IllegalArgumentException e) {
            throw new SignatureVerificationException(Reason.MALFORMED_SIGNATURE, "Cannot decode signature: " + e.getMessage(), e);
        }
    }
}
