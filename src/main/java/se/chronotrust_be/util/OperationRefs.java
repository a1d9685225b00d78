package se.chronotrust_be.util;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Deterministic idempotency keys for outbound calls. The same inputs always produce the same key,
 * so a retried call is recognised by the collaborator instead of being applied twice.
 */
public class OperationRefs {

    private OperationRefs() {
    }

    public static String tokenization(Long contractId, String watchSerial, String newOwnerKey) {
        String material = "tokenize:" + contractId + ":" + watchSerial + ":" + newOwnerKey;
        return UUID.nameUUIDFromBytes(material.getBytes(StandardCharsets.UTF_8)).toString();
    }

    public static String payout(String holdReference) {
        return "payout:" + holdReference;
    }

    public static String refund(String holdReference) {
        return "refund:" + holdReference;
    }

    public static String newHoldReference() {
        return "hold-" + UUID.randomUUID();
    }

    public static String assetCode(Long watchId) {
        // Stellar asset codes are at most 12 alphanumeric characters
        return String.format("CTW%09d", watchId);
    }
}
