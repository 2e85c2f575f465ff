package com.byootify.booking_ledger.ledger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Deterministic idempotency keys: {@code sha256(subject | kind | trigger)} as lowercase hex.
 *
 * Replaying the same trigger for the same subject always yields the same key.
 */
public final class IdempotencyKeys {

    private IdempotencyKeys() {
    }

    public static String forEntry(UUID subjectId, EntryKind kind, String triggerEventId) {
        return sha256(subjectId + "|" + kind.name() + "|" + triggerEventId);
    }

    public static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
