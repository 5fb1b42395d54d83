package com.example.autopilot.service;

import com.example.autopilot.domain.MessageRole;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

public final class DedupKeys {

    private static final String REPLY_PREFIX = "reply:";

    private DedupKeys() {
    }

    /**
     * Key for messages the source did not identify: the first 32 hex chars of
     * SHA-256({@code conversationId|role|text}).
     */
    public static String contentKey(String conversationId, MessageRole role, String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((conversationId + "|" + role.name().toLowerCase(Locale.ROOT) + "|" + text)
                    .getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String replyKey(String batchId) {
        return REPLY_PREFIX + batchId;
    }
}
