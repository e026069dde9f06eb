package com.chatmirror.projector;

import java.time.Instant;

/**
 * Store key layout for the mirror.
 */
public final class ChatKeys {
    private ChatKeys() {
    }

    public static String active(Platform platform, String channelId, String senderHandle) {
        return platform.keyPrefix() + ":chat:active:" + channelId + ":" + senderHandle;
    }

    public static String deleted(Platform platform, String channelId, String senderHandle) {
        return platform.keyPrefix() + ":chat:deleted:" + channelId + ":" + senderHandle;
    }

    public static String message(Platform platform, String channelId, String messageId) {
        return platform.keyPrefix() + ":chat:message:" + channelId + ":" + messageId;
    }

    /**
     * Index score of a message: its creation time in epoch seconds, sub-second precision kept in the fraction.
     */
    public static double score(Instant createdAt) {
        return createdAt.getEpochSecond() + createdAt.getNano() / 1_000_000_000d;
    }
}
