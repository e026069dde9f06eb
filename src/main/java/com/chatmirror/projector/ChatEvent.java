package com.chatmirror.projector;

import java.time.Instant;
import java.util.List;

/**
 * A decoded change to one chat message. {@code senderId} is the platform-local sender identity.
 * Deleted events may carry only the ids.
 */
public record ChatEvent(ChangeType changeType,
                        String messageId,
                        String channelId,
                        String conversationId,
                        String senderId,
                        Instant createdAt,
                        Instant modifiedAt,
                        String text,
                        List<String> attachments,
                        String replyTo) {

    public ChatEvent {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public static ChatEvent deleted(String messageId, String channelId) {
        return deleted(messageId, channelId, null);
    }

    public static ChatEvent deleted(String messageId, String channelId, String senderId) {
        return new ChatEvent(ChangeType.DELETED, messageId, channelId, channelId, senderId, null, null, null, null, null);
    }

    public ChatEvent withChangeType(ChangeType type) {
        return new ChatEvent(type, messageId, channelId, conversationId, senderId, createdAt, modifiedAt, text, attachments, replyTo);
    }
}
