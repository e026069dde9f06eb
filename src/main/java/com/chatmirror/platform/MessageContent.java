package com.chatmirror.platform;

import com.chatmirror.projector.ChangeType;
import com.chatmirror.projector.ChatEvent;

import java.time.Instant;
import java.util.List;

/**
 * A message as returned by a platform API.
 *
 * @param system          true for platform-generated messages (membership changes, call events)
 * @param deletedUpstream true when the platform reports the message as already deleted
 */
public record MessageContent(String messageId,
                             String channelId,
                             String conversationId,
                             String senderId,
                             Instant createdAt,
                             Instant modifiedAt,
                             String text,
                             List<String> attachments,
                             String replyTo,
                             boolean system,
                             boolean deletedUpstream) {

    public MessageContent {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public ChatEvent toEvent(ChangeType changeType) {
        return new ChatEvent(changeType, messageId, channelId, conversationId, senderId,
                createdAt, modifiedAt, text, attachments, replyTo);
    }
}
