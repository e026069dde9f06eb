package com.chatmirror.platform;

import java.util.List;

/**
 * One page of a conversation's history. A null {@code nextToken} marks the last page.
 */
public record MessagePage(List<MessageContent> messages, String nextToken) {
    public MessagePage {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
