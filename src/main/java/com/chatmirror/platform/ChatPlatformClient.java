package com.chatmirror.platform;

import com.chatmirror.projector.Platform;

import java.io.IOException;

public interface ChatPlatformClient {

    Platform platform();

    /**
     * Fetches a page of {@code conversationId}'s history.
     *
     * @param continuationToken null for the first page, otherwise the previous page's {@link MessagePage#nextToken()}
     * @return the page, or null when the platform has nothing more
     */
    MessagePage fetchPage(String conversationId, String continuationToken) throws IOException;

    /**
     * @return the message, or null when the platform no longer knows it
     */
    MessageContent fetchMessage(String conversationId, String messageId) throws IOException;
}
