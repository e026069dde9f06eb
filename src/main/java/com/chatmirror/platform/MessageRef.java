package com.chatmirror.platform;

/**
 * Location of a message decoded from a notification resource.
 */
public record MessageRef(String channelId, String messageId) {
}
