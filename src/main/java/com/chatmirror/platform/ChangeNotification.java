package com.chatmirror.platform;

/**
 * Queue payload announcing that a message changed. The message itself has to be fetched from the platform.
 */
public record ChangeNotification(String changeType, String resource) {
}
