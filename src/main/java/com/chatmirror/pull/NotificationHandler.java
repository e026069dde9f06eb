package com.chatmirror.pull;

import com.chatmirror.platform.ChangeNotification;

/**
 * Processes one notification received by a {@link SubscriptionPuller}.
 *
 * <p>Returning normally acknowledges the message. An {@link com.chatmirror.projector.InvalidEventException}
 * drops it. Any other exception returns it to the queue for redelivery.</p>
 */
@FunctionalInterface
public interface NotificationHandler {
    void handle(ChangeNotification notification) throws Exception;
}
