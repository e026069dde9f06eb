package com.chatmirror.platform;

import com.chatmirror.projector.ChangeType;
import com.chatmirror.projector.ChatEvent;
import com.chatmirror.projector.InvalidEventException;
import com.chatmirror.projector.MessageProjector;
import com.chatmirror.pull.NotificationHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Turns a queue notification into a projected event: decode the resource, re-fetch the message
 * from the platform, then hand it to the projector. Deletes carry only the ids and the sender.
 */
public class ChangeEventHandler implements NotificationHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeEventHandler.class);

    private final ChatPlatformClient client;
    private final ResourceDecoder decoder;
    private final MessageProjector projector;

    public ChangeEventHandler(ChatPlatformClient client, MessageProjector projector) {
        this(client, ResourceDecoder.forPlatform(client.platform()), projector);
    }

    public ChangeEventHandler(ChatPlatformClient client, ResourceDecoder decoder, MessageProjector projector) {
        this.client = client;
        this.decoder = decoder;
        this.projector = projector;
    }

    @Override
    public void handle(ChangeNotification notification) throws IOException {
        ChangeType type = ChangeType.fromWire(notification.changeType());
        MessageRef ref = decoder.decode(notification.resource());

        MessageContent content = client.fetchMessage(ref.channelId(), ref.messageId());
        if (type == ChangeType.DELETED) {
            // a tombstone still names its sender; without one the delete applies by id alone
            String senderId = content == null ? null : content.senderId();
            projector.apply(ChatEvent.deleted(ref.messageId(), ref.channelId(), senderId));
            return;
        }

        if (content == null) {
            throw new InvalidEventException("Message " + ref.messageId() + " in " + ref.channelId() + " no longer exists upstream");
        }
        if (content.system()) {
            LOGGER.info("skipping message {}: sent by system", ref.messageId());
            return;
        }
        projector.apply(content.toEvent(type));
    }
}
