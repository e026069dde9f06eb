package com.chatmirror.sqs;

import com.chatmirror.platform.ChangeNotification;
import com.chatmirror.projector.InvalidEventException;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import software.amazon.awssdk.services.sqs.model.Message;

/**
 * Utility class for parsing SQS messages carrying chat change notifications.
 */
public class SqsMessageParser {

    /**
     * Parses the body of an SQS message, expected as {@code {"changeType": ..., "resource": ...}}.
     *
     * @throws InvalidEventException if the body is not JSON or lacks either field
     */
    public static SqsParsedMessage parse(Message message) {
        String body = message.body();
        if (body == null || body.isBlank()) {
            throw new InvalidEventException("sqs message " + message.messageId() + " has an empty body");
        }

        JsonObject json;
        try {
            json = new JsonObject(body);
        } catch (DecodeException e) {
            throw new InvalidEventException("sqs message " + message.messageId() + " is not a JSON object", e);
        }

        String changeType = json.getValue("changeType") instanceof String ? json.getString("changeType") : null;
        String resource = json.getValue("resource") instanceof String ? json.getString("resource") : null;
        if (changeType == null || changeType.isBlank()) {
            throw new InvalidEventException("sqs message " + message.messageId() + " has no changeType");
        }
        if (resource == null || resource.isBlank()) {
            throw new InvalidEventException("sqs message " + message.messageId() + " has no resource");
        }
        return new SqsParsedMessage(message, new ChangeNotification(changeType, resource));
    }
}
