package com.chatmirror.sqs;

import com.chatmirror.platform.ChangeNotification;
import software.amazon.awssdk.services.sqs.model.Message;

/**
 * Represents an SQS message paired with the change notification decoded from its body.
 */
public record SqsParsedMessage(Message originalMessage, ChangeNotification notification) {
}
