package com.chatmirror.sqs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.*;

import java.util.List;

/**
 * Utility class for SQS message operations used by the pull loop.
 */
public class SqsMessageOperations {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqsMessageOperations.class);
    public static final int SQS_MAX_RECEIVE_BATCH_SIZE = 10;

    /**
     * Queue URL of a subscription: the endpoint with the subscription id appended.
     */
    public static String queueUrl(String endpoint, String subscriptionId) {
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        return base + "/" + subscriptionId;
    }

    /**
     * Checks that the queue exists.
     *
     * @return false if SQS reports the queue as missing
     * @throws software.amazon.awssdk.core.exception.SdkException for any other failure
     */
    public static boolean queueExists(SqsClient sqsClient, String queueUrl) {
        try {
            sqsClient.getQueueAttributes(GetQueueAttributesRequest.builder()
                .queueUrl(queueUrl)
                .attributeNames(QueueAttributeName.QUEUE_ARN)
                .build());
            return true;
        } catch (QueueDoesNotExistException e) {
            LOGGER.warn("sqs_error: queue does not exist: {}", queueUrl);
            return false;
        }
    }

    /**
     * Receives a batch of messages with long polling.
     * Unlike the delete helpers, failures are thrown: the pull loop treats them as fatal.
     *
     * @param maxMessages Maximum number of messages to receive (max 10)
     * @param waitTimeSeconds Long-poll wait in seconds
     * @param visibilityTimeout Visibility timeout in seconds
     * @return List of received messages
     */
    public static List<Message> receiveMessages(
            SqsClient sqsClient,
            String queueUrl,
            int maxMessages,
            int waitTimeSeconds,
            int visibilityTimeout) {

        ReceiveMessageRequest receiveRequest = ReceiveMessageRequest.builder()
            .queueUrl(queueUrl)
            .maxNumberOfMessages(Math.min(maxMessages, SQS_MAX_RECEIVE_BATCH_SIZE))
            .visibilityTimeout(visibilityTimeout)
            .waitTimeSeconds(waitTimeSeconds)
            .build();

        ReceiveMessageResponse response = sqsClient.receiveMessage(receiveRequest);
        if (!response.messages().isEmpty()) {
            LOGGER.debug("received {} messages from {}", response.messages().size(), queueUrl);
        }
        return response.messages();
    }

    /**
     * Acknowledges a message by deleting it.
     *
     * @return true if the delete succeeded
     */
    public static boolean ack(SqsClient sqsClient, String queueUrl, Message message) {
        try {
            sqsClient.deleteMessage(DeleteMessageRequest.builder()
                .queueUrl(queueUrl)
                .receiptHandle(message.receiptHandle())
                .build());
            return true;
        } catch (Exception e) {
            // message becomes visible again after its timeout and is redelivered
            LOGGER.error("sqs_error: failed to delete message {}", message.messageId(), e);
            return false;
        }
    }

    /**
     * Negatively acknowledges a message by making it visible again immediately.
     *
     * @return true if the visibility change succeeded
     */
    public static boolean nack(SqsClient sqsClient, String queueUrl, Message message) {
        try {
            sqsClient.changeMessageVisibility(ChangeMessageVisibilityRequest.builder()
                .queueUrl(queueUrl)
                .receiptHandle(message.receiptHandle())
                .visibilityTimeout(0)
                .build());
            return true;
        } catch (Exception e) {
            LOGGER.error("sqs_error: failed to reset visibility of message {}", message.messageId(), e);
            return false;
        }
    }
}
