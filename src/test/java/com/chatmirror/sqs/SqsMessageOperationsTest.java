package com.chatmirror.sqs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class SqsMessageOperationsTest {

    private SqsClient mockSqsClient;
    private static final String TEST_QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/123456789/test-sub";

    @BeforeEach
    void setUp() {
        mockSqsClient = mock(SqsClient.class);
    }

    @Test
    void testQueueUrl_joinsEndpointAndSubscription() {
        assertEquals(TEST_QUEUE_URL, SqsMessageOperations.queueUrl("https://sqs.us-east-1.amazonaws.com/123456789", "test-sub"));
        assertEquals(TEST_QUEUE_URL, SqsMessageOperations.queueUrl("https://sqs.us-east-1.amazonaws.com/123456789/", "test-sub"));
    }

    @Test
    void testQueueExists_true() {
        when(mockSqsClient.getQueueAttributes(any(GetQueueAttributesRequest.class)))
            .thenReturn(GetQueueAttributesResponse.builder().build());

        assertTrue(SqsMessageOperations.queueExists(mockSqsClient, TEST_QUEUE_URL));
    }

    @Test
    void testQueueExists_missingQueue() {
        when(mockSqsClient.getQueueAttributes(any(GetQueueAttributesRequest.class)))
            .thenThrow(QueueDoesNotExistException.builder().message("gone").build());

        assertFalse(SqsMessageOperations.queueExists(mockSqsClient, TEST_QUEUE_URL));
    }

    @Test
    void testReceiveMessages_capsBatchSize() {
        List<Message> messages = List.of(
            Message.builder().messageId("1").receiptHandle("r1").build(),
            Message.builder().messageId("2").receiptHandle("r2").build()
        );
        when(mockSqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
            .thenReturn(ReceiveMessageResponse.builder().messages(messages).build());

        List<Message> result = SqsMessageOperations.receiveMessages(mockSqsClient, TEST_QUEUE_URL, 50, 2, 30);

        assertEquals(2, result.size());
        ArgumentCaptor<ReceiveMessageRequest> captor = ArgumentCaptor.forClass(ReceiveMessageRequest.class);
        verify(mockSqsClient).receiveMessage(captor.capture());
        assertEquals(10, captor.getValue().maxNumberOfMessages());
        assertEquals(2, captor.getValue().waitTimeSeconds());
        assertEquals(30, captor.getValue().visibilityTimeout());
    }

    @Test
    void testReceiveMessages_exceptionPropagates() {
        when(mockSqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
            .thenThrow(new RuntimeException("SQS error"));

        assertThrows(RuntimeException.class,
            () -> SqsMessageOperations.receiveMessages(mockSqsClient, TEST_QUEUE_URL, 10, 2, 30));
    }

    @Test
    void testAck_deletesByReceiptHandle() {
        Message message = Message.builder().messageId("1").receiptHandle("r1").build();

        assertTrue(SqsMessageOperations.ack(mockSqsClient, TEST_QUEUE_URL, message));

        ArgumentCaptor<DeleteMessageRequest> captor = ArgumentCaptor.forClass(DeleteMessageRequest.class);
        verify(mockSqsClient).deleteMessage(captor.capture());
        assertEquals("r1", captor.getValue().receiptHandle());
    }

    @Test
    void testAck_failureReturnsFalse() {
        when(mockSqsClient.deleteMessage(any(DeleteMessageRequest.class))).thenThrow(new RuntimeException("SQS error"));

        assertFalse(SqsMessageOperations.ack(mockSqsClient, TEST_QUEUE_URL, Message.builder().messageId("1").receiptHandle("r1").build()));
    }

    @Test
    void testNack_resetsVisibility() {
        Message message = Message.builder().messageId("1").receiptHandle("r1").build();

        assertTrue(SqsMessageOperations.nack(mockSqsClient, TEST_QUEUE_URL, message));

        ArgumentCaptor<ChangeMessageVisibilityRequest> captor = ArgumentCaptor.forClass(ChangeMessageVisibilityRequest.class);
        verify(mockSqsClient).changeMessageVisibility(captor.capture());
        assertEquals(0, captor.getValue().visibilityTimeout());
        assertEquals("r1", captor.getValue().receiptHandle());
    }
}
