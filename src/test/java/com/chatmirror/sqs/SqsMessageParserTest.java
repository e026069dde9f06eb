package com.chatmirror.sqs;

import com.chatmirror.projector.InvalidEventException;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.sqs.model.Message;

import static org.junit.jupiter.api.Assertions.*;

public class SqsMessageParserTest {

    private static Message message(String body) {
        return Message.builder().messageId("msg-1").receiptHandle("r1").body(body).build();
    }

    @Test
    void parse_validNotification() {
        SqsParsedMessage parsed = SqsMessageParser.parse(
                message("{\"changeType\":\"created\",\"resource\":\"chats('c')/messages('m')\",\"extra\":1}"));

        assertEquals("created", parsed.notification().changeType());
        assertEquals("chats('c')/messages('m')", parsed.notification().resource());
        assertEquals("msg-1", parsed.originalMessage().messageId());
    }

    @Test
    void parse_emptyBody() {
        assertThrows(InvalidEventException.class, () -> SqsMessageParser.parse(message("")));
        assertThrows(InvalidEventException.class, () -> SqsMessageParser.parse(message(null)));
    }

    @Test
    void parse_notJson() {
        assertThrows(InvalidEventException.class, () -> SqsMessageParser.parse(message("created chats('c')")));
    }

    @Test
    void parse_missingFields() {
        assertThrows(InvalidEventException.class, () -> SqsMessageParser.parse(message("{\"resource\":\"r\"}")));
        assertThrows(InvalidEventException.class, () -> SqsMessageParser.parse(message("{\"changeType\":\"created\"}")));
        assertThrows(InvalidEventException.class, () -> SqsMessageParser.parse(message("{\"changeType\":1,\"resource\":\"r\"}")));
    }
}
