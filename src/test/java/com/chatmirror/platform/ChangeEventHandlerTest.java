package com.chatmirror.platform;

import com.chatmirror.projector.ChangeType;
import com.chatmirror.projector.ChatEvent;
import com.chatmirror.projector.InvalidEventException;
import com.chatmirror.projector.MessageProjector;
import com.chatmirror.projector.Platform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class ChangeEventHandlerTest {
    private static final String RESOURCE = "chats('19:chat')/messages('m1')";
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private ChatPlatformClient client;
    @Mock
    private MessageProjector projector;

    private ChangeEventHandler handler;

    @BeforeEach
    void setUp() {
        when(client.platform()).thenReturn(Platform.MICROSOFT);
        handler = new ChangeEventHandler(client, projector);
    }

    private static MessageContent content(boolean system) {
        return new MessageContent("m1", "19:chat", "19:chat", "u1", T0, null, "hi", List.of(), null, system, false);
    }

    @Test
    void created_fetchesMessageAndApplies() throws IOException {
        when(client.fetchMessage("19:chat", "m1")).thenReturn(content(false));

        handler.handle(new ChangeNotification("created", RESOURCE));

        ArgumentCaptor<ChatEvent> captor = ArgumentCaptor.forClass(ChatEvent.class);
        verify(projector).apply(captor.capture());
        assertEquals(ChangeType.CREATED, captor.getValue().changeType());
        assertEquals("hi", captor.getValue().text());
        assertEquals("u1", captor.getValue().senderId());
    }

    @Test
    void updated_carriesUpdatedChangeType() throws IOException {
        when(client.fetchMessage("19:chat", "m1")).thenReturn(content(false));

        handler.handle(new ChangeNotification("updated", RESOURCE));

        ArgumentCaptor<ChatEvent> captor = ArgumentCaptor.forClass(ChatEvent.class);
        verify(projector).apply(captor.capture());
        assertEquals(ChangeType.UPDATED, captor.getValue().changeType());
    }

    @Test
    void deleted_carriesSenderFromTombstone() throws IOException {
        MessageContent tombstone = new MessageContent("m1", "19:chat", "19:chat", "u-external", T0, T0,
                "", List.of(), null, false, true);
        when(client.fetchMessage("19:chat", "m1")).thenReturn(tombstone);

        handler.handle(new ChangeNotification("deleted", RESOURCE));

        verify(projector).apply(ChatEvent.deleted("m1", "19:chat", "u-external"));
    }

    @Test
    void deleted_goneUpstream_appliesByIdOnly() throws IOException {
        when(client.fetchMessage("19:chat", "m1")).thenReturn(null);

        handler.handle(new ChangeNotification("deleted", RESOURCE));

        verify(projector).apply(ChatEvent.deleted("m1", "19:chat"));
    }

    @Test
    void systemMessage_isSkipped() throws IOException {
        when(client.fetchMessage("19:chat", "m1")).thenReturn(content(true));

        handler.handle(new ChangeNotification("created", RESOURCE));

        verifyNoInteractions(projector);
    }

    @Test
    void goneUpstream_isInvalid() throws IOException {
        when(client.fetchMessage("19:chat", "m1")).thenReturn(null);

        assertThrows(InvalidEventException.class, () -> handler.handle(new ChangeNotification("created", RESOURCE)));
        verifyNoInteractions(projector);
    }

    @Test
    void unknownChangeType_isInvalid() {
        assertThrows(InvalidEventException.class, () -> handler.handle(new ChangeNotification("missed", RESOURCE)));
    }

    @Test
    void fetchFailure_propagates() throws IOException {
        when(client.fetchMessage("19:chat", "m1")).thenThrow(new IOException("503"));

        assertThrows(IOException.class, () -> handler.handle(new ChangeNotification("updated", RESOURCE)));
    }
}
