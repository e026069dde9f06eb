package com.chatmirror.platform.graph;

import com.chatmirror.platform.DirectoryResolver;
import com.chatmirror.platform.MessageContent;
import com.chatmirror.platform.MessagePage;
import com.chatmirror.web.JsonHttpClient;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class GraphChatClientTest {
    private static final String BASE = "https://graph.test/v1.0";

    private static JsonObject graphMessage(String id, String messageType) {
        return new JsonObject()
                .put("id", id)
                .put("chatId", "19:chat")
                .put("messageType", messageType)
                .put("createdDateTime", "2024-03-01T10:00:00.123Z")
                .put("lastModifiedDateTime", "2024-03-01T10:01:00Z")
                .put("from", new JsonObject().put("user", new JsonObject().put("id", "u-alice")))
                .put("body", new JsonObject().put("contentType", "html").put("content", "<p>hi</p>"))
                .put("attachments", new JsonArray()
                        .add(new JsonObject().put("id", "a1").put("contentType", "reference").put("contentUrl", "https://files/a1"))
                        .add(new JsonObject().put("id", "m0").put("contentType", "messageReference")));
    }

    @Test
    void toContent_mapsGraphFields() {
        MessageContent c = GraphChatClient.toContent("19:chat", graphMessage("m1", "message"));

        assertEquals("m1", c.messageId());
        assertEquals("19:chat", c.channelId());
        assertEquals("u-alice", c.senderId());
        assertEquals(Instant.parse("2024-03-01T10:00:00.123Z"), c.createdAt());
        assertEquals(Instant.parse("2024-03-01T10:01:00Z"), c.modifiedAt());
        assertEquals("<p>hi</p>", c.text());
        assertEquals(List.of("https://files/a1"), c.attachments());
        assertEquals("m0", c.replyTo());
        assertFalse(c.system());
        assertFalse(c.deletedUpstream());
    }

    @Test
    void toContent_malformedTimestampBecomesNull() {
        JsonObject json = graphMessage("m3", "message").put("createdDateTime", "not-a-date");
        MessageContent c = GraphChatClient.toContent("19:chat", json);

        assertNull(c.createdAt());
        assertEquals(Instant.parse("2024-03-01T10:01:00Z"), c.modifiedAt());
    }

    @Test
    void toContent_flagsSystemAndDeleted() {
        JsonObject json = graphMessage("m2", "systemEventMessage").put("deletedDateTime", "2024-03-02T00:00:00Z");
        MessageContent c = GraphChatClient.toContent("19:chat", json);

        assertTrue(c.system());
        assertTrue(c.deletedUpstream());
    }

    @Test
    void fetchPage_followsNextLink() throws IOException {
        JsonHttpClient http = mock(JsonHttpClient.class);
        String nextLink = BASE + "/chats/19%3Achat/messages?$skiptoken=abc";
        when(http.getJson(any(URI.class))).thenReturn(
                new JsonObject().put("value", new JsonArray().add(graphMessage("m1", "message"))).put("@odata.nextLink", nextLink),
                new JsonObject().put("value", new JsonArray()));
        GraphChatClient client = new GraphChatClient(http, BASE + "/");

        MessagePage first = client.fetchPage("19:chat", null);
        MessagePage second = client.fetchPage("19:chat", first.nextToken());

        assertEquals(1, first.messages().size());
        assertEquals(nextLink, first.nextToken());
        assertTrue(second.isEmpty());
        assertNull(second.nextToken());
        verify(http).getJson(URI.create(BASE + "/chats/19%3Achat/messages?$top=50&$orderby=createdDateTime%20desc"));
        verify(http).getJson(URI.create(nextLink));
    }

    @Test
    void fetchMessage_notFoundIsNull() throws IOException {
        JsonHttpClient http = mock(JsonHttpClient.class);
        when(http.getJson(any(URI.class))).thenReturn(null);

        assertNull(new GraphChatClient(http, BASE).fetchMessage("19:chat", "m404"));
    }

    @Test
    void directory_resolvesMailLocalPart() throws IOException {
        JsonHttpClient http = mock(JsonHttpClient.class);
        when(http.getJson(URI.create(BASE + "/users/u-alice?$select=id,mail")))
                .thenReturn(new JsonObject().put("id", "u-alice").put("mail", "alice@example.com"));

        assertEquals("alice", new GraphDirectoryResolver(http, BASE).resolveHandle("u-alice"));
    }

    @Test
    void directory_snapshotPagesThroughUsers() throws IOException {
        JsonHttpClient http = mock(JsonHttpClient.class);
        String next = BASE + "/users?$skiptoken=2";
        when(http.getJson(URI.create(BASE + "/users?$select=id,mail&$top=999"))).thenReturn(new JsonObject()
                .put("value", new JsonArray().add(new JsonObject().put("id", "u1").put("mail", "one@example.com")))
                .put("@odata.nextLink", next));
        when(http.getJson(URI.create(next))).thenReturn(new JsonObject()
                .put("value", new JsonArray()
                        .add(new JsonObject().put("id", "u2").put("mail", "two@example.com"))
                        .add(new JsonObject().put("id", "u3"))));

        DirectoryResolver snapshot = new GraphDirectoryResolver(http, BASE).snapshot();

        assertEquals("one", snapshot.resolveHandle("u1"));
        assertEquals("two", snapshot.resolveHandle("u2"));
        assertNull(snapshot.resolveHandle("u3"));
    }

    @Test
    void directory_transportFailureIsUnchecked() throws IOException {
        JsonHttpClient http = mock(JsonHttpClient.class);
        when(http.getJson(any(URI.class))).thenThrow(new IOException("down"));

        assertThrows(UncheckedIOException.class, () -> new GraphDirectoryResolver(http, BASE).resolveHandle("u1"));
    }
}
