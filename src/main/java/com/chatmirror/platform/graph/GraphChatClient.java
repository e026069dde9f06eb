package com.chatmirror.platform.graph;

import com.chatmirror.platform.ChatPlatformClient;
import com.chatmirror.platform.MessageContent;
import com.chatmirror.platform.MessagePage;
import com.chatmirror.platform.Timestamps;
import com.chatmirror.projector.Platform;
import com.chatmirror.web.JsonHttpClient;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Microsoft Teams chats through Microsoft Graph. Continuation tokens are {@code @odata.nextLink} URLs.
 */
public class GraphChatClient implements ChatPlatformClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphChatClient.class);
    public static final String DEFAULT_BASE_URL = "https://graph.microsoft.com/v1.0";
    static final int PAGE_SIZE = 50;

    private final JsonHttpClient http;
    private final String baseUrl;

    public GraphChatClient(JsonHttpClient http, String baseUrl) {
        this.http = http;
        this.baseUrl = trimTrailingSlash(baseUrl == null ? DEFAULT_BASE_URL : baseUrl);
    }

    @Override
    public Platform platform() {
        return Platform.MICROSOFT;
    }

    @Override
    public MessagePage fetchPage(String chatId, String continuationToken) throws IOException {
        URI uri = continuationToken != null
                ? URI.create(continuationToken)
                : URI.create(baseUrl + "/chats/" + encode(chatId) + "/messages?$top=" + PAGE_SIZE
                        + "&$orderby=" + encode("createdDateTime desc"));
        JsonObject body = http.getJson(uri);
        if (body == null) {
            LOGGER.warn("chat {} not found while paging history", chatId);
            return null;
        }
        JsonArray value = body.getJsonArray("value", new JsonArray());
        List<MessageContent> messages = new ArrayList<>(value.size());
        for (int i = 0; i < value.size(); i++) {
            messages.add(toContent(chatId, value.getJsonObject(i)));
        }
        return new MessagePage(messages, body.getString("@odata.nextLink"));
    }

    @Override
    public MessageContent fetchMessage(String chatId, String messageId) throws IOException {
        JsonObject body = http.getJson(URI.create(baseUrl + "/chats/" + encode(chatId) + "/messages/" + encode(messageId)));
        return body == null ? null : toContent(chatId, body);
    }

    static MessageContent toContent(String chatId, JsonObject json) {
        String messageId = json.getString("id");
        JsonObject from = json.getJsonObject("from");
        JsonObject user = from == null ? null : from.getJsonObject("user");
        JsonObject body = json.getJsonObject("body");

        List<String> attachments = new ArrayList<>();
        String replyTo = null;
        JsonArray rawAttachments = json.getJsonArray("attachments", new JsonArray());
        for (int i = 0; i < rawAttachments.size(); i++) {
            JsonObject a = rawAttachments.getJsonObject(i);
            String contentType = a.getString("contentType");
            if ("reference".equals(contentType)) {
                attachments.add(a.getString("contentUrl"));
            } else if ("messageReference".equals(contentType)) {
                replyTo = a.getString("id");
            } else {
                LOGGER.debug("skipped attachment {} of type {} on message {}", a.getString("id"), contentType, messageId);
            }
        }

        String channelId = json.getString("chatId", chatId);
        return new MessageContent(
                messageId,
                channelId,
                channelId,
                user == null ? null : user.getString("id"),
                Timestamps.parseOrNull(json.getString("createdDateTime"), "createdDateTime", messageId),
                Timestamps.parseOrNull(json.getString("lastModifiedDateTime"), "lastModifiedDateTime", messageId),
                body == null ? "" : body.getString("content", ""),
                attachments,
                replyTo,
                !"message".equals(json.getString("messageType", "message")),
                json.getString("deletedDateTime") != null);
    }

    static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
