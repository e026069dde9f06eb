package com.chatmirror.platform.google;

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
 * Google Chat spaces through the Chat REST API. Messages are named {@code spaces/S/messages/M},
 * threads {@code spaces/S/threads/T}.
 */
public class GoogleChatClient implements ChatPlatformClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleChatClient.class);
    public static final String DEFAULT_BASE_URL = "https://chat.googleapis.com";
    static final int PAGE_SIZE = 1000;

    private final JsonHttpClient http;
    private final String baseUrl;

    public GoogleChatClient(JsonHttpClient http, String baseUrl) {
        this.http = http;
        this.baseUrl = trimTrailingSlash(baseUrl == null ? DEFAULT_BASE_URL : baseUrl);
    }

    @Override
    public Platform platform() {
        return Platform.GOOGLE;
    }

    @Override
    public MessagePage fetchPage(String spaceId, String continuationToken) throws IOException {
        String space = spaceName(spaceId);
        StringBuilder url = new StringBuilder(baseUrl).append("/v1/").append(space)
                .append("/messages?pageSize=").append(PAGE_SIZE)
                .append("&showDeleted=true");
        if (continuationToken != null) {
            url.append("&pageToken=").append(URLEncoder.encode(continuationToken, StandardCharsets.UTF_8));
        }
        JsonObject body = http.getJson(URI.create(url.toString()));
        if (body == null) {
            LOGGER.warn("space {} not found while paging history", space);
            return null;
        }
        JsonArray raw = body.getJsonArray("messages", new JsonArray());
        List<MessageContent> messages = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            messages.add(toContent(raw.getJsonObject(i)));
        }
        String next = body.getString("nextPageToken");
        return new MessagePage(messages, next == null || next.isEmpty() ? null : next);
    }

    @Override
    public MessageContent fetchMessage(String spaceId, String messageId) throws IOException {
        JsonObject body = http.getJson(URI.create(baseUrl + "/v1/" + spaceName(spaceId) + "/messages/" + messageId));
        return body == null ? null : toContent(body);
    }

    static MessageContent toContent(JsonObject json) {
        String name = json.getString("name", "");
        String[] parts = name.split("/");
        String spaceId = parts.length >= 2 ? parts[1] : null;
        String messageId = parts.length >= 4 ? parts[3] : null;

        JsonObject sender = json.getJsonObject("sender");
        JsonObject thread = json.getJsonObject("thread");

        List<String> attachments = new ArrayList<>();
        JsonArray rawAttachments = json.getJsonArray("attachment", new JsonArray());
        for (int i = 0; i < rawAttachments.size(); i++) {
            JsonObject a = rawAttachments.getJsonObject(i);
            JsonObject drive = a.getJsonObject("driveDataRef");
            if (drive != null && drive.getString("driveFileId") != null) {
                attachments.add(drive.getString("driveFileId"));
            } else if (a.getString("name") != null) {
                attachments.add(a.getString("name"));
            }
        }

        String replyTo = null;
        JsonObject quoted = json.getJsonObject("quotedMessageMetadata");
        if (quoted != null && quoted.getString("name") != null) {
            String quotedName = quoted.getString("name");
            replyTo = quotedName.substring(quotedName.lastIndexOf('/') + 1);
        }

        return new MessageContent(
                messageId,
                spaceId,
                thread != null && thread.getString("name") != null ? thread.getString("name") : "spaces/" + spaceId,
                sender == null ? null : sender.getString("name"),
                Timestamps.parseOrNull(json.getString("createTime"), "createTime", messageId),
                Timestamps.parseOrNull(json.getString("lastUpdateTime"), "lastUpdateTime", messageId),
                json.getString("text", ""),
                attachments,
                replyTo,
                sender != null && "BOT".equals(sender.getString("type")),
                json.getString("deleteTime") != null);
    }

    static String spaceName(String spaceId) {
        return spaceId.startsWith("spaces/") ? spaceId : "spaces/" + spaceId;
    }

    static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
