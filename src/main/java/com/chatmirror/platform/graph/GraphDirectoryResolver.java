package com.chatmirror.platform.graph;

import com.chatmirror.platform.DirectoryResolver;
import com.chatmirror.platform.DirectorySnapshot;
import com.chatmirror.web.JsonHttpClient;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves Graph user ids to the local part of the user's mail address.
 */
public class GraphDirectoryResolver implements DirectoryResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphDirectoryResolver.class);

    private final JsonHttpClient http;
    private final String baseUrl;

    public GraphDirectoryResolver(JsonHttpClient http, String baseUrl) {
        this.http = http;
        this.baseUrl = GraphChatClient.trimTrailingSlash(baseUrl == null ? GraphChatClient.DEFAULT_BASE_URL : baseUrl);
    }

    @Override
    public String resolveHandle(String userId) {
        if (userId == null || userId.isBlank()) {
            return null;
        }
        try {
            JsonObject user = http.getJson(URI.create(baseUrl + "/users/" + GraphChatClient.encode(userId) + "?$select=id,mail"));
            if (user == null) {
                LOGGER.info("user {} not found in Microsoft Graph", userId);
                return null;
            }
            return handleOf(user.getString("mail"));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to resolve Graph user " + userId, e);
        }
    }

    @Override
    public DirectoryResolver snapshot() {
        Map<String, String> handles = new HashMap<>();
        URI next = URI.create(baseUrl + "/users?$select=id,mail&$top=999");
        try {
            while (next != null) {
                JsonObject page = http.getJson(next);
                if (page == null) {
                    break;
                }
                JsonArray users = page.getJsonArray("value", new JsonArray());
                for (int i = 0; i < users.size(); i++) {
                    JsonObject user = users.getJsonObject(i);
                    String handle = handleOf(user.getString("mail"));
                    if (handle != null) {
                        handles.put(user.getString("id"), handle);
                    }
                }
                String nextLink = page.getString("@odata.nextLink");
                next = nextLink == null ? null : URI.create(nextLink);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list Graph users", e);
        }
        LOGGER.info("loaded {} Graph users into directory snapshot", handles.size());
        return new DirectorySnapshot(handles);
    }

    static String handleOf(String mail) {
        if (mail == null || mail.indexOf('@') <= 0) {
            return null;
        }
        return mail.substring(0, mail.indexOf('@'));
    }
}
