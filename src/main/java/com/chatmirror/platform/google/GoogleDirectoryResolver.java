package com.chatmirror.platform.google;

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
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves Chat sender names ({@code users/<id>}) through the Admin SDK Directory API.
 */
public class GoogleDirectoryResolver implements DirectoryResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleDirectoryResolver.class);
    public static final String DEFAULT_BASE_URL = "https://admin.googleapis.com";
    private static final String USER_PREFIX = "users/";

    private final JsonHttpClient http;
    private final String baseUrl;
    private final String customer;

    public GoogleDirectoryResolver(JsonHttpClient http, String baseUrl, String customer) {
        this.http = http;
        this.baseUrl = GoogleChatClient.trimTrailingSlash(baseUrl == null ? DEFAULT_BASE_URL : baseUrl);
        this.customer = customer == null ? "my_customer" : customer;
    }

    @Override
    public String resolveHandle(String senderName) {
        if (senderName == null || senderName.isBlank()) {
            return null;
        }
        String userKey = senderName.startsWith(USER_PREFIX) ? senderName.substring(USER_PREFIX.length()) : senderName;
        try {
            JsonObject user = http.getJson(URI.create(baseUrl + "/admin/directory/v1/users/"
                    + URLEncoder.encode(userKey, StandardCharsets.UTF_8)));
            if (user == null) {
                LOGGER.info("user {} not found in Google directory", userKey);
                return null;
            }
            return handleOf(user.getString("primaryEmail"));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to resolve Google user " + userKey, e);
        }
    }

    @Override
    public DirectoryResolver snapshot() {
        Map<String, String> handles = new HashMap<>();
        String pageToken = null;
        try {
            do {
                StringBuilder url = new StringBuilder(baseUrl).append("/admin/directory/v1/users?maxResults=500&customer=")
                        .append(URLEncoder.encode(customer, StandardCharsets.UTF_8));
                if (pageToken != null) {
                    url.append("&pageToken=").append(URLEncoder.encode(pageToken, StandardCharsets.UTF_8));
                }
                JsonObject page = http.getJson(URI.create(url.toString()));
                if (page == null) {
                    break;
                }
                JsonArray users = page.getJsonArray("users", new JsonArray());
                for (int i = 0; i < users.size(); i++) {
                    JsonObject user = users.getJsonObject(i);
                    String handle = handleOf(user.getString("primaryEmail"));
                    if (handle != null) {
                        handles.put(USER_PREFIX + user.getString("id"), handle);
                    }
                }
                pageToken = page.getString("nextPageToken");
            } while (pageToken != null && !pageToken.isEmpty());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list Google directory users", e);
        }
        LOGGER.info("loaded {} Google directory users into snapshot", handles.size());
        return new DirectorySnapshot(handles);
    }

    static String handleOf(String email) {
        if (email == null || email.indexOf('@') <= 0) {
            return null;
        }
        return email.substring(0, email.indexOf('@'));
    }
}
