package com.chatmirror.platform;

import java.util.Map;

/**
 * Immutable sender id to handle map captured from a directory.
 */
public class DirectorySnapshot implements DirectoryResolver {
    private final Map<String, String> handles;

    public DirectorySnapshot(Map<String, String> handles) {
        this.handles = Map.copyOf(handles);
    }

    @Override
    public String resolveHandle(String platformSenderId) {
        return platformSenderId == null ? null : handles.get(platformSenderId);
    }

    @Override
    public DirectoryResolver snapshot() {
        return this;
    }

    public int size() {
        return handles.size();
    }
}
